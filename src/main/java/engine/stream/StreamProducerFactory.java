package engine.stream;

import common.config.AcquisitionSettings;
import model.bo.StreamFrame;

import java.util.function.Consumer;

/**
 * 每次启动采集都新建一个生产者，绑定当前配置快照
 */
public interface StreamProducerFactory {

    StreamProducer create(AcquisitionSettings settings, Consumer<StreamFrame> onFrame, Consumer<Exception> onError);
}
