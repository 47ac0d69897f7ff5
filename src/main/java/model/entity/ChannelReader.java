package model.entity;

import java.util.List;
import java.util.Map;

/**
 * 可读取多个测量通道的仪器（锁相放大器一类）
 */
public interface ChannelReader extends Instrument {

    /**
     * 读取指定通道，返回 通道名 -> 测量值
     */
    Map<String, Double> measure(List<String> channels);
}
