package service.acquisition;

import model.bo.FitResult;
import model.bo.ProcessedCurve;
import model.bo.StreamFrame;

/**
 * 流式采集通知，回调在采集 / 处理线程上执行，实现方不要阻塞
 */
public interface AcquisitionListener {

    default void onStreamerData(StreamFrame frame) {
    }

    default void onProcessedCurve(ProcessedCurve curve) {
    }

    default void onNewAverage(ProcessedCurve average) {
    }

    default void onFitResult(FitResult fit) {
    }

    /**
     * @param recoverable 为 true 时流水线继续运行
     */
    default void onError(Exception error, boolean recoverable) {
    }

    default void onAcquisitionStopped() {
    }
}
