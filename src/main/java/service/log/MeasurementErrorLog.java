package service.log;

import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 测量错误日志服务
 * 记录扫描失败、采集与处理异常、拟合不收敛等，供控制接口查询
 */
@Component
public class MeasurementErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录错误
     * @param recoverable 流水线或扫描是否继续运行
     */
    public synchronized void record(ErrorType errorType, String source, String message,
                                    Throwable cause, boolean recoverable) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(errorType);
        entry.setSource(source);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setRecoverable(recoverable);
        entry.setTimestamp(System.currentTimeMillis());

        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定时间之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceTimestamp) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getTimestamp() >= sinceTimestamp) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    /**
     * 错误类型
     */
    public enum ErrorType {
        REQUEST_REJECTED,    // 控制请求被拒绝（参数、前置条件、硬件占用）
        MEASUREMENT_FAILED,  // 扫描以 failed 结束
        ACQUISITION_FAILED,  // 采集卡异常
        PROJECTION_FAILED,   // 单帧投影失败
        FIT_NOT_CONVERGED,   // 拟合不收敛
        FIT_FAILED           // 拟合或结果通知抛出其他异常
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private ErrorType errorType;
        private String source;
        private String message;
        private String cause;
        private boolean recoverable;
        private long timestamp;
    }
}
