package common.exception;

/**
 * 扫描工作线程以 failed 状态结束
 */
public class MeasurementFailedException extends BusinessException {

    public MeasurementFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
