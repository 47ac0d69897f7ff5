package common.exception;

/**
 * 业务异常基类：参数校验、前置条件、资源占用等可预期错误
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
