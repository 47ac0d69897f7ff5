package common.exception;

/**
 * 配置或参数格式错误，调用时立即抛出，不修改任何状态
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(message);
    }
}
