package common.exception;

/**
 * 非线性拟合未收敛。属于可恢复错误，不影响流水线继续运行
 */
public class FitNotConvergedException extends BusinessException {

    public FitNotConvergedException(String message, Throwable cause) {
        super(message, cause);
    }
}
