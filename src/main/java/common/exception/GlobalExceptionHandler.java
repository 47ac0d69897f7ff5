package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.log.MeasurementErrorLog;

/**
 * 全局异常处理器
 * 捕获控制接口抛出的异常，记录日志并转成统一响应
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String SOURCE = "controller";

    private final MeasurementErrorLog errorLog;

    public GlobalExceptionHandler(MeasurementErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 硬件被其他测量链路占用
     */
    @ExceptionHandler(ResourceBusyException.class)
    public Result handleBusy(ResourceBusyException e) {
        log.warn("硬件占用: {} (持有者 {})", e.getMessage(), e.getHolder());
        errorLog.record(MeasurementErrorLog.ErrorType.REQUEST_REJECTED, SOURCE, e.getMessage(), null, true);
        return Result.busy(e.getMessage());
    }

    /**
     * 参数错误、前置条件不满足、文件名冲突
     */
    @ExceptionHandler({ValidationException.class, RequirementException.class, NameCollisionException.class})
    public Result handleBadRequest(BusinessException e) {
        log.warn("请求被拒绝: {}", e.getMessage());
        errorLog.record(MeasurementErrorLog.ErrorType.REQUEST_REJECTED, SOURCE, e.getMessage(), null, true);
        return Result.error(Result.BAD_REQUEST, e.getMessage());
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        errorLog.record(MeasurementErrorLog.ErrorType.REQUEST_REJECTED, SOURCE,
                "业务异常: " + e.getMessage(), e.getCause(), true);
        return Result.error(e.getMessage());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        errorLog.record(MeasurementErrorLog.ErrorType.REQUEST_REJECTED, SOURCE,
                "系统异常: " + e.getClass().getSimpleName(), e, false);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
