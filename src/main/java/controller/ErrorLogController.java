package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.log.MeasurementErrorLog;

import java.util.List;

/**
 * 错误日志查询接口
 */
@RestController
@RequestMapping("/errors")
public class ErrorLogController {

    private final MeasurementErrorLog errorLog;

    public ErrorLogController(MeasurementErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 查询指定时间戳之后的错误日志
     */
    @GetMapping
    public Result listErrors(@RequestParam(name = "since", defaultValue = "0") long sinceTimestamp) {
        List<MeasurementErrorLog.ErrorLogEntry> entries = errorLog.listSince(sinceTimestamp);
        return Result.success("查询成功", entries);
    }

    @GetMapping("/all")
    public Result listAllErrors() {
        return Result.success("查询成功", errorLog.listAll());
    }
}
