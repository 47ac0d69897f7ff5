package controller;

import common.Result;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.CreateFileReq;
import model.dto.request.ParameterIterationReq;
import model.dto.request.StepScanSettingsReq;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.experiment.StepScanCoordinator;
import service.log.MeasurementEventLog;
import service.sink.OutputSink;

import java.util.List;
import java.util.Map;

/**
 * 参数扫描控制接口
 */
@Slf4j
@RestController
@RequestMapping("/experiment")
public class ExperimentController {

    private final StepScanCoordinator coordinator;
    private final MeasurementEventLog eventLog;

    public ExperimentController(StepScanCoordinator coordinator, MeasurementEventLog eventLog) {
        this.coordinator = coordinator;
        this.eventLog = eventLog;
    }

    //  仪器

    @GetMapping("/instruments")
    public Result listInstruments() {
        return Result.success("查询成功", coordinator.describeSetup());
    }

    @PostMapping("/instruments/connect")
    public Result connect(@RequestParam(name = "names", required = false) List<String> names) {
        coordinator.connectAll(toArray(names));
        return Result.success(coordinator.describeSetup());
    }

    @PostMapping("/instruments/disconnect")
    public Result disconnect(@RequestParam(name = "names", required = false) List<String> names) {
        coordinator.disconnectAll(toArray(names));
        return Result.success(coordinator.describeSetup());
    }

    private static String[] toArray(List<String> names) {
        return names == null ? new String[0] : names.toArray(new String[0]);
    }

    //  扫描计划

    @PostMapping("/iterations")
    public Result addIteration(@RequestBody ParameterIterationReq req) {
        coordinator.addParameterIteration(req.getName(), req.getUnit(), req.getInstrument(),
                req.getMethod(), req.getValues());
        return Result.success("添加成功", coordinator.currentPlan().getDimensions().toString());
    }

    @DeleteMapping("/iterations")
    public Result clearIterations() {
        coordinator.clearParameterIterations();
        return Result.success();
    }

    @GetMapping("/settings")
    public Result getSettings() {
        return Result.success(coordinator.currentSettings().toSettingsMap());
    }

    @PostMapping("/settings")
    public Result updateSettings(@RequestBody StepScanSettingsReq req) {
        coordinator.updateSettings(req.getAverages(), req.getStagePositions(), req.getTimeZero());
        return Result.success(coordinator.currentSettings().toSettingsMap());
    }

    //  输出文件与执行

    @PostMapping("/file")
    public Result createFile(@RequestBody CreateFileReq req) {
        OutputSink sink = coordinator.createFile(req.getName(), req.getDir(), req.isReplace());
        return Result.success("创建成功", sink.getPath().toString());
    }

    /**
     * 异步启动，通过 /status 与 /events 跟踪
     */
    @PostMapping("/start")
    public Result start() {
        coordinator.launchMeasurement();
        return Result.success("测量已启动", coordinator.getStatus());
    }

    @PostMapping("/stop")
    public Result stop() {
        coordinator.stopMeasurement();
        return Result.success("已请求停止", null);
    }

    @PostMapping("/kill")
    public Result kill() {
        coordinator.killMeasurement();
        return Result.success("已强制停止", null);
    }

    @GetMapping("/status")
    public Result status() {
        Map<String, Object> status = coordinator.getStatus();
        return Result.success("查询成功", status);
    }

    @GetMapping("/events")
    public Result events(@RequestParam(name = "since", defaultValue = "0") long sinceSequence) {
        List<EventLogEntryDto> entries = eventLog.listSince(sinceSequence);
        return Result.success("查询成功", entries);
    }
}
