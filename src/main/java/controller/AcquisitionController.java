package controller;

import common.Result;
import common.config.AcquisitionSettings;
import lombok.extern.slf4j.Slf4j;
import model.bo.CalibrationResult;
import model.bo.ProcessedCurve;
import model.dto.request.AcquisitionSettingsReq;
import model.dto.request.CalibrationReq;
import model.dto.request.SaveDataReq;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.acquisition.AcquisitionCoordinator;
import service.calibration.ShakerCalibrationService;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 快速扫描（流式采集）控制接口
 */
@Slf4j
@RestController
@RequestMapping("/acquisition")
public class AcquisitionController {

    private final AcquisitionCoordinator acquisition;
    private final ShakerCalibrationService calibration;

    public AcquisitionController(AcquisitionCoordinator acquisition, ShakerCalibrationService calibration) {
        this.acquisition = acquisition;
        this.calibration = calibration;
    }

    //  生命周期

    @PostMapping("/start")
    public Result start() {
        acquisition.startStreamer();
        return Result.success("采集已启动", acquisition.getStatus());
    }

    /**
     * 停止是延迟的，/status 中 running 变为 false 表示已完全停止
     */
    @PostMapping("/stop")
    public Result stop() {
        acquisition.stopStreamer();
        return Result.success("已请求停止", acquisition.getStatus());
    }

    @GetMapping("/status")
    public Result status() {
        return Result.success("查询成功", acquisition.getStatus());
    }

    //  数据

    @PostMapping("/reset")
    public Result reset() {
        acquisition.resetData();
        return Result.success();
    }

    @PostMapping("/save")
    public Result save(@RequestBody SaveDataReq req) {
        Path target = acquisition.saveData(req.getName(), req.getDir());
        return Result.success("保存成功", target.toString());
    }

    @GetMapping("/average")
    public Result average() {
        Map<String, Object> data = new LinkedHashMap<>();
        ProcessedCurve average = acquisition.getAverage();
        if (average != null) {
            data.put("sequence", average.getSequence());
            data.put("time", average.times());
            data.put("values", average.getValues());
        }
        data.put("fit", acquisition.getLastFit());
        return Result.success("查询成功", data);
    }

    //  设置

    @GetMapping("/settings")
    public Result getSettings() {
        return Result.success(acquisition.getSettings().toSettingsMap());
    }

    /**
     * 全部字段校验通过后一次性生效
     */
    @PostMapping("/settings")
    public Result updateSettings(@RequestBody AcquisitionSettingsReq req) {
        AcquisitionSettings next = acquisition.getSettings();
        if (req.getAverageCount() != null) {
            next = next.withAverageCount(req.getAverageCount());
        }
        if (req.getDarkControl() != null) {
            next = next.withDarkControl(req.getDarkControl());
        }
        if (req.getAutocorrelationFit() != null) {
            next = next.withAutocorrelationFit(req.getAutocorrelationFit());
        }
        if (req.getProcessorCount() != null) {
            next = next.withProcessorCount(req.getProcessorCount());
        }
        if (req.getShakerGain() != null) {
            next = next.withShakerGain(req.getShakerGain());
        }
        if (req.getSampleCount() != null) {
            next = next.withSampleCount(req.getSampleCount());
        }
        acquisition.reloadSettings(next);
        return Result.success(acquisition.getSettings().toSettingsMap());
    }

    //  位移台

    @GetMapping("/stage")
    public Result stagePosition() {
        OptionalDouble position = acquisition.getStagePosition();
        return Result.success(position.isPresent() ? position.getAsDouble() : null);
    }

    @PostMapping("/stage")
    public Result moveStage(@RequestParam double position) {
        acquisition.moveStage(position);
        return Result.success();
    }

    //  标定

    @PostMapping("/calibrate")
    public Result calibrate(@RequestBody(required = false) CalibrationReq req) {
        AcquisitionSettings s = acquisition.getSettings();
        int iterations = req != null && req.getIterations() != null
                ? req.getIterations() : s.getCalibrationIterations();
        int integration = req != null && req.getIntegration() != null
                ? req.getIntegration() : s.getCalibrationIntegration();
        CalibrationResult result = calibration.calibrate(iterations, integration);
        return Result.success("标定完成", result);
    }

    @PostMapping("/calibration/apply")
    public Result applyCalibration(@RequestParam(name = "timePerStep", required = false) Double timePerStep) {
        double applied = calibration.apply(timePerStep);
        return Result.success("标定已应用", applied);
    }
}
