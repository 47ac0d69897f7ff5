package service.calibration;

import common.config.AcquisitionSettings;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.exception.RequirementException;
import common.exception.ResourceBusyException;
import common.exception.ValidationException;
import engine.stream.AutocorrelationFitter;
import engine.stream.FrameProjector;
import lombok.extern.slf4j.Slf4j;
import model.bo.CalibrationResult;
import model.bo.FitResult;
import model.bo.ProcessedCurve;
import model.bo.StreamFrame;
import model.entity.MovableStage;
import service.HardwareAccessLock;
import service.acquisition.AcquisitionCoordinator;

/**
 * 振镜位置 -> 时间 标定
 * 移动延迟位移台到一组位置，在每个位置单次采集并拟合脉冲中心（单位：振镜步），
 * 由 位置-中心 关系得到每步对应的延迟
 */
@Slf4j
public class ShakerCalibrationService {

    private static final int MIN_ITERATIONS = 4;

    private final AcquisitionCoordinator acquisition;
    private final HardwareAccessLock hardwareLock;
    private final AutocorrelationFitter fitter;

    private volatile CalibrationResult lastResult;

    public ShakerCalibrationService(AcquisitionCoordinator acquisition, HardwareAccessLock hardwareLock,
                                    AutocorrelationFitter fitter) {
        this.acquisition = acquisition;
        this.hardwareLock = hardwareLock;
        this.fitter = fitter;
    }

    /**
     * 使用配置中的迭代次数与积分帧数
     */
    public CalibrationResult calibrate() {
        AcquisitionSettings s = acquisition.getSettings();
        return calibrate(s.getCalibrationIterations(), s.getCalibrationIntegration());
    }

    public CalibrationResult calibrate(int iterations, int integration) {
        if (iterations < MIN_ITERATIONS) {
            throw new ValidationException(ErrorCodes.CALIBRATION_ITERATIONS_INVALID + ": " + iterations);
        }
        if (acquisition.isStreamerRunning()) {
            throw new ResourceBusyException(ErrorCodes.STREAMER_RUNNING, HardwareAccessLock.STREAMING);
        }
        MovableStage stage = acquisition.getDelayStage();
        if (stage == null) {
            throw new RequirementException(ErrorCodes.INSTRUMENT_NOT_FOUND + ": delay_stage");
        }

        hardwareLock.acquire(HardwareAccessLock.CALIBRATION);
        try {
            AcquisitionSettings s = acquisition.getSettings();
            StreamFrame coarseShot = acquisition.measureSingleShot(integration);
            ProcessedCurve coarse = FrameProjector.project(coarseShot, s.isDarkControl(),
                    s.getShakerPositionStep(), s.getShakerPsPerStep()).dropMissing();
            if (coarse.isEmpty()) {
                throw new BusinessException("粗扫描没有有效数据，无法确定标定范围");
            }
            double[] positions = CalibrationMath.probePositions(coarse.minTime(), coarse.maxTime(), iterations);
            log.info("振镜标定开始: {} 个位置, 范围 [{}, {}]", positions.length,
                    positions.length > 0 ? positions[0] : Double.NaN,
                    positions.length > 0 ? positions[positions.length / 2 - 1] : Double.NaN);

            // 时间轴单位为步，预期脉宽换算成步
            double expectedFwhmSteps = s.getExpectedPulseDuration() / s.getShakerPsPerStep();
            double[] centers = new double[positions.length];
            for (int i = 0; i < positions.length; i++) {
                stage.moveAbsolute(positions[i]);
                StreamFrame shot = acquisition.measureSingleShot(integration);
                ProcessedCurve curve = FrameProjector.project(shot, s.isDarkControl(),
                        s.getShakerPositionStep(), 1.0);
                FitResult fit = fitter.fit(curve, expectedFwhmSteps);
                centers[i] = fit.getCenter();
                log.debug("标定点 {}: 位置 {} -> 中心 {} 步", i, positions[i], centers[i]);
            }

            CalibrationResult result = CalibrationMath.compute(positions, centers);
            log.info("振镜标定结果: 差分 {} / 去离群 {}，直线拟合 {} ps/步",
                    1.0 / result.getMeanPairwiseSlope(), result.robustPositionPerStep(), result.getFittedSlope());
            lastResult = result;
            return result;
        } finally {
            hardwareLock.release(HardwareAccessLock.CALIBRATION);
        }
    }

    /**
     * 写入新的时间标定
     * @param timePerStep 为 null 时采用上一次标定的直线拟合斜率
     * @return 实际写入的值
     */
    public double apply(Double timePerStep) {
        double value;
        if (timePerStep != null) {
            value = timePerStep;
        } else {
            CalibrationResult result = lastResult;
            if (result == null) {
                throw new BusinessException(ErrorCodes.NO_CALIBRATION_RESULT);
            }
            value = result.getFittedSlope();
        }
        acquisition.applyTimePerStep(value);
        log.info("时间标定已更新为 {} ps/步", value);
        return value;
    }

    public CalibrationResult getLastResult() {
        return lastResult;
    }
}
