package service.experiment;

import common.config.ExperimentProperties;
import common.consts.ErrorCodes;
import common.consts.InstrumentRoleEnum;
import common.consts.ScanTypeEnum;
import common.exception.ValidationException;
import common.util.MathUtil;
import engine.StepScanSettings;
import engine.StepScanWorker;
import engine.SweepPlan;
import engine.SweepWorker;
import lombok.extern.slf4j.Slf4j;
import model.entity.ChannelReader;
import model.entity.Instrument;
import model.entity.MovableStage;
import service.HardwareAccessLock;
import service.log.MeasurementErrorLog;
import service.log.MeasurementEventLog;
import service.sink.OutputSink;
import service.sink.OutputSinkFactory;

import java.util.List;
import java.util.Map;

/**
 * 步进延迟扫描：需要一个延迟位移台与一台锁相放大器
 */
@Slf4j
public class StepScanCoordinator extends ExperimentCoordinator {

    public static final List<String> DEFAULT_CHANNELS = List.of("X", "Y");

    private volatile int averages;
    private volatile List<Double> stagePositions;
    private volatile double timeZero;

    public StepScanCoordinator(ExperimentProperties properties, HardwareAccessLock hardwareLock,
                               OutputSinkFactory sinkFactory, MeasurementEventLog eventLog,
                               MeasurementErrorLog errorLog) {
        super(hardwareLock, sinkFactory, eventLog, errorLog, properties.getPaths().getDataDir());
        ExperimentProperties.StepScan defaults = properties.getStepScan();
        updateSettings(defaults.getAverages(), defaults.getStagePositions(), defaults.getTimeZero());
    }

    @Override
    protected ScanTypeEnum scanType() {
        return ScanTypeEnum.STEP_SCAN;
    }

    @Override
    protected List<InstrumentRoleEnum> requiredRoles() {
        return List.of(InstrumentRoleEnum.DELAY_STAGE, InstrumentRoleEnum.LOCK_IN);
    }

    @Override
    protected SweepWorker createWorker(SweepPlan plan, Map<InstrumentRoleEnum, Instrument> roles, OutputSink sink) {
        return new StepScanWorker(plan,
                (MovableStage) roles.get(InstrumentRoleEnum.DELAY_STAGE),
                (ChannelReader) roles.get(InstrumentRoleEnum.LOCK_IN),
                sink, currentSettings());
    }

    @Override
    protected Map<String, Object> measurementSettings() {
        return currentSettings().toSettingsMap();
    }

    public synchronized StepScanSettings currentSettings() {
        return new StepScanSettings(averages, stagePositions, timeZero, DEFAULT_CHANNELS);
    }

    /**
     * 批量修改设置，null 表示保持不变；先全部校验再一起生效
     */
    public synchronized void updateSettings(Integer averages, List<Double> stagePositions, Double timeZero) {
        if (averages != null) {
            checkAverages(averages);
        }
        if (stagePositions != null) {
            checkStagePositions(stagePositions);
        }
        if (timeZero != null) {
            checkTimeZero(timeZero);
        }
        if (averages != null) {
            this.averages = averages;
        }
        if (stagePositions != null) {
            this.stagePositions = List.copyOf(stagePositions);
        }
        if (timeZero != null) {
            this.timeZero = timeZero;
        }
        log.debug("步进扫描设置: {}", currentSettings());
    }

    public void setAverages(int averages) {
        updateSettings(averages, null, null);
    }

    public void setStagePositions(List<Double> stagePositions) {
        updateSettings(null, stagePositions, null);
    }

    public void setTimeZero(double timeZero) {
        updateSettings(null, null, timeZero);
    }

    public int getAverages() {
        return averages;
    }

    public List<Double> getStagePositions() {
        return stagePositions;
    }

    public double getTimeZero() {
        return timeZero;
    }

    private static void checkAverages(int averages) {
        if (averages <= 0) {
            throw new ValidationException(ErrorCodes.AVERAGES_INVALID + ": " + averages);
        }
    }

    private static void checkStagePositions(List<Double> positions) {
        if (positions.isEmpty()) {
            throw new ValidationException(ErrorCodes.STAGE_POSITIONS_EMPTY);
        }
        if (!MathUtil.allFinite(positions)) {
            throw new ValidationException(ErrorCodes.VALUES_NOT_FINITE);
        }
        if (!MathUtil.isStrictlyIncreasing(positions)) {
            throw new ValidationException(ErrorCodes.STAGE_POSITIONS_NOT_INCREASING);
        }
    }

    private static void checkTimeZero(double timeZero) {
        if (!Double.isFinite(timeZero)) {
            throw new ValidationException(ErrorCodes.TIME_ZERO_INVALID + ": " + timeZero);
        }
    }
}
