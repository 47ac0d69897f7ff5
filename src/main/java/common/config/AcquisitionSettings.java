package common.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 快速扫描配置的不可变快照
 * 运行中只能通过 with* 方法生成新快照并在定义好的重载点替换
 */
@Getter
@ToString
@AllArgsConstructor
public final class AcquisitionSettings {
    private final int sampleCount;
    private final double shakerPositionStep;
    private final double shakerPsPerStep;
    private final int shakerGain;
    private final boolean darkControl;
    private final int processorCount;
    private final int averageCount;
    private final int queueCapacity;
    private final long tickIntervalMs;
    private final boolean autocorrelationFit;
    private final boolean orderedAggregation;
    private final double expectedPulseDuration;
    private final int calibrationIterations;
    private final int calibrationIntegration;

    public AcquisitionSettings withSampleCount(int value) {
        return new AcquisitionSettings(value, shakerPositionStep, shakerPsPerStep, shakerGain, darkControl,
                processorCount, averageCount, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withShakerGain(int value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, value, darkControl,
                processorCount, averageCount, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withAverageCount(int value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, shakerGain, darkControl,
                processorCount, value, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withDarkControl(boolean value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, shakerGain, value,
                processorCount, averageCount, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withAutocorrelationFit(boolean value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, shakerGain, darkControl,
                processorCount, averageCount, queueCapacity, tickIntervalMs, value, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withProcessorCount(int value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, shakerGain, darkControl,
                value, averageCount, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    public AcquisitionSettings withShakerPsPerStep(double value) {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, value, shakerGain, darkControl,
                processorCount, averageCount, queueCapacity, tickIntervalMs, autocorrelationFit, orderedAggregation,
                expectedPulseDuration, calibrationIterations, calibrationIntegration);
    }

    /**
     * 保存到输出文件 settings 区的键值
     */
    public Map<String, Object> toSettingsMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("n_samples", sampleCount);
        map.put("shaker_position_step", shakerPositionStep);
        map.put("shaker_ps_per_step", shakerPsPerStep);
        map.put("shaker_gain", shakerGain);
        map.put("dark_control", darkControl);
        map.put("n_processors", processorCount);
        map.put("n_averages", averageCount);
        map.put("autocorrelation_fit", autocorrelationFit);
        map.put("ordered_aggregation", orderedAggregation);
        return map;
    }
}
