package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 快速扫描（流式采集）配置
 * 对应配置前缀 femtoscan.fast-scan，组件只在构造或显式重载时通过 {@link #snapshot()} 读取一次
 */
@Configuration
@ConfigurationProperties(prefix = "femtoscan.fast-scan")
@Data
public class FastScanProperties {

    /**
     * 使用模拟采集卡与模拟位移台
     */
    private boolean simulate = true;

    /**
     * 单帧采样数
     */
    private int sampleCount = 18000;

    /**
     * 振镜位置量化步长（原始位置单位 / 步）
     */
    private double shakerPositionStep = 0.000152587890625;

    /**
     * 每步对应的时间延迟 (ps)，由振镜标定得到
     */
    private double shakerPsPerStep = 0.05;

    private int shakerGain = 1;

    /**
     * 暗场控制：按暗场通道区分泵浦开/关样本并相减
     */
    private boolean darkControl = true;

    /**
     * 处理线程池大小，必须小于 CPU 核数
     */
    private int processorCount = 1;

    /**
     * 滑动平均窗口
     */
    private int averageCount = 50;

    /**
     * 采集帧有界队列容量
     */
    private int queueCapacity = 64;

    /**
     * 生命周期定时检查间隔 (ms)
     */
    private long tickIntervalMs = 50;

    /**
     * 每次更新平均后是否做自相关拟合
     */
    private boolean autocorrelationFit = false;

    /**
     * 按采集序号重排后再做平均
     */
    private boolean orderedAggregation = true;

    /**
     * 拟合初值：预期脉宽 (ps)
     */
    private double expectedPulseDuration = 0.1;

    private int calibrationIterations = 20;

    private int calibrationIntegration = 1;

    public AcquisitionSettings snapshot() {
        return new AcquisitionSettings(sampleCount, shakerPositionStep, shakerPsPerStep, shakerGain,
                darkControl, processorCount, averageCount, queueCapacity, tickIntervalMs,
                autocorrelationFit, orderedAggregation, expectedPulseDuration,
                calibrationIterations, calibrationIntegration);
    }
}
