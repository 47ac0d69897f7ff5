package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 模拟采集参数，femtoscan.simulation
 * 仅在 femtoscan.fast-scan.simulate=true 时使用
 */
@Configuration
@ConfigurationProperties(prefix = "femtoscan.simulation")
@Data
public class SimulationProperties {

    private double amplitude = 1.0;

    /**
     * 位移台零位时脉冲中心对应的延迟 (ps)
     */
    private double centerPosition = -1.0;

    /**
     * 自相关脉冲半高宽 (ps)
     */
    private double fwhm = 0.5;

    private double offset = 1.0;

    /**
     * 振镜振幅（步）
     */
    private double shakerAmplitude = 100;

    /**
     * 一个振镜周期包含的采样数
     */
    private int samplesPerPeriod = 1000;

    /**
     * 位移台单位位移对应的延迟 (ps)
     */
    private double psPerPosition = 1.0;

    /**
     * 信号高斯噪声标准差
     */
    private double noise = 0.0;

    /**
     * 模拟生成一帧的耗时 (ms)，用来模仿硬件帧率
     */
    private long frameIntervalMs = 20;
}
