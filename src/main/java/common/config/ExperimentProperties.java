package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 实验管理配置：数据目录与步进扫描默认值
 *
 * femtoscan.paths.data-dir
 * femtoscan.step-scan.averages
 * femtoscan.step-scan.time-zero
 * femtoscan.step-scan.stage-positions
 */
@Configuration
@ConfigurationProperties(prefix = "femtoscan")
@Data
public class ExperimentProperties {

    private Paths paths = new Paths();

    private StepScan stepScan = new StepScan();

    @Data
    public static class Paths {
        /**
         * 测量文件默认目录
         */
        private String dataDir = "data";
    }

    @Data
    public static class StepScan {
        private int averages = 2;
        private double timeZero = -0.5;
        private List<Double> stagePositions = new ArrayList<>(List.of(-1.0, 0.0, 1.0, 2.0, 3.0));
    }
}
