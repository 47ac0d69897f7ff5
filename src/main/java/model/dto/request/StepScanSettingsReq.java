package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 步进扫描设置，空字段保持不变
 */
@Data
public class StepScanSettingsReq {
    private Integer averages;
    private List<Double> stagePositions;
    private Double timeZero;
}
