package model.dto.request;

import lombok.Data;

/**
 * 快速扫描设置，空字段保持不变
 */
@Data
public class AcquisitionSettingsReq {
    private Integer averageCount;
    private Boolean darkControl;
    private Boolean autocorrelationFit;
    private Integer processorCount;
    private Integer shakerGain;
    private Integer sampleCount;
}
