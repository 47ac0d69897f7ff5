package model.dto.request;

import lombok.Data;

@Data
public class CalibrationReq {
    private Integer iterations;  // 空则使用 femtoscan.fast-scan.calibration-iterations
    private Integer integration; // 空则使用 femtoscan.fast-scan.calibration-integration
}
