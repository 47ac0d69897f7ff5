package model.bo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 标定采样点：位移台位置与拟合得到的脉冲中心（单位：振镜步）
 */
@Getter
@ToString
@AllArgsConstructor
public final class CalibrationPoint {
    private final double stagePosition;
    private final double center;
}
