package model.bo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 振镜标定结果
 * pairwise* 为相邻点差分斜率 |Δcenter|/|Δposition|（步 / 位置单位）
 * fitted* 为两轮剔除后 position = slope * center + intercept 的最小二乘结果（位置单位 / 步）
 */
@Getter
@ToString
@AllArgsConstructor
public final class CalibrationResult {
    private final List<CalibrationPoint> points;
    private final double meanPairwiseSlope;
    private final double robustPairwiseSlope;
    private final int rejectedSlopeCount;
    private final double firstPassSlope;
    private final double fittedSlope;
    private final double fittedIntercept;
    private final List<Integer> rejectedPointIndices;

    /**
     * 差分斜率换算成与 fittedSlope 相同的量纲
     */
    public double robustPositionPerStep() {
        return 1.0 / robustPairwiseSlope;
    }
}
