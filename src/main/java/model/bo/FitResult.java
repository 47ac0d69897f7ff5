package model.bo;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * sech² 自相关峰拟合结果
 */
@Getter
@ToString
@AllArgsConstructor
public final class FitResult {
    private final double amplitude;
    private final double center;
    private final double fwhm;
    private final double offset;
    private final double rms;      // 残差均方根
    private final int iterations;
}
