package service.calibration;

import common.util.MathUtil;
import model.bo.CalibrationPoint;
import model.bo.CalibrationResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.List;

/**
 * 振镜标定的纯计算部分
 */
public final class CalibrationMath {

    static final double PROBE_RANGE = 0.7;
    static final double SLOPE_REJECT_SIGMA = 2.0;
    static final double RESIDUAL_REJECT_SIGMA = 1.2;
    // 低于此值的离散度视为 0，浮点舍入不触发剔除
    static final double ZERO_SPREAD = 1e-9;

    private CalibrationMath() {}

    /**
     * linspace(0.7·tmin, 0.7·tmax, iterations/2) 后接其逆序，往返各走一遍
     */
    public static double[] probePositions(double tmin, double tmax, int iterations) {
        double[] half = MathUtil.linspace(PROBE_RANGE * tmin, PROBE_RANGE * tmax, iterations / 2);
        double[] result = new double[half.length * 2];
        for (int i = 0; i < half.length; i++) {
            result[i] = half[i];
            result[result.length - 1 - i] = half[i];
        }
        return result;
    }

    /**
     * 相邻点斜率 |Δcenter| / |Δposition|，位置相同的相邻点跳过
     */
    public static double[] pairwiseSlopes(double[] positions, double[] centers) {
        List<Double> slopes = new ArrayList<>();
        for (int i = 0; i < positions.length - 1; i++) {
            double dx = FastMath.abs(positions[i] - positions[i + 1]);
            if (dx != 0) {
                slopes.add(FastMath.abs(centers[i] - centers[i + 1]) / dx);
            }
        }
        return MathUtil.toArray(slopes);
    }

    /**
     * 丢弃偏离均值 sigmas·σ 及以上的值；σ 为 0 时全部保留
     */
    public static double[] rejectOutliers(double[] values, double sigmas) {
        if (values.length == 0) {
            return values;
        }
        double mean = MathUtil.mean(values);
        double std = MathUtil.populationStd(values);
        if (std < ZERO_SPREAD) {
            return values.clone();
        }
        List<Double> kept = new ArrayList<>();
        for (double v : values) {
            if (FastMath.abs(v - mean) < sigmas * std) {
                kept.add(v);
            }
        }
        return MathUtil.toArray(kept);
    }

    /**
     * 最小二乘直线 y = slope·x + intercept
     * @return {slope, intercept}
     */
    public static double[] fitLine(double[] x, double[] y) {
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }
        return new double[]{regression.getSlope(), regression.getIntercept()};
    }

    /**
     * 两条路线都给出：差分斜率（去离群）与两轮直线拟合（按 1.2σ 残差剔除后重拟合）
     */
    public static CalibrationResult compute(double[] positions, double[] centers) {
        if (positions.length != centers.length) {
            throw new IllegalArgumentException("位置与中心数量不一致");
        }
        if (positions.length < 2) {
            throw new IllegalArgumentException("标定点少于 2 个");
        }
        List<CalibrationPoint> points = new ArrayList<>(positions.length);
        for (int i = 0; i < positions.length; i++) {
            points.add(new CalibrationPoint(positions[i], centers[i]));
        }

        double[] slopes = pairwiseSlopes(positions, centers);
        double[] goodSlopes = rejectOutliers(slopes, SLOPE_REJECT_SIGMA);
        double meanSlope = slopes.length == 0 ? Double.NaN : MathUtil.mean(slopes);
        double robustSlope = goodSlopes.length == 0 ? Double.NaN : MathUtil.mean(goodSlopes);

        double[] firstPass = fitLine(centers, positions);
        double[] residuals = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            residuals[i] = positions[i] - (firstPass[0] * centers[i] + firstPass[1]);
        }
        double residualStd = MathUtil.populationStd(residuals);

        List<Double> keptCenters = new ArrayList<>();
        List<Double> keptPositions = new ArrayList<>();
        List<Integer> rejected = new ArrayList<>();
        for (int i = 0; i < positions.length; i++) {
            if (residualStd < ZERO_SPREAD || FastMath.abs(residuals[i]) < RESIDUAL_REJECT_SIGMA * residualStd) {
                keptCenters.add(centers[i]);
                keptPositions.add(positions[i]);
            } else {
                rejected.add(i);
            }
        }
        double[] secondPass = keptCenters.size() >= 2
                ? fitLine(MathUtil.toArray(keptCenters), MathUtil.toArray(keptPositions))
                : firstPass;

        return new CalibrationResult(points, meanSlope, robustSlope, slopes.length - goodSlopes.length,
                firstPass[0], secondPass[0], secondPass[1], rejected);
    }
}
