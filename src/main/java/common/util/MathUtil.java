package common.util;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.FastMath;

import java.util.List;

/**
 * 数值工具类
 */
public class MathUtil {

    private MathUtil() {}

    /**
     * 闭区间 [start, stop] 上等间距的 num 个点
     */
    public static double[] linspace(double start, double stop, int num) {
        if (num <= 0) {
            return new double[0];
        }
        double[] result = new double[num];
        if (num == 1) {
            result[0] = start;
            return result;
        }
        double step = (stop - start) / (num - 1);
        for (int i = 0; i < num; i++) {
            result[i] = start + i * step;
        }
        // 消除累积误差，末点严格等于 stop
        result[num - 1] = stop;
        return result;
    }

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /**
     * 总体标准差（分母为 n）
     */
    public static double populationStd(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return FastMath.sqrt(StatUtils.populationVariance(values));
    }

    public static boolean isStrictlyIncreasing(List<Double> values) {
        for (int i = 1; i < values.size(); i++) {
            if (!(values.get(i) > values.get(i - 1))) {
                return false;
            }
        }
        return true;
    }

    public static boolean allFinite(List<Double> values) {
        for (Double v : values) {
            if (v == null || !Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double sech(double x) {
        return 1.0 / FastMath.cosh(x);
    }

    public static double[] toArray(List<Double> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
