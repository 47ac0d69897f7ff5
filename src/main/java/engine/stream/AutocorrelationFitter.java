package engine.stream;

import common.consts.ErrorCodes;
import common.exception.FitNotConvergedException;
import lombok.extern.slf4j.Slf4j;
import model.bo.FitResult;
import model.bo.ProcessedCurve;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;

/**
 * sech² 自相关峰拟合：f(t) = A·sech²(1.7627·(t - x0) / fwhm) + c
 * 使用 Levenberg-Marquardt 最小二乘；不收敛时抛出 {@link FitNotConvergedException}
 */
@Slf4j
public class AutocorrelationFitter {

    public static final double SECH2_FWHM_FACTOR = 1.7627;
    private static final int MIN_POINTS = 4;

    private final int maxIterations;

    public AutocorrelationFitter() {
        this(1000);
    }

    public AutocorrelationFitter(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * @param curve        待拟合曲线，NaN 位置忽略
     * @param expectedFwhm 预期脉宽，单位与曲线时间轴一致，作为初值的后备
     */
    public FitResult fit(ProcessedCurve curve, double expectedFwhm) {
        ProcessedCurve data = curve.dropMissing();
        if (data.size() < MIN_POINTS) {
            throw new FitNotConvergedException(ErrorCodes.FIT_NOT_CONVERGED + ": 有效点数 " + data.size()
                    + " 少于 " + MIN_POINTS, null);
        }
        double[] t = data.times();
        double[] y = data.getValues();
        double[] guess = initialGuess(t, y, expectedFwhm);

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(guess)
                .model(model(new Sech2(), t))
                .target(y)
                .maxIterations(maxIterations)
                .maxEvaluations(maxIterations * 10)
                .build();

        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        } catch (MathIllegalStateException e) {
            throw new FitNotConvergedException(ErrorCodes.FIT_NOT_CONVERGED + ": " + e.getMessage(), e);
        }
        double[] p = optimum.getPoint().toArray();
        for (double v : p) {
            if (!Double.isFinite(v)) {
                throw new FitNotConvergedException(ErrorCodes.FIT_NOT_CONVERGED + ": 参数非有限值", null);
            }
        }
        // fwhm 的符号不影响函数值
        FitResult result = new FitResult(p[0], p[1], FastMath.abs(p[2]), p[3], optimum.getRMS(),
                optimum.getIterations());
        log.debug("自相关拟合: {}", result);
        return result;
    }

    private static MultivariateJacobianFunction model(ParametricUnivariateFunction f, double[] t) {
        return point -> {
            double[] p = point.toArray();
            RealVector value = new ArrayRealVector(t.length);
            RealMatrix jacobian = new Array2DRowRealMatrix(t.length, p.length);
            for (int i = 0; i < t.length; i++) {
                value.setEntry(i, f.value(t[i], p));
                jacobian.setRow(i, f.gradient(t[i], p));
            }
            return new Pair<>(value, jacobian);
        };
    }

    /**
     * 振幅 = max - min，中心 = 最大值位置，基线 = min
     * 脉宽优先取半高全宽的估计，估计失败时用 expectedFwhm
     */
    static double[] initialGuess(double[] t, double[] y, double expectedFwhm) {
        int argMax = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < y.length; i++) {
            if (y[i] > max) {
                max = y[i];
                argMax = i;
            }
            min = Math.min(min, y[i]);
        }
        double halfMax = min + (max - min) / 2;
        double lower = t[argMax];
        double upper = t[argMax];
        for (int i = argMax; i >= 0 && y[i] >= halfMax; i--) {
            lower = t[i];
        }
        for (int i = argMax; i < y.length && y[i] >= halfMax; i++) {
            upper = t[i];
        }
        double fwhm = upper - lower;
        if (!(fwhm > 0)) {
            fwhm = expectedFwhm;
        }
        return new double[]{max - min, t[argMax], fwhm, min};
    }

    /**
     * 参数顺序：振幅、中心、半高宽、基线
     */
    static final class Sech2 implements ParametricUnivariateFunction {

        @Override
        public double value(double t, double... p) {
            double s = 1.0 / FastMath.cosh(SECH2_FWHM_FACTOR * (t - p[1]) / p[2]);
            return p[0] * s * s + p[3];
        }

        @Override
        public double[] gradient(double t, double... p) {
            double a = p[0];
            double w = p[2];
            double u = SECH2_FWHM_FACTOR * (t - p[1]) / w;
            double s = 1.0 / FastMath.cosh(u);
            double s2 = s * s;
            double tanh = FastMath.tanh(u);
            return new double[]{
                    s2,
                    2 * a * s2 * tanh * SECH2_FWHM_FACTOR / w,
                    2 * a * s2 * tanh * u / w,
                    1.0
            };
        }
    }
}
