package engine.stream;

import common.exception.FitNotConvergedException;
import model.bo.FitResult;
import model.bo.ProcessedCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("自相关拟合测试")
class AutocorrelationFitterTest {

    private static final double STEP = 0.02;

    private static ProcessedCurve sech2Curve(double amplitude, double center, double fwhm, double offset) {
        AutocorrelationFitter.Sech2 f = new AutocorrelationFitter.Sech2();
        int n = 151;
        long[] bins = new long[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            bins[i] = i - 75;
            values[i] = f.value(bins[i] * STEP, amplitude, center, fwhm, offset);
        }
        return new ProcessedCurve(0, bins, values, STEP);
    }

    /**
     * 测试1: 无噪声合成峰恢复全部参数
     */
    @Test
    @DisplayName("合成 sech² 峰的参数被准确恢复")
    void testRecoverParameters() {
        FitResult fit = new AutocorrelationFitter().fit(sech2Curve(2.0, 0.3, 0.5, 1.0), 0.4);
        assertEquals(2.0, fit.getAmplitude(), 1e-6);
        assertEquals(0.3, fit.getCenter(), 1e-6);
        assertEquals(0.5, fit.getFwhm(), 1e-6);
        assertEquals(1.0, fit.getOffset(), 1e-6);
        assertTrue(fit.getRms() < 1e-6, "无噪声数据残差应接近 0");
    }

    /**
     * 测试2: NaN 点被忽略
     */
    @Test
    @DisplayName("缺失点不影响拟合")
    void testIgnoresMissing() {
        ProcessedCurve clean = sech2Curve(1.0, -0.2, 0.3, 0.0);
        double[] values = clean.getValues().clone();
        for (int i = 0; i < values.length; i += 7) {
            values[i] = Double.NaN;
        }
        ProcessedCurve holes = new ProcessedCurve(0, clean.getBins(), values, STEP);
        FitResult fit = new AutocorrelationFitter().fit(holes, 0.3);
        assertEquals(-0.2, fit.getCenter(), 1e-6);
        assertEquals(0.3, fit.getFwhm(), 1e-6);
    }

    @Test
    @DisplayName("有效点不足时抛出拟合不收敛")
    void testTooFewPoints() {
        ProcessedCurve curve = new ProcessedCurve(0, new long[]{0, 1, 2, 3},
                new double[]{1, Double.NaN, 2, 1}, 1.0);
        assertThrows(FitNotConvergedException.class, () -> new AutocorrelationFitter().fit(curve, 1.0));
    }

    @Test
    @DisplayName("初值取峰值位置与半高宽")
    void testInitialGuess() {
        double[] t = {0, 1, 2, 3, 4};
        double[] y = {0, 1, 4, 1, 0};
        double[] guess = AutocorrelationFitter.initialGuess(t, y, 9.0);
        assertArrayEquals(new double[]{4, 2, 0, 0}, new double[]{guess[0], guess[1], 0, guess[3]}, 1e-12);
        assertEquals(9.0, guess[2], 1e-12, "半高宽为 0 时使用预期脉宽");

        double[] wide = AutocorrelationFitter.initialGuess(t, new double[]{0, 3, 4, 3, 0}, 9.0);
        assertEquals(2.0, wide[2], 1e-12);
    }
}
