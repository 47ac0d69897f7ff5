package engine.stream;

import model.bo.ProcessedCurve;
import model.bo.StreamFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("帧投影测试")
class FrameProjectorTest {

    private static StreamFrame frame(double[] positions, double[] signal, double[] darkControl) {
        double[] reference = new double[positions.length];
        return new StreamFrame(7, new double[][]{positions, signal, darkControl, reference});
    }

    @Test
    @DisplayName("暗场控制：每个 bin 取泵浦开与关的均值之差")
    void testDarkControlDifference() {
        StreamFrame f = frame(
                new double[]{0, 0, 1, 1, 2},
                new double[]{3, 1, 4, 2, 9},
                new double[]{5, 0, 5, 0, 5});
        ProcessedCurve curve = FrameProjector.project(f, true, 1.0, 0.5);

        assertEquals(7, curve.getSequence(), "曲线序号沿用帧标签");
        assertArrayEquals(new long[]{0, 1, 2}, curve.getBins());
        assertEquals(2.0, curve.getValues()[0], 1e-12);
        assertEquals(2.0, curve.getValues()[1], 1e-12);
        assertTrue(Double.isNaN(curve.getValues()[2]), "只有泵浦开的 bin 没有数据");
        assertEquals(1.0, curve.time(2), 1e-12);
    }

    @Test
    @DisplayName("无暗场控制：每个 bin 取信号均值")
    void testMeanWithoutDarkControl() {
        StreamFrame f = frame(
                new double[]{0, 0, 1, 1, 2},
                new double[]{3, 1, 4, 2, 9},
                new double[]{5, 0, 5, 0, 5});
        ProcessedCurve curve = FrameProjector.project(f, false, 1.0, 1.0);
        assertArrayEquals(new double[]{2.0, 3.0, 9.0}, curve.getValues(), 1e-12);
    }

    @Test
    @DisplayName("振镜位置按步长四舍五入到 bin，中间缺失的 bin 为 NaN")
    void testRoundingAndGaps() {
        StreamFrame f = frame(
                new double[]{-0.24, 0.26, 0.74},
                new double[]{1, 2, 3},
                new double[]{0, 0, 0});
        ProcessedCurve curve = FrameProjector.project(f, false, 0.25, 1.0);
        assertArrayEquals(new long[]{-1, 0, 1, 2, 3}, curve.getBins());
        assertEquals(1.0, curve.valueAtBin(-1), 1e-12);
        assertTrue(Double.isNaN(curve.valueAtBin(0)));
        assertEquals(2.0, curve.valueAtBin(1), 1e-12);
        assertTrue(Double.isNaN(curve.valueAtBin(2)));
        assertEquals(3.0, curve.valueAtBin(3), 1e-12);
    }

    @Test
    @DisplayName("空帧投影为空曲线")
    void testEmptyFrame() {
        StreamFrame f = frame(new double[0], new double[0], new double[0]);
        assertTrue(FrameProjector.project(f, true, 1.0, 1.0).isEmpty());
    }

    @Test
    @DisplayName("步长非正数时拒绝投影")
    void testInvalidStep() {
        StreamFrame f = frame(new double[]{0}, new double[]{1}, new double[]{0});
        assertThrows(IllegalArgumentException.class, () -> FrameProjector.project(f, false, 0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> FrameProjector.project(f, false, 1.0, -0.1));
    }
}
