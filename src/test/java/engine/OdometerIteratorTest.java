package engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("里程表遍历测试")
class OdometerIteratorTest {

    private static List<int[]> drain(OdometerIterator it) {
        List<int[]> result = new ArrayList<>();
        while (it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }

    @Test
    @DisplayName("最后一个维度变化最快")
    void testRightmostFastest() {
        List<int[]> tuples = drain(new OdometerIterator(new int[]{2, 3}));
        assertEquals(6, tuples.size());
        int[][] expected = {{0, 0}, {0, 1}, {0, 2}, {1, 0}, {1, 1}, {1, 2}};
        for (int i = 0; i < expected.length; i++) {
            assertArrayEquals(expected[i], tuples.get(i), "第 " + i + " 个坐标组");
        }
    }

    @Test
    @DisplayName("三维计划的坐标组数等于各维长度之积")
    void testCountIsProduct() {
        assertEquals(2 * 3 * 4, drain(new OdometerIterator(new int[]{2, 3, 4})).size());
    }

    @Test
    @DisplayName("空计划只产生一个空坐标组")
    void testEmptyPlan() {
        List<int[]> tuples = drain(new OdometerIterator(new int[0]));
        assertEquals(1, tuples.size());
        assertEquals(0, tuples.get(0).length);
    }

    @Test
    @DisplayName("耗尽后继续取值抛出 NoSuchElementException")
    void testExhausted() {
        OdometerIterator it = new OdometerIterator(new int[]{1});
        it.next();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    @DisplayName("维度长度为 0 时拒绝构建")
    void testZeroLength() {
        assertThrows(IllegalArgumentException.class, () -> new OdometerIterator(new int[]{2, 0}));
    }
}
