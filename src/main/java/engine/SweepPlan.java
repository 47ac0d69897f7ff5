package engine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 扫描计划：维度按声明顺序嵌套，第一个维度在最外层，最后一个变化最快
 */
public final class SweepPlan {

    private final List<ParameterIteration> dimensions;

    public SweepPlan(List<ParameterIteration> dimensions) {
        this.dimensions = List.copyOf(dimensions);
    }

    public static SweepPlan empty() {
        return new SweepPlan(List.of());
    }

    public List<ParameterIteration> getDimensions() {
        return dimensions;
    }

    public ParameterIteration dimension(int i) {
        return dimensions.get(i);
    }

    public int dimensionCount() {
        return dimensions.size();
    }

    public int[] lengths() {
        int[] lengths = new int[dimensions.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = dimensions.get(i).length();
        }
        return lengths;
    }

    /**
     * 坐标组总数 ∏Li；空计划只有一个空坐标组
     */
    public long coordinateCount() {
        long total = 1;
        for (ParameterIteration dimension : dimensions) {
            total *= dimension.length();
        }
        return total;
    }

    public Iterator<int[]> coordinates() {
        return new OdometerIterator(lengths());
    }

    /**
     * 坐标组对应的分组名，例如 "10.0K - 0.5V"；空计划返回 "single"
     */
    public String label(int[] indexes) {
        if (dimensions.isEmpty()) {
            return "single";
        }
        List<String> parts = new ArrayList<>(dimensions.size());
        for (int i = 0; i < dimensions.size(); i++) {
            parts.add(dimensions.get(i).label(indexes[i]));
        }
        return String.join(" - ", parts);
    }

    public boolean isEmpty() {
        return dimensions.isEmpty();
    }
}
