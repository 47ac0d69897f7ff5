package engine;

import lombok.Getter;
import model.entity.Instrument;
import model.entity.ParameterSetter;

import java.util.List;

/**
 * 扫描计划中的一个维度
 * 设置方法在构建时解析为委托并持有，扫描过程中不再按名称查找
 */
@Getter
public final class ParameterIteration {
    private final String name;
    private final String unit;
    private final Instrument instrument;
    private final String method;
    private final ParameterSetter setter;
    private final List<Double> values;

    public ParameterIteration(String name, String unit, Instrument instrument, String method,
                              ParameterSetter setter, List<Double> values) {
        this.name = name;
        this.unit = unit;
        this.instrument = instrument;
        this.method = method;
        this.setter = setter;
        this.values = List.copyOf(values);
    }

    public int length() {
        return values.size();
    }

    public double valueAt(int index) {
        return values.get(index);
    }

    /**
     * 例如 "10.0K"，用于拼接输出文件分组路径
     */
    public String label(int index) {
        return values.get(index) + unit;
    }

    @Override
    public String toString() {
        return name + "(" + instrument.getName() + "." + method + ", " + values.size() + " 个取值)";
    }
}
