package model.entity;

/**
 * 仪器上单个数值参数的设置委托
 */
@FunctionalInterface
public interface ParameterSetter {

    void apply(double value);
}
