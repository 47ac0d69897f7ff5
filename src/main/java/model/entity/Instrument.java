package model.entity;

import java.util.Optional;
import java.util.Set;

/**
 * 仪器能力契约
 * 所有仪器都具备连接/断开与按名称解析的数值设置方法；可选能力见 {@link MovableStage} 与 {@link ChannelReader}
 */
public interface Instrument {

    String getName();

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * 按名称解析数值设置方法。只在构建扫描计划时调用一次，之后直接持有返回的委托
     */
    Optional<ParameterSetter> setter(String method);

    Set<String> setterNames();

    /**
     * 当前参数快照中包含的参数名
     */
    Set<String> settingNames();

    /**
     * 读取单个参数的当前值
     * @throws UnsupportedOperationException 参数不可读
     */
    Object readSetting(String name);
}
