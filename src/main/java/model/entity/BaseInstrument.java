package model.entity;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 仪器基类
 * 子类在构造时登记可设置参数与可读参数，扫描计划只通过登记的委托访问仪器
 */
@Slf4j
public abstract class BaseInstrument implements Instrument {

    @Getter
    private final String name;
    private volatile boolean connected;

    private final Map<String, ParameterSetter> setters = new LinkedHashMap<>();
    private final Map<String, Supplier<Object>> settings = new LinkedHashMap<>();

    protected BaseInstrument(String name) {
        this.name = name;
    }

    protected final void registerSetter(String method, ParameterSetter setter) {
        setters.put(method, setter);
    }

    protected final void registerSetting(String settingName, Supplier<Object> reader) {
        settings.put(settingName, reader);
    }

    @Override
    public synchronized void connect() {
        if (connected) {
            return;
        }
        onConnect();
        connected = true;
        log.debug("仪器 [{}] 已连接", name);
    }

    @Override
    public synchronized void disconnect() {
        if (!connected) {
            return;
        }
        onDisconnect();
        connected = false;
        log.debug("仪器 [{}] 已断开", name);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Optional<ParameterSetter> setter(String method) {
        return Optional.ofNullable(setters.get(method));
    }

    @Override
    public Set<String> setterNames() {
        return Collections.unmodifiableSet(setters.keySet());
    }

    @Override
    public Set<String> settingNames() {
        return Collections.unmodifiableSet(settings.keySet());
    }

    @Override
    public Object readSetting(String settingName) {
        Supplier<Object> reader = settings.get(settingName);
        if (reader == null) {
            throw new UnsupportedOperationException("仪器 [" + name + "] 没有参数 " + settingName);
        }
        return reader.get();
    }

    // 硬件连接钩子，模拟设备无需实现
    protected void onConnect() {
    }

    protected void onDisconnect() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
