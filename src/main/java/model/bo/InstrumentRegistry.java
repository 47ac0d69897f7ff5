package model.bo;

import common.consts.InstrumentRoleEnum;
import model.entity.Instrument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已登记仪器表，按登记顺序保存
 * 由实验协调器独占持有，不是全局单例
 */
public class InstrumentRegistry {

    private final Map<String, Instrument> instruments = new LinkedHashMap<>();

    public synchronized void register(String name, Instrument instrument) {
        instruments.put(name, instrument);
    }

    public synchronized Instrument get(String name) {
        return name == null ? null : instruments.get(name);
    }

    public synchronized boolean contains(String name) {
        return instruments.containsKey(name);
    }

    public synchronized boolean containsInstance(Instrument instrument) {
        for (Instrument registered : instruments.values()) {
            if (registered == instrument) {
                return true;
            }
        }
        return false;
    }

    public synchronized List<String> names() {
        return new ArrayList<>(instruments.keySet());
    }

    public synchronized Map<String, Instrument> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(instruments));
    }

    public synchronized Collection<Instrument> values() {
        return new ArrayList<>(instruments.values());
    }

    /**
     * 按能力匹配角色，返回第一个满足且不在 exclude 中的仪器名
     */
    public synchronized String findByRole(InstrumentRoleEnum role, Collection<String> exclude) {
        for (Map.Entry<String, Instrument> entry : instruments.entrySet()) {
            if (!exclude.contains(entry.getKey()) && role.isSatisfiedBy(entry.getValue())) {
                return entry.getKey();
            }
        }
        return null;
    }

    public synchronized int size() {
        return instruments.size();
    }

    public synchronized void clear() {
        instruments.clear();
    }
}
