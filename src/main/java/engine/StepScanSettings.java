package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 步进扫描参数快照，启动扫描时从协调器复制
 */
@Getter
@ToString
@AllArgsConstructor
public final class StepScanSettings {
    private final int averages;
    private final List<Double> stagePositions;
    private final double timeZero;
    private final List<String> channels;

    public Map<String, Object> toSettingsMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("averages", averages);
        map.put("stage_positions", stagePositions);
        map.put("time_zero", timeZero);
        map.put("channels", channels);
        return map;
    }
}
