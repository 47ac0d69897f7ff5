package model.entity;

import org.apache.commons.math3.util.FastMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 模拟锁相放大器
 * 输出随位移台延迟变化的单指数衰减泵浦-探测信号；未绑定位移台时输出常数
 */
public class SimulatedLockInAmplifier extends BaseInstrument implements ChannelReader {

    private final MovableStage stage;
    private volatile double sensitivity = 1.0;
    private volatile double timeConstant = 0.3;
    private volatile double decayTime = 1.5;

    public SimulatedLockInAmplifier(String name, MovableStage stage) {
        super(name);
        this.stage = stage;
        registerSetter("sensitivity", v -> this.sensitivity = v);
        registerSetter("time_constant", v -> this.timeConstant = v);
        registerSetter("decay_time", v -> this.decayTime = v);
        registerSetting("sensitivity", () -> sensitivity);
        registerSetting("time_constant", () -> timeConstant);
        registerSetting("decay_time", () -> decayTime);
    }

    @Override
    public Map<String, Double> measure(List<String> channels) {
        double delay = 0.0;
        if (stage != null) {
            OptionalDouble pos = stage.position();
            delay = pos.isPresent() ? pos.getAsDouble() : 0.0;
        }
        double response = delay < 0 ? 0.0 : FastMath.exp(-delay / decayTime);
        double x = response * sensitivity;
        double y = 0.1 * response * sensitivity;

        Map<String, Double> result = new LinkedHashMap<>();
        for (String channel : channels) {
            switch (channel) {
                case "X":
                    result.put(channel, x);
                    break;
                case "Y":
                    result.put(channel, y);
                    break;
                case "R":
                    result.put(channel, FastMath.hypot(x, y));
                    break;
                case "Theta":
                    result.put(channel, FastMath.toDegrees(FastMath.atan2(y, x)));
                    break;
                default:
                    throw new IllegalArgumentException("未知锁相通道: " + channel);
            }
        }
        return result;
    }
}
