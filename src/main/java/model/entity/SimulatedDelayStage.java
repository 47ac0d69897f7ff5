package model.entity;

import lombok.extern.slf4j.Slf4j;

import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模拟延迟位移台
 */
@Slf4j
public class SimulatedDelayStage extends BaseInstrument implements MovableStage {

    private volatile double currentPosition;
    private volatile double velocity = 10.0;
    private final AtomicInteger moveCount = new AtomicInteger();

    public SimulatedDelayStage(String name) {
        super(name);
        registerSetter("move_absolute", this::moveAbsolute);
        registerSetter("velocity", this::setVelocity);
        registerSetting("position", () -> currentPosition);
        registerSetting("velocity", () -> velocity);
    }

    @Override
    public void moveAbsolute(double position) {
        moveCount.incrementAndGet();
        log.debug("位移台 [{}] 移动: {} -> {}", getName(), currentPosition, position);
        this.currentPosition = position;
    }

    @Override
    public OptionalDouble position() {
        return OptionalDouble.of(currentPosition);
    }

    public void setVelocity(double velocity) {
        this.velocity = velocity;
    }

    public int getMoveCount() {
        return moveCount.get();
    }
}
