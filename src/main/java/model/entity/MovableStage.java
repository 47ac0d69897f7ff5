package model.entity;

import java.util.OptionalDouble;

/**
 * 可移动位移台
 */
public interface MovableStage extends Instrument {

    void moveAbsolute(double position);

    /**
     * 读回实际位置；设备不支持读回时返回 empty
     */
    OptionalDouble position();
}
