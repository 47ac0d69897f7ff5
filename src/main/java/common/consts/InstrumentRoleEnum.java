package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;
import model.entity.ChannelReader;
import model.entity.Instrument;
import model.entity.MovableStage;

/**
 * 仪器角色：按能力接口匹配，而不是按名称
 */
@Getter
@AllArgsConstructor
public enum InstrumentRoleEnum {
    DELAY_STAGE("delay_stage", MovableStage.class),
    LOCK_IN("lockin", ChannelReader.class);

    // 扫描工作线程中引用该角色时使用的名称
    private final String roleName;
    private final Class<? extends Instrument> capability;

    public boolean isSatisfiedBy(Instrument instrument) {
        return instrument != null && capability.isInstance(instrument);
    }
}
