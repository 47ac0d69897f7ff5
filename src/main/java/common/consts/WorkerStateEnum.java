package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 扫描工作线程状态枚举
 * 除 FAILED 外状态单向推进；COMPLETE 与 FAILED 为终态
 */
@Getter
@AllArgsConstructor
public enum WorkerStateEnum {
    LOADING("loading", "加载中"),
    IDLE("idle", "就绪"),
    CHANGING_PARAMETERS("changing_parameters", "切换参数"),
    RUNNING("running", "测量中"),
    FAILED("failed", "失败"),
    COMPLETE("complete", "完成");

    private final String code;
    private final String desc;

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETE;
    }

    /**
     * 判断是否允许从当前状态切换到目标状态
     * 终态不可离开；进入扫描循环后不可回到 LOADING/IDLE
     */
    public boolean canTransitionTo(WorkerStateEnum target) {
        if (isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        switch (target) {
            case LOADING:
                return this == LOADING;
            case IDLE:
                return this == LOADING || this == IDLE;
            default:
                return true;
        }
    }
}
