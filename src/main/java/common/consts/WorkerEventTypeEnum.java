package common.consts;

/**
 * 扫描工作线程对外发布的通知类型
 */
public enum WorkerEventTypeEnum {
    STATE_CHANGED,    // 状态变化，负载为 WorkerStateEnum
    PROGRESS_CHANGED, // 进度变化，负载为百分比 Double
    NEW_DATA,         // 新测量点，负载为 Map
    ERROR,            // 不可恢复错误，负载为 Throwable
    FINISHED;         // 扫描结束，负载为结果 Map

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR;
    }
}
