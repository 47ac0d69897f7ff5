package engine;

import common.consts.WorkerEventTypeEnum;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 扫描工作线程发布的通知
 */
@Getter
@ToString
public class WorkerEvent {
    private final String workerId;       // 发布者
    private final WorkerEventTypeEnum type;
    private final Object data;           // 负载，类型由 type 决定
    private final long sequence;         // 全局发布序号
    private final long timestamp;

    // 发布序号计数器
    private static final AtomicLong sequenceGenerator = new AtomicLong(0);

    public WorkerEvent(String workerId, WorkerEventTypeEnum type, Object data) {
        this.workerId = workerId;
        this.type = type;
        this.data = data;
        this.sequence = sequenceGenerator.getAndIncrement();
        this.timestamp = System.currentTimeMillis();
    }
}
