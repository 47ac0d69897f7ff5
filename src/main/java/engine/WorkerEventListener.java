package engine;

/**
 * 扫描通知订阅者
 * 回调在工作线程专属的通知线程上串行执行，不要在这里阻塞
 */
@FunctionalInterface
public interface WorkerEventListener {

    void onEvent(WorkerEvent event);
}
