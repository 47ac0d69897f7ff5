package engine.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 按采集序号重排乱序完成的结果
 * 只有序号连续的前缀才会被放出；处理失败的序号通过 {@link #skip(long)} 让出位置
 * 非线程安全，调用方持有聚合锁
 */
@Slf4j
public class SequenceReorderBuffer<T> {

    private final TreeMap<Long, Optional<T>> pending = new TreeMap<>();
    private long nextSequence;

    public SequenceReorderBuffer(long firstSequence) {
        this.nextSequence = firstSequence;
    }

    /**
     * 放入一个结果，返回因此可以按顺序放出的结果（可能为空）
     */
    public List<T> accept(long sequence, T item) {
        return put(sequence, Optional.of(item));
    }

    public List<T> skip(long sequence) {
        return put(sequence, Optional.empty());
    }

    /**
     * 丢弃所有等待中的结果，从 firstSequence 重新开始
     */
    public void reset(long firstSequence) {
        pending.clear();
        nextSequence = firstSequence;
    }

    public int pendingCount() {
        return pending.size();
    }

    public long getNextSequence() {
        return nextSequence;
    }

    private List<T> put(long sequence, Optional<T> item) {
        if (sequence < nextSequence) {
            log.debug("丢弃过期序号 {}，期望 {}", sequence, nextSequence);
            return List.of();
        }
        pending.put(sequence, item);
        List<T> released = new ArrayList<>();
        while (!pending.isEmpty() && pending.firstKey() == nextSequence) {
            pending.pollFirstEntry().getValue().ifPresent(released::add);
            nextSequence++;
        }
        return released;
    }
}
