package service.log;

import engine.WorkerEvent;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 简单的内存通知日志（最近 N 条）
 */
@Component
public class MeasurementEventLog {

    private static final int DEFAULT_CAPACITY = 1000;

    private final Deque<EventLogEntryDto> buffer = new ArrayDeque<>(DEFAULT_CAPACITY);
    private final AtomicLong sequence = new AtomicLong();

    public void record(WorkerEvent event) {
        record(event.getWorkerId(), event.getType().name(), String.valueOf(event.getData()));
    }

    public synchronized void record(String source, String type, String detail) {
        EventLogEntryDto entry = new EventLogEntryDto();
        entry.setSequence(sequence.getAndIncrement());
        entry.setTimestamp(System.currentTimeMillis());
        entry.setSource(source);
        entry.setType(type);
        entry.setDetail(detail);
        if (buffer.size() >= DEFAULT_CAPACITY) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 查询指定序号之后的通知
     */
    public synchronized List<EventLogEntryDto> listSince(long sinceSequence) {
        List<EventLogEntryDto> result = new ArrayList<>();
        for (EventLogEntryDto dto : buffer) {
            if (dto.getSequence() >= sinceSequence) {
                result.add(dto);
            }
        }
        return result;
    }
}
