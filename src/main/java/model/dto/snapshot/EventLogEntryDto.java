package model.dto.snapshot;

import lombok.Data;

/**
 * 测量通知日志条目 DTO
 */
@Data
public class EventLogEntryDto {
    /**
     * 发布序号，单调递增
     */
    private long sequence;

    /**
     * 发布时间（毫秒时间戳）
     */
    private long timestamp;

    /**
     * 来源（扫描工作线程 ID 或 acquisition）
     */
    private String source;

    private String type;

    /**
     * 负载摘要
     */
    private String detail;
}
