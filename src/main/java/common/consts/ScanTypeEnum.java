package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 扫描类型，写入输出文件 metadata/type
 */
@Getter
@AllArgsConstructor
public enum ScanTypeEnum {
    STEP_SCAN("stepscan", "步进延迟扫描"),
    FAST_SCAN("fastscan", "快速扫描流式采集");

    private final String tag;
    private final String desc;
}
