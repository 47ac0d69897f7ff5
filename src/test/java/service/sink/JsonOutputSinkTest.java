package service.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.config.JacksonConfig;
import common.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON 输出文件测试")
class JsonOutputSinkTest {

    @TempDir
    Path tempDir;

    private JsonOutputSinkFactory factory;
    private Path target;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new JacksonConfig().objectMapper();
        factory = new JsonOutputSinkFactory(mapper);
        target = tempDir.resolve("nested/dir/output.json");
    }

    @Test
    @DisplayName("创建时建立父目录并立即落盘")
    void testCreateFlushes() throws Exception {
        OutputSink sink = factory.create(target);
        assertTrue(Files.exists(target), "创建后文件应存在");
        assertEquals(target, sink.getPath());
        assertTrue(sink.children("").isEmpty());
    }

    @Test
    @DisplayName("分组、数据集与表重新打开后内容一致")
    void testReopen() throws Exception {
        OutputSink sink = factory.create(target);
        sink.createGroup("settings/lockin");
        sink.writeValue("settings/lockin/sensitivity", 0.5);
        sink.writeValue("metadata/type", "stepscan");
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        columns.put("X", List.of(1.0, 2.0));
        sink.writeTable("raw_data/single/avg0000", columns, List.of(0.1, 0.2));

        OutputSink reopened = factory.open(target);
        assertEquals(List.of("settings", "metadata", "raw_data"), reopened.children(""));
        assertEquals(0.5, reopened.read("settings/lockin/sensitivity"));
        assertEquals("stepscan", reopened.read("metadata/type"));
        assertTrue(reopened.exists("raw_data/single/avg0000"));
        assertNull(reopened.read("raw_data/single/avg0001"));
        assertFalse(Files.exists(target.resolveSibling("output.json.tmp")), "临时文件应已替换目标文件");
    }

    @Test
    @DisplayName("重复创建分组不覆盖已有内容")
    void testCreateGroupIdempotent() throws Exception {
        OutputSink sink = factory.create(target);
        sink.writeValue("axes/delay", List.of(1.0, 2.0));
        sink.createGroup("axes");
        assertEquals(List.of(1.0, 2.0), sink.read("axes/delay"));
    }

    @Test
    @DisplayName("列长度与索引不一致时拒绝写入")
    void testTableLengthMismatch() throws Exception {
        OutputSink sink = factory.create(target);
        Map<String, List<Double>> columns = Map.of("X", List.of(1.0));
        assertThrows(IllegalArgumentException.class,
                () -> sink.writeTable("raw/t", columns, List.of(0.1, 0.2)));
        assertFalse(sink.exists("raw/t"));
    }

    @Test
    @DisplayName("数据集不能作为分组使用")
    void testDatasetIsNotGroup() throws Exception {
        OutputSink sink = factory.create(target);
        sink.writeValue("metadata/date", "2024-01-01");
        assertThrows(BusinessException.class, () -> sink.createGroup("metadata/date/child"));
    }

    @Test
    @DisplayName("打开非对象文档时报错")
    void testOpenMalformed() throws Exception {
        Path bad = tempDir.resolve("bad.json");
        Files.writeString(bad, "[1, 2, 3]");
        assertThrows(BusinessException.class, () -> factory.open(bad));
    }
}
