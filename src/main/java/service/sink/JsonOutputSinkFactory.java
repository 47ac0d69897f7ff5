package service.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Component
public class JsonOutputSinkFactory implements OutputSinkFactory {

    public static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;

    public JsonOutputSinkFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public OutputSink create(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JsonOutputSink sink = new JsonOutputSink(target, objectMapper, objectMapper.createObjectNode());
        // 立即落盘一个空文档，文件存在性检查依赖它
        sink.createGroup("");
        log.info("创建输出文件: {}", target);
        return sink;
    }

    @Override
    public OutputSink open(Path target) throws IOException {
        JsonNode tree = objectMapper.readTree(target.toFile());
        if (tree == null || !tree.isObject()) {
            throw new BusinessException("输出文件格式错误: " + target);
        }
        return new JsonOutputSink(target, objectMapper, (ObjectNode) tree);
    }
}
