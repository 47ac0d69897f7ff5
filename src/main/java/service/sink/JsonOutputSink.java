package service.sink;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 基于 Jackson 树模型的输出文件
 * 整棵树常驻内存，每次修改后先写临时文件再替换目标文件
 */
@Slf4j
public class JsonOutputSink implements OutputSink {

    private final Path path;
    private final ObjectMapper mapper;
    private final ObjectNode root;

    JsonOutputSink(Path path, ObjectMapper mapper, ObjectNode root) {
        this.path = path;
        this.mapper = mapper;
        this.root = root;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void createGroup(String groupPath) {
        resolveGroup(groupPath);
        flush();
    }

    @Override
    public synchronized boolean exists(String nodePath) {
        return find(nodePath) != null;
    }

    @Override
    public synchronized void writeValue(String nodePath, Object value) {
        String[] parts = split(nodePath);
        ObjectNode parent = resolveParent(parts);
        parent.set(parts[parts.length - 1], mapper.valueToTree(value));
        flush();
    }

    @Override
    public synchronized void writeTable(String nodePath, Map<String, List<Double>> columns, List<Double> index) {
        for (Map.Entry<String, List<Double>> column : columns.entrySet()) {
            if (column.getValue().size() != index.size()) {
                throw new IllegalArgumentException("列 " + column.getKey() + " 长度 " + column.getValue().size()
                        + " 与索引长度 " + index.size() + " 不一致");
            }
        }
        String[] parts = split(nodePath);
        ObjectNode parent = resolveParent(parts);
        ObjectNode table = mapper.createObjectNode();
        ObjectNode columnsNode = table.putObject("columns");
        for (Map.Entry<String, List<Double>> column : columns.entrySet()) {
            ArrayNode values = columnsNode.putArray(column.getKey());
            column.getValue().forEach(values::add);
        }
        ArrayNode indexNode = table.putArray("index");
        index.forEach(indexNode::add);
        parent.set(parts[parts.length - 1], table);
        flush();
    }

    @Override
    public synchronized Object read(String nodePath) {
        JsonNode node = find(nodePath);
        if (node == null) {
            return null;
        }
        return mapper.convertValue(node, new TypeReference<Object>() {});
    }

    @Override
    public synchronized List<String> children(String nodePath) {
        JsonNode node = find(nodePath);
        List<String> names = new ArrayList<>();
        if (node != null && node.isObject()) {
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
        }
        return names;
    }

    private JsonNode find(String nodePath) {
        JsonNode current = root;
        for (String part : split(nodePath)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    private ObjectNode resolveParent(String[] parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("数据集路径不能为空");
        }
        ObjectNode current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            current = child(current, parts[i]);
        }
        return current;
    }

    private ObjectNode resolveGroup(String groupPath) {
        ObjectNode current = root;
        for (String part : split(groupPath)) {
            current = child(current, part);
        }
        return current;
    }

    private ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing == null) {
            return parent.putObject(name);
        }
        if (!existing.isObject()) {
            throw new BusinessException("路径 " + name + " 已是数据集，不能作为分组");
        }
        return (ObjectNode) existing;
    }

    private static String[] split(String nodePath) {
        List<String> parts = new ArrayList<>();
        for (String part : nodePath.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts.toArray(new String[0]);
    }

    private void flush() {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), root);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("写入输出文件失败: {}", path, e);
            throw new UncheckedIOException(e);
        }
    }
}
