package service.sink;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 层级输出文件：以 "/" 分隔的路径定位分组与数据集
 * 每次写入后立即落盘
 */
public interface OutputSink {

    Path getPath();

    /**
     * 创建分组（以及缺失的父分组），已存在时不做任何事
     */
    void createGroup(String path);

    boolean exists(String path);

    /**
     * 写入标量、数组或 Map，覆盖同名数据集
     */
    void writeValue(String path, Object value);

    /**
     * 写入带索引的表：columns 中每列长度须与 index 一致
     */
    void writeTable(String path, Map<String, List<Double>> columns, List<Double> index);

    /**
     * 读取数据集或分组，转成 Java 对象（Map / List / 数值 / 字符串）
     * @return 路径不存在时返回 null
     */
    Object read(String path);

    /**
     * 直接子节点名称，按写入顺序
     */
    List<String> children(String path);
}
