package service.sink;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 输出文件工厂，屏蔽具体文件格式
 */
public interface OutputSinkFactory {

    /**
     * 文件扩展名（含点）
     */
    String extension();

    /**
     * 新建空文件，目标已存在时直接覆盖
     */
    OutputSink create(Path target) throws IOException;

    /**
     * 打开已有文件
     */
    OutputSink open(Path target) throws IOException;
}
