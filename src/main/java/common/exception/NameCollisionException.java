package common.exception;

import java.nio.file.Path;

/**
 * 输出文件已存在且未要求覆盖
 */
public class NameCollisionException extends BusinessException {
    private final Path target;

    public NameCollisionException(String message, Path target) {
        super(message);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
