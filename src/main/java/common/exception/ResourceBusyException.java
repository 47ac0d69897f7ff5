package common.exception;

/**
 * 硬件正被另一条测量链路使用（扫描 / 流式采集 / 标定三者互斥）
 */
public class ResourceBusyException extends BusinessException {
    private final String holder;

    public ResourceBusyException(String message, String holder) {
        super(message);
        this.holder = holder;
    }

    public String getHolder() {
        return holder;
    }
}
