package common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 控制接口统一响应体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int BUSY = 409;
    public static final int FAILED = 500;

    private Integer code; // 200成功 400参数错误 409硬件占用 500失败
    private String msg;
    private Object data;

    public static Result success() {
        return new Result(OK, "操作成功", null);
    }

    public static Result success(Object data) {
        return new Result(OK, "操作成功", data);
    }

    public static Result success(String msg, Object data) {
        return new Result(OK, msg, data);
    }

    public static Result error(String msg) {
        return new Result(FAILED, msg, null);
    }

    public static Result error(Integer code, String msg) {
        return new Result(code, msg, null);
    }

    // 硬件被另一条测量链路占用
    public static Result busy(String msg) {
        return new Result(BUSY, msg, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == OK;
    }
}
