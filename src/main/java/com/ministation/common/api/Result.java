package com.ministation.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * /station 接口的响应信封。
 *
 * <p>{@code ok} 是业务结果而非 HTTP 状态；成功时 {@code code=0}、{@code message="ok"}，
 * 失败时 {@code code} 取 {@link ApiCodes}，{@code message} 为 snake_case 原因码（如 {@code invite_expired}）。
 * {@code ts} 为服务端毫秒时间戳。</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(boolean ok, int code, String message, T data, long ts) {

    private static final String OK = "ok";

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, OK, data, System.currentTimeMillis());
    }

    /** 无返回数据的成功（record 已占用 ok() 作为访问器）。 */
    public static <T> Result<T> okVoid() {
        return ok(null);
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(ErrorKind kind, String reason) {
        return fail(kind.getApiCode(), reason);
    }
}
