package com.ministation.common.api;

/**
 * service 层统一的业务异常：种类 + 稳定的原因码（例如 {@code invite_expired}）。
 *
 * <p>是 RuntimeException，抛出即回滚当前 {@code @Transactional} 方法内的所有写入。</p>
 */
public class BizException extends RuntimeException {

    private final ErrorKind kind;

    public BizException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static BizException notFound(String message) {
        return new BizException(ErrorKind.NOT_FOUND, message);
    }

    public static BizException forbidden(String message) {
        return new BizException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static BizException conflict(String message) {
        return new BizException(ErrorKind.CONFLICT, message);
    }

    public static BizException invalidState(String message) {
        return new BizException(ErrorKind.INVALID_STATE, message);
    }

    public static BizException validation(String message) {
        return new BizException(ErrorKind.VALIDATION, message);
    }
}
