package com.ministation.common.api;

/**
 * 统一错误码定义。
 *
 * <p>与 {@link ErrorKind} 一一对应；HTTP 状态码由 GlobalExceptionHandler 决定。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 必填字段缺失 */
    public static final int BAD_REQUEST = 40000;

    /** 未携带 principal */
    public static final int UNAUTHORIZED = 40100;

    /** 缺少能力或试图做受保护的操作 */
    public static final int FORBIDDEN = 40300;

    /** station / role / post / comment / invite / membership 不存在 */
    public static final int NOT_FOUND = 40400;

    /** slug 重复、已被封禁、已是成员等 */
    public static final int CONFLICT = 40900;

    /** 邀请过期/失效/用尽、回复层级超限、自定义角色优先级越界等 */
    public static final int INVALID_STATE = 42200;

    /** 触发限流 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
