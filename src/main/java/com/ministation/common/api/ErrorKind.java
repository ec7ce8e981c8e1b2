package com.ministation.common.api;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 业务拒绝的种类。全部是同步返回给调用方的业务规则拒绝，不做自动重试。
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    NOT_FOUND(404, ApiCodes.NOT_FOUND),

    PERMISSION_DENIED(403, ApiCodes.FORBIDDEN),

    CONFLICT(409, ApiCodes.CONFLICT),

    INVALID_STATE(422, ApiCodes.INVALID_STATE),

    VALIDATION(400, ApiCodes.BAD_REQUEST);

    private final int httpStatus;

    private final int apiCode;
}
