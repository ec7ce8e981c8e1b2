package com.ministation.common.ratelimit;

/**
 * 限流维度。
 */
public enum RateLimitKey {

    /** 按当前 principal；匿名请求不限流 */
    PRINCIPAL,

    /** 按客户端 IP */
    IP
}
