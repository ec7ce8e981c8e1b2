package com.ministation.common.ratelimit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 固定窗口限流：{@code windowSeconds} 内同一维度最多 {@code max} 次。
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    String name();

    long windowSeconds();

    long max();

    RateLimitKey key() default RateLimitKey.PRINCIPAL;
}
