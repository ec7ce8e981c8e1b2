package com.ministation.common.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Redis 固定窗口计数器：一个 key 一个窗口，INCR + EXPIRE 在同一段 Lua 里完成。
 */
@Component
@RequiredArgsConstructor
public class FixedWindowLimiter {

    private final StringRedisTemplate redis;
    private final RedisScript<Long> fixedWindowScript;

    /**
     * 记一次访问。
     *
     * @return 0 表示放行；大于 0 为距窗口重置的秒数
     */
    public long hit(String key, long windowSeconds, long max) {
        Long ttl = redis.execute(fixedWindowScript, List.of(key),
                String.valueOf(windowSeconds), String.valueOf(max));
        return ttl == null ? 0 : Math.max(0, ttl);
    }
}
