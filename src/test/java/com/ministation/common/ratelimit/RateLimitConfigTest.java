package com.ministation.common.ratelimit;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.script.RedisScript;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitConfigTest {

    @Test
    void fixedWindowScript_ShouldLoadFromClasspath() {
        RedisScript<Long> script = new RateLimitConfig().fixedWindowScript();

        assertThat(script.getResultType()).isEqualTo(Long.class);
        assertThat(script.getScriptAsString()).contains("INCR", "EXPIRE", "TTL");
        assertThat(script.getSha1()).hasSize(40);
    }
}
