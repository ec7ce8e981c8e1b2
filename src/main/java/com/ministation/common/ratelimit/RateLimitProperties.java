package com.ministation.common.ratelimit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "station.ratelimit")
public class RateLimitProperties {

    private boolean enabled = true;

    /** 仅当前面有可信反向代理时打开，否则客户端可伪造 X-Forwarded-For。 */
    private boolean trustForwardedHeaders = false;

    /** Redis 不可用时放行（true）还是按整窗拒绝（false）。 */
    private boolean failOpen = true;

    private String keyPrefix = "station:rl:";
}
