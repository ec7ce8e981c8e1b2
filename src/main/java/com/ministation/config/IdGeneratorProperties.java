package com.ministation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.OptionalLong;

/**
 * 雪花 ID 参数（{@code station.id.*}）。
 *
 * <p>workerId 为负表示未显式配置，此时从 instanceId 末尾的数字推导：{@code station-3} 对应 workerId 2。</p>
 */
@Data
@ConfigurationProperties(prefix = "station.id")
public class IdGeneratorProperties {

    private long datacenterId = 1;

    private long workerId = -1;

    private String instanceId;

    OptionalLong effectiveWorkerId() {
        if (workerId >= 0) {
            return OptionalLong.of(Math.floorMod(workerId, 32L));
        }
        long fromInstance = trailingNumber(instanceId);
        if (fromInstance < 1) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.floorMod(fromInstance - 1, 32L));
    }

    long effectiveDatacenterId() {
        return Math.floorMod(datacenterId, 32L);
    }

    /** 取字符串中最后一段连续数字；没有则返回 -1。 */
    static long trailingNumber(String s) {
        if (s == null) {
            return -1;
        }
        int end = s.length();
        while (end > 0 && !Character.isDigit(s.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && Character.isDigit(s.charAt(start - 1))) {
            start--;
        }
        if (start == end || end - start > 18) {
            return -1;
        }
        return Long.parseLong(s.substring(start, end));
    }
}
