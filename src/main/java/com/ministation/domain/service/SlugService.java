package com.ministation.domain.service;

import com.ministation.domain.config.StationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * URL 安全的 slug 生成。唯一性由调用方的“检查 + 插入 + 重试后缀”循环保证。
 */
@Service
@RequiredArgsConstructor
public class SlugService {

    public static final String FALLBACK = "station";

    /** 后缀重试上限（base-1 ... base-N）。 */
    public static final int MAX_TRIES = 30;

    private final StationProperties props;

    public String slugify(String raw) {
        return slugify(raw, props.getSlugMaxLength());
    }

    public String candidate(String base, int attempt) {
        return candidate(base, attempt, props.getSlugMaxLength());
    }

    /**
     * 小写；连续的非 [a-z0-9] 折叠成一个 '-'；去掉首尾 '-'；截断；空串回退为 {@value #FALLBACK}。
     */
    public static String slugify(String raw, int maxLen) {
        if (raw == null) {
            return FALLBACK;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean dash = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
                dash = false;
            } else if (!dash) {
                sb.append('-');
                dash = true;
            }
        }
        String s = trimDashes(sb.toString());
        if (s.length() > maxLen) {
            s = trimDashes(s.substring(0, maxLen));
        }
        return s.isEmpty() ? FALLBACK : s;
    }

    /**
     * attempt=0 返回 base 本身，之后是 base-1、base-2 ...；带后缀时先截 base，保证总长不超限。
     */
    public static String candidate(String base, int attempt, int maxLen) {
        if (attempt <= 0) {
            return base;
        }
        String suffix = "-" + attempt;
        String head = base;
        if (head.length() + suffix.length() > maxLen) {
            head = trimDashes(head.substring(0, Math.max(1, maxLen - suffix.length())));
        }
        return head + suffix;
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
