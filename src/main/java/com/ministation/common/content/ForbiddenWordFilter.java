package com.ministation.common.content;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 违禁词过滤器（服务端替换），作用于帖子标题/正文与评论。
 *
 * <p>按“忽略大小写的子串”匹配，命中则替换为 {@code ***}；长词优先，避免短词先把长词切碎。</p>
 */
@Slf4j
@Component
public class ForbiddenWordFilter {

    private static final String MASK = "***";

    private final List<String> words;

    @Autowired
    public ForbiddenWordFilter(@Value("classpath:forbidden-words.txt") Resource resource) {
        this(load(resource));
        log.info("forbidden words loaded: {} items", this.words.size());
    }

    ForbiddenWordFilter(List<String> words) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String w : words) {
            if (w != null && !w.isBlank()) {
                normalized.add(w.trim().toLowerCase(Locale.ROOT));
            }
        }
        List<String> sorted = new ArrayList<>(normalized);
        sorted.sort(LONGEST_FIRST);
        this.words = List.copyOf(sorted);
    }

    public String sanitize(String text) {
        if (text == null || text.isEmpty() || words.isEmpty()) {
            return text;
        }
        String out = text;
        for (String w : words) {
            out = replaceIgnoreCase(out, w);
        }
        return out;
    }

    private static String replaceIgnoreCase(String text, String word) {
        String lower = text.toLowerCase(Locale.ROOT);
        int idx = lower.indexOf(word);
        if (idx < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int from = 0;
        while (idx >= 0) {
            sb.append(text, from, idx).append(MASK);
            from = idx + word.length();
            idx = lower.indexOf(word, from);
        }
        sb.append(text, from, text.length());
        return sb.toString();
    }

    private static final Comparator<String> LONGEST_FIRST =
            Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    /** 每行一个词，{@code #} 开头为注释；文件缺失或读取失败时不过滤。 */
    private static List<String> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            return List.of();
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .map(String::trim)
                    .filter(line -> !line.startsWith("#"))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("load forbidden words failed: {}", e.toString());
            return List.of();
        }
    }
}
