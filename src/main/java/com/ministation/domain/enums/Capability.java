package com.ministation.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * station 内的单项能力。自定义角色在库里存逗号分隔的 code（t_station_role.capabilities）。
 */
@Getter
@RequiredArgsConstructor
public enum Capability {

    VIEW("view"),

    POST("post"),

    PIN("pin"),

    DELETE("delete"),

    SETTINGS("settings"),

    PROMOTE("promote"),

    BAN("ban"),

    ROLES("roles");

    @JsonValue
    private final String code;

    public static Capability fromCode(String code) {
        if (code == null) {
            return null;
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Capability cap : values()) {
            if (cap.code.equals(c)) {
                return cap;
            }
        }
        return null;
    }

    /**
     * 解析客户端传入的能力列表；出现未知 code 返回 null，由调用方决定报错。
     */
    public static Set<Capability> fromCodes(Collection<String> codes) {
        Set<Capability> out = EnumSet.noneOf(Capability.class);
        if (codes == null) {
            return out;
        }
        for (String code : codes) {
            Capability cap = fromCode(code);
            if (cap == null) {
                return null;
            }
            out.add(cap);
        }
        return out;
    }

    /** 解析库里的逗号分隔串；未知项忽略。 */
    public static Set<Capability> parseStored(String csv) {
        Set<Capability> out = EnumSet.noneOf(Capability.class);
        if (csv == null || csv.isBlank()) {
            return out;
        }
        for (String part : csv.split(",")) {
            Capability cap = fromCode(part);
            if (cap != null) {
                out.add(cap);
            }
        }
        return out;
    }

    public static String toStored(Set<Capability> caps) {
        if (caps == null || caps.isEmpty()) {
            return "";
        }
        List<String> codes = new ArrayList<>();
        for (Capability cap : values()) {
            if (caps.contains(cap)) {
                codes.add(cap.code);
            }
        }
        return String.join(",", codes);
    }
}
