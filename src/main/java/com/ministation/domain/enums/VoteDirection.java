package com.ministation.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum VoteDirection {

    UP("up"),

    DOWN("down");

    @EnumValue
    @JsonValue
    private final String code;

    public VoteDirection opposite() {
        return this == UP ? DOWN : UP;
    }

    public static VoteDirection fromString(String s) {
        if (s == null) {
            return null;
        }
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (VoteDirection d : values()) {
            if (d.code.equals(v)) {
                return d;
            }
        }
        return null;
    }
}
