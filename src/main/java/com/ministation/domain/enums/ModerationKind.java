package com.ministation.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 管理动作类型（t_station_moderation.kind）。
 */
@Getter
@RequiredArgsConstructor
public enum ModerationKind {

    /** 封禁：移除成员身份；expiresAt 为空表示永久 */
    BAN("ban"),

    /** 禁言：保留成员身份，只禁止发帖/评论；必须有 expiresAt */
    MUTE("mute");

    @EnumValue
    @JsonValue
    private final String code;
}
