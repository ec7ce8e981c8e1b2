package com.ministation.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 审计日志动作（t_station_audit_log.audit_action）。
 */
@Getter
@RequiredArgsConstructor
public enum AuditAction {

    STATION_UPDATE("station_update"),
    STATION_ARCHIVE("station_archive"),

    ROLE_CREATE("role_create"),
    ROLE_UPDATE("role_update"),
    ROLE_DELETE("role_delete"),
    ROLE_ASSIGN("role_assign"),

    MEMBER_BAN("member_ban"),
    MEMBER_UNBAN("member_unban"),
    MEMBER_MUTE("member_mute"),
    MEMBER_UNMUTE("member_unmute"),

    INVITE_CREATE("invite_create"),
    INVITE_REVOKE("invite_revoke"),
    MEMBER_JOIN_INVITE("member_join_invite"),

    POST_PIN("post_pin"),
    POST_DELETE("post_delete"),
    COMMENT_DELETE("comment_delete");

    @EnumValue
    @JsonValue
    private final String code;
}
