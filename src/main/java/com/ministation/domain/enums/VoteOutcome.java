package com.ministation.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 一次投票请求的结果（返回给客户端的 action 字段）。
 */
@Getter
@RequiredArgsConstructor
public enum VoteOutcome {

    UPVOTED("upvoted"),

    DOWNVOTED("downvoted"),

    /** 同方向重复投票：撤销 */
    REMOVED("removed"),

    /** 反方向投票：翻转 */
    CHANGED("changed");

    @JsonValue
    private final String action;
}
