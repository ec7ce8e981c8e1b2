package com.ministation.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum StationStatus {

    ACTIVE("active"),

    /** 归档后只读：不能加入、发帖、评论、兑换邀请 */
    ARCHIVED("archived");

    @EnumValue
    @JsonValue
    private final String code;
}
