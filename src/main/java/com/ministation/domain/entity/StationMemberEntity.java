package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.SystemRole;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_member")
public class StationMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    private String principal;

    /** 系统角色；持有自定义角色时固定为 crew，由 customRoleId 决定能力。 */
    private SystemRole systemRole;

    /** 自定义角色引用；为空表示按 systemRole 判定。 */
    private Long customRoleId;

    private Integer karmaEarnedHere;

    private LocalDateTime joinedAt;

    private LocalDateTime updatedAt;
}
