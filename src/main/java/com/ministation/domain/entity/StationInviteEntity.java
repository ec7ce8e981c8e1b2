package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_invite")
public class StationInviteEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    /** 8 位邀请码（uk_station_invite_code）。 */
    private String inviteCode;

    /** 定向邀请：只有该 principal 能兑换。 */
    private String invitedPrincipal;

    private String invitedBy;

    /** 加入后获得的角色 slug（系统或自定义）。 */
    private String roleOnJoin;

    /** 为空表示不限次数。 */
    private Integer maxUses;

    private Integer usedCount;

    private LocalDateTime expiresAt;

    private Boolean active;

    private LocalDateTime createdAt;
}
