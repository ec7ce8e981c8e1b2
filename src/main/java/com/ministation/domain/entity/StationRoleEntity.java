package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.Capability;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@TableName("t_station_role")
public class StationRoleEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    private String name;

    /** station 内唯一（uk_station_role_slug）。 */
    private String slug;

    private String colorHint;

    /** 逗号分隔的能力 code，见 {@link Capability}。 */
    private String capabilities;

    private Integer priority;

    /** 新成员的入口角色；每个 station 恰好一个（crew）。 */
    private Boolean defaultRole;

    /** 系统角色：不可修改、不可删除。 */
    private Boolean builtin;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public Set<Capability> capabilitySet() {
        return Capability.parseStored(capabilities);
    }
}
