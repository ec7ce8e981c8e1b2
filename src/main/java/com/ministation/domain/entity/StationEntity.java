package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.StationStatus;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station")
public class StationEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** URL 安全、全局唯一（uk_station_slug）。 */
    private String slug;

    private String name;

    private String description;

    /** captain：唯一且不可转让。 */
    private String ownerPrincipal;

    private Integer memberCount;

    private Integer postCount;

    private StationStatus status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
