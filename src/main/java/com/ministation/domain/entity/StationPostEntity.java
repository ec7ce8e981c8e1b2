package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_post")
public class StationPostEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    private String authorPrincipal;

    /** 开放字符串集合：feedback / bug / feature / discussion / question / update ... */
    private String postType;

    private String title;

    private String content;

    private Boolean ownerPost;

    private Boolean pinned;

    private Boolean edited;

    private Integer upvotes;

    private Integer downvotes;

    private Integer commentCount;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
