package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_comment")
public class StationCommentEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long postId;

    private Long stationId;

    private String authorPrincipal;

    private String content;

    private Long parentId;

    /** 0..3，等于 parent.depth + 1。 */
    private Integer depth;

    private Integer upvotes;

    private Integer downvotes;

    private Boolean edited;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
