package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.VoteDirection;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_comment_vote")
public class CommentVoteEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long commentId;

    private String voterPrincipal;

    private VoteDirection direction;

    private LocalDateTime createdAt;
}
