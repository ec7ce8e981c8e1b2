package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.VoteDirection;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_station_post_vote")
public class PostVoteEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long postId;

    private String voterPrincipal;

    private VoteDirection direction;

    private LocalDateTime createdAt;
}
