package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 跨 station 的全局 karma（每个 principal 一行）。
 */
@Data
@TableName("t_karma_ledger")
public class KarmaLedgerEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String principal;

    private Integer externalKarma;

    private Integer uniqueStationsHelped;

    /** 派生值：见 KarmaRewards#promotionBoost。 */
    private Double promotionBoost;

    private LocalDateTime updatedAt;
}
