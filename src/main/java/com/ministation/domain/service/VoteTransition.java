package com.ministation.domain.service;

import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.enums.VoteOutcome;

/**
 * 一次投票请求对计数与投票行的影响。
 *
 * <ul>
 *   <li>无旧票：新增一票</li>
 *   <li>同方向：撤销（删除投票行）</li>
 *   <li>反方向：翻转，一个计数 -1 另一个 +1，必须在同一条 update 里落库</li>
 * </ul>
 */
public record VoteTransition(VoteOutcome outcome, int upDelta, int downDelta) {

    public static VoteTransition of(VoteDirection existing, VoteDirection requested) {
        if (requested == null) {
            throw new IllegalArgumentException("direction");
        }
        if (existing == null) {
            return requested == VoteDirection.UP
                    ? new VoteTransition(VoteOutcome.UPVOTED, 1, 0)
                    : new VoteTransition(VoteOutcome.DOWNVOTED, 0, 1);
        }
        if (existing == requested) {
            return requested == VoteDirection.UP
                    ? new VoteTransition(VoteOutcome.REMOVED, -1, 0)
                    : new VoteTransition(VoteOutcome.REMOVED, 0, -1);
        }
        return requested == VoteDirection.UP
                ? new VoteTransition(VoteOutcome.CHANGED, 1, -1)
                : new VoteTransition(VoteOutcome.CHANGED, -1, 1);
    }

    public boolean insertsVote() {
        return outcome == VoteOutcome.UPVOTED || outcome == VoteOutcome.DOWNVOTED;
    }

    public boolean removesVote() {
        return outcome == VoteOutcome.REMOVED;
    }

    public boolean flipsVote() {
        return outcome == VoteOutcome.CHANGED;
    }
}
