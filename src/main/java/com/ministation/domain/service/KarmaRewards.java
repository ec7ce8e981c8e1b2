package com.ministation.domain.service;

import java.util.Locale;
import java.util.Map;

/**
 * karma 奖励表与 promotionBoost 曲线。
 */
public final class KarmaRewards {

    public static final String TYPE_VOTE = "vote";
    public static final String TYPE_DISCUSSION = "discussion";
    public static final String TYPE_UPDATE = "update";

    /** 未登记的帖子类型。 */
    public static final int DEFAULT_POINTS = 2;

    public static final double MAX_BOOST = 3.0;

    private static final Map<String, Integer> REWARDS = Map.of(
            "feedback", 5,
            "bug", 8,
            "feature", 5,
            TYPE_DISCUSSION, 2,
            "question", 2,
            TYPE_VOTE, 1,
            // update 只有 owner 能发，owner 本来就不拿 karma
            TYPE_UPDATE, 0
    );

    private KarmaRewards() {
    }

    public static int pointsFor(String type) {
        if (type == null) {
            return DEFAULT_POINTS;
        }
        Integer p = REWARDS.get(type.trim().toLowerCase(Locale.ROOT));
        return p == null ? DEFAULT_POINTS : p;
    }

    /**
     * karma ≤ 0 → 1；否则 min(3, 1 + log10(max(1, karma / 50)))。
     */
    public static double promotionBoost(long externalKarma) {
        if (externalKarma <= 0) {
            return 1.0;
        }
        double ratio = Math.max(1.0, externalKarma / 50.0);
        return Math.min(MAX_BOOST, 1.0 + Math.log10(ratio));
    }
}
