package com.ministation.domain.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KarmaRewardsTest {

    @Test
    void pointsFor_ShouldFollowRewardTable() {
        assertThat(KarmaRewards.pointsFor("feedback")).isEqualTo(5);
        assertThat(KarmaRewards.pointsFor("Bug")).isEqualTo(8);
        assertThat(KarmaRewards.pointsFor("feature")).isEqualTo(5);
        assertThat(KarmaRewards.pointsFor("discussion")).isEqualTo(2);
        assertThat(KarmaRewards.pointsFor("question")).isEqualTo(2);
        assertThat(KarmaRewards.pointsFor("vote")).isEqualTo(1);
        assertThat(KarmaRewards.pointsFor("update")).isZero();
    }

    @Test
    void pointsFor_UnknownType_ShouldUseDefault() {
        assertThat(KarmaRewards.pointsFor("meme")).isEqualTo(KarmaRewards.DEFAULT_POINTS);
        assertThat(KarmaRewards.pointsFor(null)).isEqualTo(KarmaRewards.DEFAULT_POINTS);
    }

    @Test
    void promotionBoost_ShouldHaveDiminishingReturns() {
        assertThat(KarmaRewards.promotionBoost(0)).isEqualTo(1.0);
        assertThat(KarmaRewards.promotionBoost(-3)).isEqualTo(1.0);
        assertThat(KarmaRewards.promotionBoost(5)).isEqualTo(1.0);
        assertThat(KarmaRewards.promotionBoost(50)).isEqualTo(1.0);
        assertThat(KarmaRewards.promotionBoost(500)).isCloseTo(2.0, within(1e-9));
        assertThat(KarmaRewards.promotionBoost(5_000)).isCloseTo(3.0, within(1e-9));
        assertThat(KarmaRewards.promotionBoost(5_000_000)).isEqualTo(KarmaRewards.MAX_BOOST);
    }
}
