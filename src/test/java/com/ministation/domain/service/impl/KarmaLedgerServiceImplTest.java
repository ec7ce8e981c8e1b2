package com.ministation.domain.service.impl;

import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.service.KarmaLedgerService;
import com.ministation.support.StationIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KarmaLedgerServiceImplTest extends StationIntegrationSupport {

    private long mars;
    private long venus;

    @BeforeEach
    void setUp() {
        mars = createStation("alice", "Mars Base");
        venus = createStation("bob", "Venus Base");
        join(mars, "bob", "carol");
        join(venus, "carol");
    }

    @Test
    void award_FeedbackFromZero_ShouldKeepBoostAtOne() {
        assertThat(karmaService.award(station(mars), "carol", "feedback")).isEqualTo(5);

        KarmaLedgerService.KarmaDto k = karmaService.getKarma("carol");
        assertThat(k.externalKarma()).isEqualTo(5);
        assertThat(k.promotionBoost()).isEqualTo(1.0);
        assertThat(k.uniqueStationsHelped()).isEqualTo(1);
        assertThat(memberService.getMembership(mars, "carol").karmaEarnedHere()).isEqualTo(5);
    }

    @Test
    void award_SkipsOwnerZeroPointTypesAndNonMembers() {
        assertThat(karmaService.award(station(mars), "alice", "bug")).isZero();
        assertThat(karmaService.award(station(mars), "carol", "update")).isZero();
        assertThat(karmaService.award(station(mars), "mallory", "bug")).isZero();

        assertThat(karmaService.getKarma("alice").externalKarma()).isZero();
        assertThat(karmaService.getKarma("mallory").promotionBoost()).isEqualTo(1.0);
        assertThat(karmaService.count()).isZero();
    }

    @Test
    void award_ShouldTrackStationsHelpedAcrossStations() {
        karmaService.award(station(mars), "carol", "bug");
        karmaService.award(station(mars), "carol", "question");
        karmaService.award(station(venus), "carol", "feature");

        KarmaLedgerService.KarmaDto k = karmaService.getKarma("carol");
        assertThat(k.externalKarma()).isEqualTo(15);
        assertThat(k.uniqueStationsHelped()).isEqualTo(2);

        // bob 在自己的 venus 不计分，只算 mars
        karmaService.award(station(mars), "bob", "discussion");
        assertThat(karmaService.getKarma("bob").uniqueStationsHelped()).isEqualTo(1);
    }

    @Test
    void recalculate_ShouldRebuildFromMemberships() {
        karmaService.award(station(mars), "carol", "bug");
        jdbcTemplate.update("update t_station_member set karma_earned_here = 480 where station_id = ? and principal = ?",
                mars, "carol");
        jdbcTemplate.update("update t_station_member set karma_earned_here = 20 where station_id = ? and principal = ?",
                venus, "carol");

        KarmaLedgerService.KarmaDto k = karmaService.recalculate("carol");

        assertThat(k.externalKarma()).isEqualTo(500);
        assertThat(k.promotionBoost()).isCloseTo(2.0, within(1e-9));
        assertThat(k.uniqueStationsHelped()).isEqualTo(2);
    }

    @Test
    void leaderboardAndBreakdown() {
        karmaService.award(station(mars), "carol", "bug");
        karmaService.award(station(mars), "bob", "question");
        karmaService.award(station(venus), "carol", "vote");

        List<KarmaLedgerService.KarmaDto> board = karmaService.leaderboard(10);
        assertThat(board).extracting(KarmaLedgerService.KarmaDto::principal).containsExactly("carol", "bob");
        assertThat(board.get(0).externalKarma()).isEqualTo(9);

        List<KarmaLedgerService.StationKarmaDto> bob = karmaService.breakdown("bob");
        assertThat(bob).hasSize(2);
        assertThat(bob.get(0).stationId()).isEqualTo(mars);
        assertThat(bob.get(0).karmaEarnedHere()).isEqualTo(2);
        assertThat(bob.get(1).owner()).isTrue();
        assertThat(karmaService.breakdown("nobody")).isEmpty();
    }

    private StationEntity station(long id) {
        return stationService.getById(id);
    }
}
