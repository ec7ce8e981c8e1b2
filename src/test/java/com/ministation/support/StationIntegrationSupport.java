package com.ministation.support;

import com.ministation.StationApplication;
import com.ministation.common.api.BizException;
import com.ministation.common.api.ErrorKind;
import com.ministation.domain.service.KarmaLedgerService;
import com.ministation.domain.service.ModerationService;
import com.ministation.domain.service.StationCommentService;
import com.ministation.domain.service.StationInviteService;
import com.ministation.domain.service.StationMemberService;
import com.ministation.domain.service.StationPostService;
import com.ministation.domain.service.StationRoleService;
import com.ministation.domain.service.StationService;
import com.ministation.domain.service.AuditLogService;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * H2（MySQL 模式）+ Flyway 的整库测试基类。每个用例前清空所有表并把时钟拨回起点。
 */
@SpringBootTest(classes = {StationApplication.class, TestClockConfig.class})
@ActiveProfiles("test")
public abstract class StationIntegrationSupport {

    private static final List<String> TABLES = List.of(
            "t_station", "t_station_role", "t_station_member", "t_station_moderation",
            "t_station_invite", "t_station_audit_log", "t_station_post", "t_station_comment",
            "t_station_post_vote", "t_station_comment_vote", "t_karma_ledger");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected StationService stationService;

    @Autowired
    protected StationMemberService memberService;

    @Autowired
    protected StationRoleService roleService;

    @Autowired
    protected ModerationService moderationService;

    @Autowired
    protected StationInviteService inviteService;

    @Autowired
    protected StationPostService postService;

    @Autowired
    protected StationCommentService commentService;

    @Autowired
    protected KarmaLedgerService karmaService;

    @Autowired
    protected AuditLogService auditLogService;

    @BeforeEach
    void resetStore() {
        for (String table : TABLES) {
            jdbcTemplate.update("delete from " + table);
        }
        clock.set(TestClockConfig.START);
    }

    protected long createStation(String owner, String name) {
        return stationService.create(owner, name, "test station").stationId();
    }

    protected void join(long stationId, String... principals) {
        for (String p : principals) {
            memberService.join(stationId, p);
        }
    }

    protected int memberCount(long stationId) {
        return stationService.get(stationId).memberCount();
    }

    protected static void assertBiz(ThrowableAssert.ThrowingCallable call, ErrorKind kind, String reason) {
        assertThatThrownBy(call)
                .isInstanceOf(BizException.class)
                .hasMessage(reason)
                .extracting(e -> ((BizException) e).getKind())
                .isEqualTo(kind);
    }
}
