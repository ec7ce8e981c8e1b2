package com.ministation.domain.service.impl;

import com.ministation.common.api.ErrorKind;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.enums.VoteOutcome;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.StationPostService;
import com.ministation.support.StationIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StationPostServiceImplTest extends StationIntegrationSupport {

    private long stationId;

    @BeforeEach
    void setUp() {
        stationId = createStation("alice", "Mars Base");
        join(stationId, "bob", "carol");
    }

    @Test
    void createPost_ShouldCountAndAwardKarma() {
        StationPostService.PostDto post = postService.createPost(stationId, "bob", "Feedback", "Oxygen", "needs more");

        assertThat(post.type()).isEqualTo("feedback");
        assertThat(post.ownerPost()).isFalse();
        assertThat(post.upvotes()).isZero();
        assertThat(stationService.get(stationId).postCount()).isEqualTo(1);
        assertThat(memberService.getMembership(stationId, "bob").karmaEarnedHere()).isEqualTo(5);
        assertThat(karmaService.getKarma("bob").externalKarma()).isEqualTo(5);
        assertThat(karmaService.getKarma("bob").uniqueStationsHelped()).isEqualTo(1);
    }

    @Test
    void createPost_Guards() {
        assertBiz(() -> postService.createPost(stationId, "mallory", "bug", "x", "y"),
                ErrorKind.PERMISSION_DENIED, "not_member");
        assertBiz(() -> postService.createPost(stationId, "bob", "update", "News", "..."),
                ErrorKind.PERMISSION_DENIED, "update_owner_only");
        assertBiz(() -> postService.createPost(stationId, "bob", "bug", " ", "y"),
                ErrorKind.VALIDATION, "missing_title");
        assertBiz(() -> postService.createPost(stationId, "bob", "bug", "x", ""),
                ErrorKind.VALIDATION, "missing_content");
        assertBiz(() -> postService.createPost(stationId, "bob", " ", "x", "y"),
                ErrorKind.VALIDATION, "missing_type");
        assertThat(stationService.get(stationId).postCount()).isZero();

        StationPostService.PostDto update = postService.createPost(stationId, "alice", "update", "News", "we moved");
        assertThat(update.ownerPost()).isTrue();
        assertThat(karmaService.getKarma("alice").externalKarma()).isZero();

        stationService.archive(stationId, "alice");
        assertBiz(() -> postService.createPost(stationId, "bob", "bug", "x", "y"),
                ErrorKind.INVALID_STATE, "station_not_active");
    }

    @Test
    void createPost_ShouldMaskForbiddenWords() {
        StationPostService.PostDto post = postService.createPost(stationId, "bob", "discussion",
                "ScamCoin alert", "ignore the free-crypto-giveaway");

        assertThat(post.title()).isEqualTo("*** alert");
        assertThat(post.content()).isEqualTo("ignore the ***");
    }

    @Test
    void editPost_OnlyAuthor() {
        StationPostService.PostDto post = postService.createPost(stationId, "bob", "question", "Q", "why?");

        assertBiz(() -> postService.editPost(post.id(), "alice", "hacked", null),
                ErrorKind.PERMISSION_DENIED, "not_author");
        StationPostService.PostDto edited = postService.editPost(post.id(), "bob", null, "why not?");
        assertThat(edited.edited()).isTrue();
        assertThat(edited.title()).isEqualTo("Q");
        assertThat(edited.content()).isEqualTo("why not?");
    }

    @Test
    void votePost_SameDirectionTwice_ShouldCancel() {
        long postId = postService.createPost(stationId, "bob", "discussion", "T", "C").id();

        StationPostService.VoteResult first = postService.votePost(postId, "carol", VoteDirection.UP);
        assertThat(first.action()).isEqualTo(VoteOutcome.UPVOTED);
        assertThat(first.upvotes()).isEqualTo(1);

        StationPostService.VoteResult second = postService.votePost(postId, "carol", VoteDirection.UP);
        assertThat(second.action()).isEqualTo(VoteOutcome.REMOVED);
        assertThat(second.upvotes()).isZero();
        assertThat(second.downvotes()).isZero();
        assertThat(postService.getPostVote(postId, "carol").voted()).isFalse();
    }

    @Test
    void votePost_OppositeDirection_ShouldFlipOneUnit() {
        long postId = postService.createPost(stationId, "bob", "discussion", "T", "C").id();
        postService.votePost(postId, "alice", VoteDirection.UP);
        postService.votePost(postId, "carol", VoteDirection.UP);

        StationPostService.VoteResult flipped = postService.votePost(postId, "carol", VoteDirection.DOWN);
        assertThat(flipped.action()).isEqualTo(VoteOutcome.CHANGED);
        assertThat(flipped.upvotes()).isEqualTo(1);
        assertThat(flipped.downvotes()).isEqualTo(1);
        assertThat(postService.getPostVote(postId, "carol").direction()).isEqualTo(VoteDirection.DOWN);

        assertBiz(() -> postService.votePost(postId, "mallory", VoteDirection.UP),
                ErrorKind.PERMISSION_DENIED, "not_member");
    }

    @Test
    void votePost_UpvoteAwardsVoterOnce() {
        long postId = postService.createPost(stationId, "bob", "discussion", "T", "C").id();

        postService.votePost(postId, "carol", VoteDirection.UP);
        assertThat(karmaService.getKarma("carol").externalKarma()).isEqualTo(1);

        // 撤销、翻转、给自己投票都不加分
        postService.votePost(postId, "carol", VoteDirection.UP);
        postService.votePost(postId, "carol", VoteDirection.DOWN);
        postService.votePost(postId, "bob", VoteDirection.UP);
        assertThat(karmaService.getKarma("carol").externalKarma()).isEqualTo(1);
        assertThat(karmaService.getKarma("bob").externalKarma()).isEqualTo(2);
    }

    @Test
    void pinPost_RequiresPinAndSortsFirst() {
        long older = postService.createPost(stationId, "bob", "discussion", "Old", "C").id();
        clock.advance(Duration.ofMinutes(5));
        long newer = postService.createPost(stationId, "carol", "discussion", "New", "C").id();

        assertThat(postService.listPosts(stationId, null, null))
                .extracting(StationPostService.PostDto::id).containsExactly(newer, older);

        assertBiz(() -> postService.pinPost(older, "bob", true), ErrorKind.PERMISSION_DENIED, "no_pin_permission");
        roleService.assignRole(stationId, "alice", "carol", "moderator");
        postService.pinPost(older, "carol", true);

        assertThat(postService.listPosts(stationId, null, null))
                .extracting(StationPostService.PostDto::id).containsExactly(older, newer);
        assertThat(postService.listPosts(stationId, "bug", null)).isEmpty();
    }

    @Test
    void deletePost_ShouldCascadeAndAuditModeratorDeletes() {
        long postId = postService.createPost(stationId, "bob", "bug", "Crash", "on launch").id();
        long commentId = commentService.createComment(postId, "carol", "same here", null).id();
        commentService.voteComment(commentId, "bob", VoteDirection.UP);
        postService.votePost(postId, "carol", VoteDirection.UP);

        assertBiz(() -> postService.deletePost(postId, "carol"), ErrorKind.PERMISSION_DENIED, "no_delete_permission");

        roleService.assignRole(stationId, "alice", "carol", "moderator");
        postService.deletePost(postId, "carol");

        assertBiz(() -> postService.getPost(postId), ErrorKind.NOT_FOUND, "post_not_found");
        assertThat(stationService.get(stationId).postCount()).isZero();
        assertThat(commentService.count()).isZero();
        assertThat(jdbcTemplate.queryForObject("select count(*) from t_station_post_vote", Integer.class)).isZero();
        assertThat(jdbcTemplate.queryForObject("select count(*) from t_station_comment_vote", Integer.class)).isZero();
        assertThat(auditLogService.list(stationId, "alice", null))
                .extracting(AuditLogService.AuditEntryDto::action)
                .contains(AuditAction.POST_DELETE);
    }

    @Test
    void deletePost_ByAuthor_IsNotAudited() {
        long postId = postService.createPost(stationId, "bob", "bug", "Crash", "on launch").id();

        postService.deletePost(postId, "bob");

        assertThat(stationService.get(stationId).postCount()).isZero();
        assertThat(auditLogService.list(stationId, "alice", null)).isEmpty();
    }
}
