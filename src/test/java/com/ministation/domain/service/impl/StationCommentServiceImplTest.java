package com.ministation.domain.service.impl;

import com.ministation.common.api.ErrorKind;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.enums.VoteOutcome;
import com.ministation.domain.service.StationCommentService;
import com.ministation.support.StationIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StationCommentServiceImplTest extends StationIntegrationSupport {

    private long stationId;
    private long postId;

    @BeforeEach
    void setUp() {
        stationId = createStation("alice", "Mars Base");
        join(stationId, "bob", "carol", "dave");
        postId = postService.createPost(stationId, "bob", "discussion", "Thread", "talk").id();
    }

    @Test
    void replies_ShouldStopAtDepthThree() {
        StationCommentService.CommentDto root = commentService.createComment(postId, "carol", "d0", null);
        StationCommentService.CommentDto d1 = commentService.createComment(postId, "dave", "d1", root.id());
        StationCommentService.CommentDto d2 = commentService.createComment(postId, "carol", "d2", d1.id());
        StationCommentService.CommentDto d3 = commentService.createComment(postId, "dave", "d3", d2.id());

        assertThat(root.depth()).isZero();
        assertThat(d3.depth()).isEqualTo(StationCommentService.MAX_DEPTH);
        assertBiz(() -> commentService.createComment(postId, "carol", "d4", d3.id()),
                ErrorKind.INVALID_STATE, "max_depth_reached");
        assertThat(postService.getPost(postId).commentCount()).isEqualTo(4);
    }

    @Test
    void parentOnOtherPost_ShouldBeRejected() {
        long otherPost = postService.createPost(stationId, "carol", "discussion", "Other", "x").id();
        long foreign = commentService.createComment(otherPost, "dave", "hi", null).id();

        assertBiz(() -> commentService.createComment(postId, "carol", "reply", foreign),
                ErrorKind.NOT_FOUND, "parent_not_found");
        assertBiz(() -> commentService.createComment(postId, "carol", "reply", 999L),
                ErrorKind.NOT_FOUND, "parent_not_found");
        assertBiz(() -> commentService.createComment(postId, "mallory", "hi", null),
                ErrorKind.PERMISSION_DENIED, "not_member");
        assertBiz(() -> commentService.createComment(12345L, "carol", "hi", null),
                ErrorKind.NOT_FOUND, "post_not_found");
    }

    @Test
    void deleteComment_ShouldRemoveWholeSubtreeAndAdjustCount() {
        StationCommentService.CommentDto root = commentService.createComment(postId, "carol", "root", null);
        StationCommentService.CommentDto a = commentService.createComment(postId, "dave", "a", root.id());
        StationCommentService.CommentDto b = commentService.createComment(postId, "dave", "b", root.id());
        StationCommentService.CommentDto a1 = commentService.createComment(postId, "carol", "a1", a.id());
        commentService.createComment(postId, "bob", "a1x", a1.id());
        long sibling = commentService.createComment(postId, "dave", "sibling", null).id();
        commentService.voteComment(b.id(), "bob", VoteDirection.UP);
        assertThat(postService.getPost(postId).commentCount()).isEqualTo(6);

        int deleted = commentService.deleteComment(root.id(), "carol");

        assertThat(deleted).isEqualTo(5);
        assertThat(postService.getPost(postId).commentCount()).isEqualTo(1);
        assertThat(commentService.listComments(postId, null))
                .extracting(StationCommentService.CommentDto::id)
                .containsExactly(sibling);
        assertThat(jdbcTemplate.queryForObject("select count(*) from t_station_comment_vote", Integer.class)).isZero();
    }

    @Test
    void deleteComment_Permissions() {
        long c = commentService.createComment(postId, "carol", "mine", null).id();

        assertBiz(() -> commentService.deleteComment(c, "dave"), ErrorKind.PERMISSION_DENIED, "no_delete_permission");
        roleService.assignRole(stationId, "alice", "dave", "moderator");
        assertThat(commentService.deleteComment(c, "dave")).isEqualTo(1);
        assertBiz(() -> commentService.deleteComment(c, "carol"), ErrorKind.NOT_FOUND, "comment_not_found");
        assertThat(postService.getPost(postId).commentCount()).isZero();
    }

    @Test
    void editComment_OnlyAuthor() {
        long c = commentService.createComment(postId, "carol", "typo", null).id();

        assertBiz(() -> commentService.editComment(c, "dave", "x"), ErrorKind.PERMISSION_DENIED, "not_author");
        StationCommentService.CommentDto edited = commentService.editComment(c, "carol", "fixed shithead");
        assertThat(edited.content()).isEqualTo("fixed ***");
        assertThat(edited.edited()).isTrue();
    }

    @Test
    void createComment_AwardsDiscussionKarmaExceptToPostAuthor() {
        int bobBefore = karmaService.getKarma("bob").externalKarma();

        commentService.createComment(postId, "carol", "nice", null);
        commentService.createComment(postId, "bob", "thanks", null);

        assertThat(karmaService.getKarma("carol").externalKarma()).isEqualTo(2);
        assertThat(karmaService.getKarma("bob").externalKarma()).isEqualTo(bobBefore);
    }

    @Test
    void threadedComments_RootsByScoreRepliesByTime() {
        StationCommentService.CommentDto first = commentService.createComment(postId, "carol", "first", null);
        clock.advance(Duration.ofMinutes(1));
        StationCommentService.CommentDto second = commentService.createComment(postId, "dave", "second", null);
        clock.advance(Duration.ofMinutes(1));
        StationCommentService.CommentDto r1 = commentService.createComment(postId, "bob", "r1", first.id());
        clock.advance(Duration.ofMinutes(1));
        StationCommentService.CommentDto r2 = commentService.createComment(postId, "dave", "r2", first.id());
        commentService.voteComment(second.id(), "bob", VoteDirection.UP);
        commentService.voteComment(second.id(), "carol", VoteDirection.UP);
        commentService.voteComment(first.id(), "dave", VoteDirection.DOWN);

        List<StationCommentService.CommentNode> tree = commentService.threadedComments(postId);

        assertThat(tree).extracting(n -> n.comment().id()).containsExactly(second.id(), first.id());
        assertThat(tree.get(1).replies()).extracting(n -> n.comment().id()).containsExactly(r1.id(), r2.id());
        assertThat(tree.get(0).comment().score()).isEqualTo(2);
    }

    @Test
    void voteComment_TogglesWithoutKarma() {
        long c = commentService.createComment(postId, "carol", "vote me", null).id();
        int daveBefore = karmaService.getKarma("dave").externalKarma();

        assertThat(commentService.voteComment(c, "dave", VoteDirection.UP).action()).isEqualTo(VoteOutcome.UPVOTED);
        assertThat(commentService.voteComment(c, "dave", VoteDirection.DOWN).action()).isEqualTo(VoteOutcome.CHANGED);
        assertThat(commentService.getCommentVote(c, "dave").direction()).isEqualTo(VoteDirection.DOWN);
        StationCommentService.CommentDto after = commentService.listComments(postId, null).get(0);
        assertThat(after.upvotes()).isZero();
        assertThat(after.downvotes()).isEqualTo(1);
        assertThat(karmaService.getKarma("dave").externalKarma()).isEqualTo(daveBefore);

        assertThat(commentService.voteComment(c, "dave", VoteDirection.DOWN).action()).isEqualTo(VoteOutcome.REMOVED);
        assertThat(commentService.getCommentVote(c, "dave").voted()).isFalse();
    }
}
