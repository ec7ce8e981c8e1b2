package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationCommentEntity;
import com.ministation.domain.enums.VoteDirection;

import java.time.LocalDateTime;
import java.util.List;

public interface StationCommentService extends IService<StationCommentEntity> {

    /** 最大回复深度；根评论 depth=0。 */
    int MAX_DEPTH = 3;

    CommentDto createComment(long postId, String principal, String content, Long parentId);

    CommentDto editComment(long commentId, String principal, String content);

    /**
     * 删除评论及其整棵回复子树，帖子 commentCount 同事务内减去删除总数。返回删除条数。
     */
    int deleteComment(long commentId, String principal);

    List<CommentDto> listComments(long postId, Integer limit);

    /** 根评论按 (up - down) 倒序，回复按时间正序。 */
    List<CommentNode> threadedComments(long postId);

    StationPostService.VoteResult voteComment(long commentId, String principal, VoteDirection direction);

    StationPostService.MyVote getCommentVote(long commentId, String principal);

    record CommentDto(
            Long id,
            Long postId,
            Long stationId,
            String authorPrincipal,
            String content,
            Long parentId,
            Integer depth,
            Integer upvotes,
            Integer downvotes,
            Boolean edited,
            LocalDateTime createdAt,
            LocalDateTime updatedAt
    ) {
        public static CommentDto from(StationCommentEntity c) {
            return new CommentDto(c.getId(), c.getPostId(), c.getStationId(), c.getAuthorPrincipal(), c.getContent(),
                    c.getParentId(), c.getDepth(), c.getUpvotes(), c.getDownvotes(), c.getEdited(), c.getCreatedAt(),
                    c.getUpdatedAt());
        }

        public int score() {
            return (upvotes == null ? 0 : upvotes) - (downvotes == null ? 0 : downvotes);
        }
    }

    record CommentNode(CommentDto comment, List<CommentNode> replies) {
    }
}
