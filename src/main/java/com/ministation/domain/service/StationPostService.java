package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationPostEntity;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.enums.VoteOutcome;

import java.time.LocalDateTime;
import java.util.List;

public interface StationPostService extends IService<StationPostEntity> {

    PostDto createPost(long stationId, String author, String type, String title, String content);

    /** 只有作者能编辑。 */
    PostDto editPost(long postId, String principal, String title, String content);

    void pinPost(long postId, String principal, boolean pinned);

    /** 作者、owner 或持有 delete 能力的成员；帖子下的评论与投票一并删除。 */
    void deletePost(long postId, String principal);

    PostDto getPost(long postId);

    /** 置顶优先，其次按时间倒序；type 为空表示全部。 */
    List<PostDto> listPosts(long stationId, String type, Integer limit);

    VoteResult votePost(long postId, String principal, VoteDirection direction);

    MyVote getPostVote(long postId, String principal);

    StationPostEntity requirePost(long postId);

    record PostDto(
            Long id,
            Long stationId,
            String authorPrincipal,
            String type,
            String title,
            String content,
            Boolean ownerPost,
            Boolean pinned,
            Boolean edited,
            Integer upvotes,
            Integer downvotes,
            Integer commentCount,
            LocalDateTime createdAt,
            LocalDateTime updatedAt
    ) {
        public static PostDto from(StationPostEntity p) {
            return new PostDto(p.getId(), p.getStationId(), p.getAuthorPrincipal(), p.getPostType(), p.getTitle(),
                    p.getContent(), p.getOwnerPost(), p.getPinned(), p.getEdited(), p.getUpvotes(), p.getDownvotes(),
                    p.getCommentCount(), p.getCreatedAt(), p.getUpdatedAt());
        }
    }

    /** 投票后的结果与最新计数（帖子、评论共用）。 */
    record VoteResult(VoteOutcome action, Integer upvotes, Integer downvotes) {
    }

    record MyVote(boolean voted, VoteDirection direction) {
    }
}
