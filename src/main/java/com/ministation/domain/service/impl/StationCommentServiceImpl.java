package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.common.content.ForbiddenWordFilter;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.CommentVoteEntity;
import com.ministation.domain.entity.StationCommentEntity;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationPostEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.mapper.CommentVoteMapper;
import com.ministation.domain.mapper.StationCommentMapper;
import com.ministation.domain.mapper.StationPostMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.KarmaLedgerService;
import com.ministation.domain.service.KarmaRewards;
import com.ministation.domain.service.ModerationStatus;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.StationCommentService;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationPostService;
import com.ministation.domain.service.VoteTransition;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class StationCommentServiceImpl extends ServiceImpl<StationCommentMapper, StationCommentEntity> implements StationCommentService {

    private static final int DEFAULT_LIST_LIMIT = 50;

    private final StationPostService postService;
    private final StationPostMapper postMapper;
    private final CommentVoteMapper commentVoteMapper;
    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final ModerationStatus moderationStatus;
    private final KarmaLedgerService karmaLedgerService;
    private final AuditLogService auditLogService;
    private final ForbiddenWordFilter forbiddenWordFilter;
    private final StationProperties props;
    private final Clock clock;

    public StationCommentServiceImpl(StationPostService postService,
                                     StationPostMapper postMapper,
                                     CommentVoteMapper commentVoteMapper,
                                     StationGuard stationGuard,
                                     PermissionResolver permissionResolver,
                                     ModerationStatus moderationStatus,
                                     KarmaLedgerService karmaLedgerService,
                                     AuditLogService auditLogService,
                                     ForbiddenWordFilter forbiddenWordFilter,
                                     StationProperties props,
                                     Clock clock) {
        this.postService = postService;
        this.postMapper = postMapper;
        this.commentVoteMapper = commentVoteMapper;
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.moderationStatus = moderationStatus;
        this.karmaLedgerService = karmaLedgerService;
        this.auditLogService = auditLogService;
        this.forbiddenWordFilter = forbiddenWordFilter;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public CommentDto createComment(long postId, String principal, String content, Long parentId) {
        StationPostEntity post = postService.requirePost(postId);
        StationEntity station = stationGuard.requireActive(post.getStationId());
        if (permissionResolver.findMember(station.getId(), principal) == null) {
            throw BizException.forbidden("not_member");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (moderationStatus.isMuted(station.getId(), principal, now)) {
            throw BizException.forbidden("muted");
        }
        String text = forbiddenWordFilter.sanitize(requireContent(content));

        int depth = 0;
        if (parentId != null) {
            StationCommentEntity parent = this.getById(parentId);
            if (parent == null || parent.getPostId() == null || parent.getPostId() != postId) {
                throw BizException.notFound("parent_not_found");
            }
            depth = (parent.getDepth() == null ? 0 : parent.getDepth()) + 1;
            if (depth > MAX_DEPTH) {
                throw BizException.invalidState("max_depth_reached");
            }
        }

        StationCommentEntity c = new StationCommentEntity();
        c.setPostId(postId);
        c.setStationId(station.getId());
        c.setAuthorPrincipal(principal);
        c.setContent(text);
        c.setParentId(parentId);
        c.setDepth(depth);
        c.setUpvotes(0);
        c.setDownvotes(0);
        c.setEdited(false);
        c.setCreatedAt(now);
        this.save(c);

        postMapper.adjustCommentCount(postId, 1);
        if (!principal.equals(post.getAuthorPrincipal())) {
            karmaLedgerService.award(station, principal, KarmaRewards.TYPE_DISCUSSION);
        }
        return CommentDto.from(c);
    }

    @Transactional
    @Override
    public CommentDto editComment(long commentId, String principal, String content) {
        StationCommentEntity c = requireComment(commentId);
        if (principal == null || !principal.equals(c.getAuthorPrincipal())) {
            throw BizException.forbidden("not_author");
        }
        this.update(new LambdaUpdateWrapper<StationCommentEntity>()
                .eq(StationCommentEntity::getId, commentId)
                .set(StationCommentEntity::getContent, forbiddenWordFilter.sanitize(requireContent(content)))
                .set(StationCommentEntity::getEdited, true)
                .set(StationCommentEntity::getUpdatedAt, LocalDateTime.now(clock)));
        return CommentDto.from(this.getById(commentId));
    }

    @Transactional
    @Override
    public int deleteComment(long commentId, String principal) {
        StationCommentEntity c = requireComment(commentId);
        StationEntity station = stationGuard.requireStation(c.getStationId());
        boolean author = principal != null && principal.equals(c.getAuthorPrincipal());
        if (!author && !StationGuard.isOwner(station, principal)) {
            permissionResolver.require(station.getId(), principal, Capability.DELETE, "no_delete_permission");
        }

        List<Object> subtree = collectSubtree(commentId);
        commentVoteMapper.delete(new LambdaQueryWrapper<CommentVoteEntity>()
                .in(CommentVoteEntity::getCommentId, subtree));
        int deleted = baseMapper.delete(new LambdaQueryWrapper<StationCommentEntity>()
                .in(StationCommentEntity::getId, subtree));
        // 计数与删除在同一事务：不会出现子树删了、计数没减的中间态
        postMapper.adjustCommentCount(c.getPostId(), -deleted);

        if (!author) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("commentId", String.valueOf(commentId));
            details.put("postId", String.valueOf(c.getPostId()));
            details.put("deleted", deleted);
            auditLogService.record(station.getId(), AuditAction.COMMENT_DELETE, principal, c.getAuthorPrincipal(), details);
        }
        return deleted;
    }

    /**
     * 按层展开：frontier 是上一层的 id，每轮查一次它们的直接回复。
     */
    private List<Object> collectSubtree(long rootId) {
        List<Object> all = new ArrayList<>();
        all.add(rootId);
        List<Object> frontier = List.of(rootId);
        while (!frontier.isEmpty()) {
            List<Object> children = baseMapper.selectObjs(new LambdaQueryWrapper<StationCommentEntity>()
                    .select(StationCommentEntity::getId)
                    .in(StationCommentEntity::getParentId, frontier));
            all.addAll(children);
            frontier = children;
        }
        return all;
    }

    @Override
    public List<CommentDto> listComments(long postId, Integer limit) {
        postService.requirePost(postId);
        int n = props.clampLimit(limit, DEFAULT_LIST_LIMIT);
        List<StationCommentEntity> rows = this.list(new LambdaQueryWrapper<StationCommentEntity>()
                .eq(StationCommentEntity::getPostId, postId)
                .orderByAsc(StationCommentEntity::getCreatedAt)
                .orderByAsc(StationCommentEntity::getId)
                .last("limit " + n));
        List<CommentDto> out = new ArrayList<>(rows.size());
        for (StationCommentEntity c : rows) {
            out.add(CommentDto.from(c));
        }
        return out;
    }

    @Override
    public List<CommentNode> threadedComments(long postId) {
        postService.requirePost(postId);
        List<StationCommentEntity> rows = this.list(new LambdaQueryWrapper<StationCommentEntity>()
                .eq(StationCommentEntity::getPostId, postId)
                .orderByAsc(StationCommentEntity::getCreatedAt)
                .orderByAsc(StationCommentEntity::getId));

        Map<Long, CommentNode> byId = new HashMap<>();
        for (StationCommentEntity c : rows) {
            byId.put(c.getId(), new CommentNode(CommentDto.from(c), new ArrayList<>()));
        }
        List<CommentNode> roots = new ArrayList<>();
        for (StationCommentEntity c : rows) {
            CommentNode node = byId.get(c.getId());
            if (c.getParentId() == null) {
                roots.add(node);
                continue;
            }
            CommentNode parent = byId.get(c.getParentId());
            if (parent != null) {
                parent.replies().add(node);
            }
        }
        roots.sort(Comparator.comparingInt((CommentNode n) -> n.comment().score()).reversed());
        return roots;
    }

    @Transactional
    @Override
    public StationPostService.VoteResult voteComment(long commentId, String principal, VoteDirection direction) {
        if (direction == null) {
            throw BizException.validation("bad_direction");
        }
        StationCommentEntity c = requireComment(commentId);
        if (permissionResolver.findMember(c.getStationId(), principal) == null) {
            throw BizException.forbidden("not_member");
        }

        CommentVoteEntity existing = findVote(commentId, principal);
        VoteTransition t = VoteTransition.of(existing == null ? null : existing.getDirection(), direction);
        LocalDateTime now = LocalDateTime.now(clock);
        if (t.insertsVote()) {
            CommentVoteEntity v = new CommentVoteEntity();
            v.setCommentId(commentId);
            v.setVoterPrincipal(principal);
            v.setDirection(direction);
            v.setCreatedAt(now);
            try {
                commentVoteMapper.insert(v);
            } catch (DuplicateKeyException e) {
                throw BizException.conflict("vote_conflict");
            }
        } else if (t.removesVote()) {
            commentVoteMapper.deleteById(existing.getId());
        } else {
            commentVoteMapper.update(null, new LambdaUpdateWrapper<CommentVoteEntity>()
                    .eq(CommentVoteEntity::getId, existing.getId())
                    .set(CommentVoteEntity::getDirection, direction)
                    .set(CommentVoteEntity::getCreatedAt, now));
        }
        baseMapper.applyVoteDelta(commentId, t.upDelta(), t.downDelta());

        StationCommentEntity after = this.getById(commentId);
        return new StationPostService.VoteResult(t.outcome(), after.getUpvotes(), after.getDownvotes());
    }

    @Override
    public StationPostService.MyVote getCommentVote(long commentId, String principal) {
        requireComment(commentId);
        CommentVoteEntity v = findVote(commentId, principal);
        return v == null ? new StationPostService.MyVote(false, null) : new StationPostService.MyVote(true, v.getDirection());
    }

    private StationCommentEntity requireComment(long commentId) {
        StationCommentEntity c = commentId <= 0 ? null : this.getById(commentId);
        if (c == null) {
            throw BizException.notFound("comment_not_found");
        }
        return c;
    }

    private CommentVoteEntity findVote(long commentId, String principal) {
        if (principal == null || principal.isBlank()) {
            return null;
        }
        return commentVoteMapper.selectOne(new LambdaQueryWrapper<CommentVoteEntity>()
                .eq(CommentVoteEntity::getCommentId, commentId)
                .eq(CommentVoteEntity::getVoterPrincipal, principal)
                .last("limit 1"));
    }

    private String requireContent(String content) {
        String c = content == null ? "" : content.trim();
        if (c.isEmpty()) {
            throw BizException.validation("missing_content");
        }
        if (c.length() > props.getMaxCommentLength()) {
            throw BizException.validation("content_too_long");
        }
        return c;
    }
}
