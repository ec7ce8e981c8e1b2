package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.common.content.ForbiddenWordFilter;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.CommentVoteEntity;
import com.ministation.domain.entity.PostVoteEntity;
import com.ministation.domain.entity.StationCommentEntity;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationPostEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.enums.VoteOutcome;
import com.ministation.domain.mapper.CommentVoteMapper;
import com.ministation.domain.mapper.PostVoteMapper;
import com.ministation.domain.mapper.StationCommentMapper;
import com.ministation.domain.mapper.StationMapper;
import com.ministation.domain.mapper.StationPostMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.KarmaLedgerService;
import com.ministation.domain.service.KarmaRewards;
import com.ministation.domain.service.ModerationStatus;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationPostService;
import com.ministation.domain.service.VoteTransition;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class StationPostServiceImpl extends ServiceImpl<StationPostMapper, StationPostEntity> implements StationPostService {

    private static final int MAX_TYPE_LEN = 32;

    private final StationMapper stationMapper;
    private final StationCommentMapper commentMapper;
    private final PostVoteMapper postVoteMapper;
    private final CommentVoteMapper commentVoteMapper;
    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final ModerationStatus moderationStatus;
    private final KarmaLedgerService karmaLedgerService;
    private final AuditLogService auditLogService;
    private final ForbiddenWordFilter forbiddenWordFilter;
    private final StationProperties props;
    private final Clock clock;

    public StationPostServiceImpl(StationMapper stationMapper,
                                  StationCommentMapper commentMapper,
                                  PostVoteMapper postVoteMapper,
                                  CommentVoteMapper commentVoteMapper,
                                  StationGuard stationGuard,
                                  PermissionResolver permissionResolver,
                                  ModerationStatus moderationStatus,
                                  KarmaLedgerService karmaLedgerService,
                                  AuditLogService auditLogService,
                                  ForbiddenWordFilter forbiddenWordFilter,
                                  StationProperties props,
                                  Clock clock) {
        this.stationMapper = stationMapper;
        this.commentMapper = commentMapper;
        this.postVoteMapper = postVoteMapper;
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
    public PostDto createPost(long stationId, String author, String type, String title, String content) {
        StationEntity station = stationGuard.requireActive(stationId);
        if (permissionResolver.findMember(stationId, author) == null) {
            throw BizException.forbidden("not_member");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (moderationStatus.isMuted(stationId, author, now)) {
            throw BizException.forbidden("muted");
        }

        String t = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            throw BizException.validation("missing_type");
        }
        if (t.length() > MAX_TYPE_LEN) {
            throw BizException.validation("bad_type");
        }
        boolean ownerPost = StationGuard.isOwner(station, author);
        if (KarmaRewards.TYPE_UPDATE.equals(t) && !ownerPost) {
            throw BizException.forbidden("update_owner_only");
        }

        StationPostEntity p = new StationPostEntity();
        p.setStationId(stationId);
        p.setAuthorPrincipal(author);
        p.setPostType(t);
        p.setTitle(forbiddenWordFilter.sanitize(requireTitle(title)));
        p.setContent(forbiddenWordFilter.sanitize(requireContent(content)));
        p.setOwnerPost(ownerPost);
        p.setPinned(false);
        p.setEdited(false);
        p.setUpvotes(0);
        p.setDownvotes(0);
        p.setCommentCount(0);
        p.setCreatedAt(now);
        this.save(p);

        stationMapper.adjustPostCount(stationId, 1);
        karmaLedgerService.award(station, author, t);
        return PostDto.from(p);
    }

    @Transactional
    @Override
    public PostDto editPost(long postId, String principal, String title, String content) {
        StationPostEntity post = requirePost(postId);
        if (principal == null || !principal.equals(post.getAuthorPrincipal())) {
            throw BizException.forbidden("not_author");
        }
        if (title == null && content == null) {
            throw BizException.validation("nothing_to_update");
        }
        LambdaUpdateWrapper<StationPostEntity> uw = new LambdaUpdateWrapper<StationPostEntity>()
                .eq(StationPostEntity::getId, postId)
                .set(StationPostEntity::getEdited, true)
                .set(StationPostEntity::getUpdatedAt, LocalDateTime.now(clock));
        if (title != null) {
            uw.set(StationPostEntity::getTitle, forbiddenWordFilter.sanitize(requireTitle(title)));
        }
        if (content != null) {
            uw.set(StationPostEntity::getContent, forbiddenWordFilter.sanitize(requireContent(content)));
        }
        this.update(uw);
        return PostDto.from(this.getById(postId));
    }

    @Transactional
    @Override
    public void pinPost(long postId, String principal, boolean pinned) {
        StationPostEntity post = requirePost(postId);
        permissionResolver.require(post.getStationId(), principal, Capability.PIN, "no_pin_permission");
        this.update(new LambdaUpdateWrapper<StationPostEntity>()
                .eq(StationPostEntity::getId, postId)
                .set(StationPostEntity::getPinned, pinned));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("postId", String.valueOf(postId));
        details.put("pinned", pinned);
        auditLogService.record(post.getStationId(), AuditAction.POST_PIN, principal, post.getAuthorPrincipal(), details);
    }

    @Transactional
    @Override
    public void deletePost(long postId, String principal) {
        StationPostEntity post = requirePost(postId);
        StationEntity station = stationGuard.requireStation(post.getStationId());
        boolean author = principal != null && principal.equals(post.getAuthorPrincipal());
        if (!author && !StationGuard.isOwner(station, principal)) {
            permissionResolver.require(station.getId(), principal, Capability.DELETE, "no_delete_permission");
        }

        List<Object> commentIds = commentMapper.selectObjs(new LambdaQueryWrapper<StationCommentEntity>()
                .select(StationCommentEntity::getId)
                .eq(StationCommentEntity::getPostId, postId));
        if (!commentIds.isEmpty()) {
            commentVoteMapper.delete(new LambdaQueryWrapper<CommentVoteEntity>()
                    .in(CommentVoteEntity::getCommentId, commentIds));
        }
        commentMapper.delete(new LambdaQueryWrapper<StationCommentEntity>()
                .eq(StationCommentEntity::getPostId, postId));
        postVoteMapper.delete(new LambdaQueryWrapper<PostVoteEntity>()
                .eq(PostVoteEntity::getPostId, postId));
        this.removeById(postId);
        stationMapper.adjustPostCount(station.getId(), -1);

        if (!author) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("postId", String.valueOf(postId));
            details.put("title", post.getTitle());
            details.put("comments", commentIds.size());
            auditLogService.record(station.getId(), AuditAction.POST_DELETE, principal, post.getAuthorPrincipal(), details);
        }
    }

    @Override
    public PostDto getPost(long postId) {
        return PostDto.from(requirePost(postId));
    }

    @Override
    public List<PostDto> listPosts(long stationId, String type, Integer limit) {
        stationGuard.requireStation(stationId);
        int n = props.clampLimit(limit, props.getDefaultListLimit());
        String t = type == null || type.isBlank() ? null : type.trim().toLowerCase(Locale.ROOT);
        List<StationPostEntity> rows = this.list(new LambdaQueryWrapper<StationPostEntity>()
                .eq(StationPostEntity::getStationId, stationId)
                .eq(t != null, StationPostEntity::getPostType, t)
                .orderByDesc(StationPostEntity::getPinned)
                .orderByDesc(StationPostEntity::getCreatedAt)
                .orderByDesc(StationPostEntity::getId)
                .last("limit " + n));
        List<PostDto> out = new ArrayList<>(rows.size());
        for (StationPostEntity p : rows) {
            out.add(PostDto.from(p));
        }
        return out;
    }

    @Transactional
    @Override
    public VoteResult votePost(long postId, String principal, VoteDirection direction) {
        if (direction == null) {
            throw BizException.validation("bad_direction");
        }
        StationPostEntity post = requirePost(postId);
        if (permissionResolver.findMember(post.getStationId(), principal) == null) {
            throw BizException.forbidden("not_member");
        }

        PostVoteEntity existing = findVote(postId, principal);
        VoteTransition t = VoteTransition.of(existing == null ? null : existing.getDirection(), direction);
        LocalDateTime now = LocalDateTime.now(clock);
        if (t.insertsVote()) {
            PostVoteEntity v = new PostVoteEntity();
            v.setPostId(postId);
            v.setVoterPrincipal(principal);
            v.setDirection(direction);
            v.setCreatedAt(now);
            try {
                postVoteMapper.insert(v);
            } catch (DuplicateKeyException e) {
                throw BizException.conflict("vote_conflict");
            }
        } else if (t.removesVote()) {
            postVoteMapper.deleteById(existing.getId());
        } else {
            postVoteMapper.update(null, new LambdaUpdateWrapper<PostVoteEntity>()
                    .eq(PostVoteEntity::getId, existing.getId())
                    .set(PostVoteEntity::getDirection, direction)
                    .set(PostVoteEntity::getCreatedAt, now));
        }
        baseMapper.applyVoteDelta(postId, t.upDelta(), t.downDelta());

        if (t.outcome() == VoteOutcome.UPVOTED && !principal.equals(post.getAuthorPrincipal())) {
            karmaLedgerService.award(stationGuard.requireStation(post.getStationId()), principal, KarmaRewards.TYPE_VOTE);
        }
        StationPostEntity after = this.getById(postId);
        return new VoteResult(t.outcome(), after.getUpvotes(), after.getDownvotes());
    }

    @Override
    public MyVote getPostVote(long postId, String principal) {
        requirePost(postId);
        PostVoteEntity v = findVote(postId, principal);
        return v == null ? new MyVote(false, null) : new MyVote(true, v.getDirection());
    }

    @Override
    public StationPostEntity requirePost(long postId) {
        StationPostEntity post = postId <= 0 ? null : this.getById(postId);
        if (post == null) {
            throw BizException.notFound("post_not_found");
        }
        return post;
    }

    private PostVoteEntity findVote(long postId, String principal) {
        if (principal == null || principal.isBlank()) {
            return null;
        }
        return postVoteMapper.selectOne(new LambdaQueryWrapper<PostVoteEntity>()
                .eq(PostVoteEntity::getPostId, postId)
                .eq(PostVoteEntity::getVoterPrincipal, principal)
                .last("limit 1"));
    }

    private String requireTitle(String title) {
        String t = title == null ? "" : title.trim();
        if (t.isEmpty()) {
            throw BizException.validation("missing_title");
        }
        if (t.length() > props.getMaxTitleLength()) {
            throw BizException.validation("title_too_long");
        }
        return t;
    }

    private String requireContent(String content) {
        String c = content == null ? "" : content.trim();
        if (c.isEmpty()) {
            throw BizException.validation("missing_content");
        }
        if (c.length() > props.getMaxPostContentLength()) {
            throw BizException.validation("content_too_long");
        }
        return c;
    }
}
