package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.common.ratelimit.RateLimit;
import com.ministation.domain.enums.VoteDirection;
import com.ministation.domain.service.StationCommentService;
import com.ministation.domain.service.StationPostService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/station/comment")
public class StationCommentController {

    private final StationCommentService commentService;

    public record CreateCommentRequest(@NotNull Long postId, String content, Long parentId) {
    }

    @PostMapping("/create")
    @RateLimit(name = "comment_create", windowSeconds = 60, max = 20)
    public Result<StationCommentService.CommentDto> create(@Valid @RequestBody CreateCommentRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(commentService.createComment(req.postId(), principal, req.content(), req.parentId()));
    }

    public record EditCommentRequest(@NotNull Long commentId, String content) {
    }

    @PostMapping("/edit")
    public Result<StationCommentService.CommentDto> edit(@Valid @RequestBody EditCommentRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(commentService.editComment(req.commentId(), principal, req.content()));
    }

    public record CommentIdRequest(@NotNull Long commentId) {
    }

    public record DeleteCommentResponse(Integer deleted) {
    }

    @PostMapping("/delete")
    public Result<DeleteCommentResponse> delete(@Valid @RequestBody CommentIdRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(new DeleteCommentResponse(commentService.deleteComment(req.commentId(), principal)));
    }

    public record VoteRequest(@NotNull Long commentId, String direction) {
    }

    @PostMapping("/vote")
    public Result<StationPostService.VoteResult> vote(@Valid @RequestBody VoteRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        VoteDirection direction = VoteDirection.fromString(req.direction());
        if (direction == null) {
            return Result.fail(ApiCodes.BAD_REQUEST, "bad_direction");
        }
        return Result.ok(commentService.voteComment(req.commentId(), principal, direction));
    }

    @GetMapping("/list")
    public Result<List<StationCommentService.CommentDto>> list(
            @RequestParam Long postId,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(commentService.listComments(postId, limit));
    }

    @GetMapping("/thread")
    public Result<List<StationCommentService.CommentNode>> thread(@RequestParam Long postId) {
        return Result.ok(commentService.threadedComments(postId));
    }

    @GetMapping("/my-vote")
    public Result<StationPostService.MyVote> myVote(@RequestParam Long commentId) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(commentService.getCommentVote(commentId, principal));
    }
}
