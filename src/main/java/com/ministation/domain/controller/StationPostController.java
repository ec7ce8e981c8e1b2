package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.common.ratelimit.RateLimit;
import com.ministation.domain.enums.VoteDirection;
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
@RequestMapping("/station/post")
public class StationPostController {

    private final StationPostService postService;

    public record CreatePostRequest(@NotNull Long stationId, String type, String title, String content) {
    }

    @PostMapping("/create")
    @RateLimit(name = "post_create", windowSeconds = 60, max = 10)
    public Result<StationPostService.PostDto> create(@Valid @RequestBody CreatePostRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(postService.createPost(req.stationId(), principal, req.type(), req.title(), req.content()));
    }

    public record EditPostRequest(@NotNull Long postId, String title, String content) {
    }

    @PostMapping("/edit")
    public Result<StationPostService.PostDto> edit(@Valid @RequestBody EditPostRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(postService.editPost(req.postId(), principal, req.title(), req.content()));
    }

    public record PinPostRequest(@NotNull Long postId, @NotNull Boolean pinned) {
    }

    @PostMapping("/pin")
    public Result<Void> pin(@Valid @RequestBody PinPostRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        postService.pinPost(req.postId(), principal, req.pinned());
        return Result.okVoid();
    }

    public record PostIdRequest(@NotNull Long postId) {
    }

    @PostMapping("/delete")
    public Result<Void> delete(@Valid @RequestBody PostIdRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        postService.deletePost(req.postId(), principal);
        return Result.okVoid();
    }

    public record VoteRequest(@NotNull Long postId, String direction) {
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
        return Result.ok(postService.votePost(req.postId(), principal, direction));
    }

    @GetMapping("/get")
    public Result<StationPostService.PostDto> get(@RequestParam Long postId) {
        return Result.ok(postService.getPost(postId));
    }

    @GetMapping("/list")
    public Result<List<StationPostService.PostDto>> list(
            @RequestParam Long stationId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(postService.listPosts(stationId, type, limit));
    }

    @GetMapping("/my-vote")
    public Result<StationPostService.MyVote> myVote(@RequestParam Long postId) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(postService.getPostVote(postId, principal));
    }
}
