package com.socialhub.backend.modules.post.presentation;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.security.JwtAuthenticationPrincipal;
import com.socialhub.backend.global.security.SecurityUtils;
import com.socialhub.backend.modules.post.application.PostService;
import com.socialhub.backend.modules.post.presentation.dto.CreatePostRequest;
import com.socialhub.backend.modules.post.presentation.dto.EditPostRequest;
import com.socialhub.backend.modules.post.presentation.dto.PostResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/posts")
public class PostController {

    private final PostService postService;

    public PostController(PostService postService) {
        this.postService = postService;
    }

    @Operation(summary = "List posts", description = "All posts, newest first.")
    @GetMapping
    public ResponseEntity<List<PostResponse>> getPosts() {
        return ResponseEntity.ok(postService.getPosts());
    }

    @Operation(summary = "Get a post")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Post not found")
    })
    @GetMapping("/{postId}")
    public ResponseEntity<PostResponse> getPost(@PathVariable UUID postId) {
        return ResponseEntity.ok(postService.getPostById(postId));
    }

    @Operation(summary = "Create a post")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "401", description = "Authentication required")
    })
    @PostMapping
    public ResponseEntity<PostResponse> createPost(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreatePostRequest request
    ) {
        PostResponse created = postService.createPost(SecurityUtils.requireUserId(principal), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Edit own post", description = "Only the fields present in the body are changed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "Post not found or not owned by caller")
    })
    @PutMapping("/{postId}")
    public ResponseEntity<PostResponse> editPost(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID postId,
            @Valid @RequestBody EditPostRequest request
    ) {
        return ResponseEntity.ok(postService.editPost(postId, SecurityUtils.requireUserId(principal), request));
    }

    @Operation(summary = "Delete own post")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "Post not found or not owned by caller")
    })
    @DeleteMapping("/{postId}")
    public ResponseEntity<Void> deletePost(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID postId
    ) {
        postService.deletePost(postId, SecurityUtils.requireUserId(principal));
        return ResponseEntity.noContent().build();
    }
}
