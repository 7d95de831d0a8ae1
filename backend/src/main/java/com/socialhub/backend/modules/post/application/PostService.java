package com.socialhub.backend.modules.post.application;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.post.domain.Post;
import com.socialhub.backend.modules.post.domain.PostStatus;
import com.socialhub.backend.modules.post.infrastructure.persistence.PostRepository;
import com.socialhub.backend.modules.post.presentation.dto.CreatePostRequest;
import com.socialhub.backend.modules.post.presentation.dto.EditPostRequest;
import com.socialhub.backend.modules.post.presentation.dto.PostResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    static final String POST_NOT_FOUND = "post.not_found";
    static final String USER_NOT_FOUND = "post.user_not_found";

    private final PostRepository postRepository;
    private final AppUserRepository appUserRepository;

    public PostService(PostRepository postRepository, AppUserRepository appUserRepository) {
        this.postRepository = postRepository;
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public List<PostResponse> getPosts() {
        return postRepository.findAllNewestFirst().stream()
                .map(PostResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PostResponse getPostById(UUID postId) {
        return postRepository.findWithUserById(postId)
                .map(PostResponse::from)
                .orElseThrow(PostService::postNotFound);
    }

    public PostResponse createPost(UUID userId, CreatePostRequest request) {
        AppUser owner = appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));

        Post post = new Post();
        post.setUser(owner);
        post.setTitle(request.title().trim());
        post.setContent(request.content());
        post.setStatus(request.status() != null ? request.status() : PostStatus.PUBLISHED);
        post.setMediaUrls(request.mediaUrls() != null ? request.mediaUrls() : List.of());
        post.setPinned(Boolean.TRUE.equals(request.pinned()));

        Post saved = postRepository.save(post);
        log.debug("User {} created post {}", userId, saved.getId());
        return PostResponse.from(saved);
    }

    public PostResponse editPost(UUID postId, UUID userId, EditPostRequest request) {
        Post post = postRepository.findOwnedBy(postId, userId)
                .orElseThrow(PostService::postNotFound);

        if (request.title() != null) {
            post.setTitle(request.title().trim());
        }
        if (request.content() != null) {
            post.setContent(request.content());
        }
        if (request.status() != null) {
            post.setStatus(request.status());
        }
        if (request.mediaUrls() != null) {
            post.setMediaUrls(request.mediaUrls());
        }
        if (request.pinned() != null) {
            post.setPinned(request.pinned());
        }
        return PostResponse.from(postRepository.save(post));
    }

    public void deletePost(UUID postId, UUID userId) {
        Post post = postRepository.findOwnedBy(postId, userId)
                .orElseThrow(PostService::postNotFound);
        postRepository.delete(post);
        log.debug("User {} deleted post {}", userId, postId);
    }

    private static ProblemException postNotFound() {
        return ProblemException.notFound(POST_NOT_FOUND, "Post not found");
    }
}
