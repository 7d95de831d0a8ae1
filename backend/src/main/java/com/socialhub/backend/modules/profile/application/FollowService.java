package com.socialhub.backend.modules.profile.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.profile.domain.FollowRequest;
import com.socialhub.backend.modules.profile.domain.Follower;
import com.socialhub.backend.modules.profile.infrastructure.persistence.FollowRequestRepository;
import com.socialhub.backend.modules.profile.infrastructure.persistence.FollowerRepository;
import com.socialhub.backend.modules.profile.presentation.dto.FollowRequestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Follow workflow per ordered pair (requester, target).
 *
 * <pre>
 * none --follow(public)--&gt; following
 * none --follow(private)--&gt; requested --accept--&gt; following
 * requested --cancel--&gt; none
 * following --unfollow--&gt; none
 * </pre>
 *
 * A pair never holds a follower edge and a pending request at the same time.
 */
@Service
@Transactional
public class FollowService {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    static final String USER_NOT_FOUND = "follow.user_not_found";
    static final String SELF_FOLLOW = "follow.self";
    static final String ALREADY_FOLLOWING = "follow.already_following";
    static final String REQUEST_EXISTS = "follow.request_exists";
    static final String REQUEST_NOT_FOUND = "follow.request_not_found";

    static final String NOW_FOLLOWING = "You are now following this user.";
    static final String REQUEST_SENT = "Follow request sent.";
    static final String REQUEST_ACCEPTED = "Follow request accepted.";
    static final String REQUEST_CANCELED = "Follow request canceled successfully.";
    static final String UNFOLLOWED = "Unfollowed successfully.";

    private final AppUserRepository appUserRepository;
    private final FollowerRepository followerRepository;
    private final FollowRequestRepository followRequestRepository;

    public FollowService(
            AppUserRepository appUserRepository,
            FollowerRepository followerRepository,
            FollowRequestRepository followRequestRepository
    ) {
        this.appUserRepository = appUserRepository;
        this.followerRepository = followerRepository;
        this.followRequestRepository = followRequestRepository;
    }

    public MessageResponse requestToFollow(UUID userId, UUID targetId) {
        if (userId.equals(targetId)) {
            throw ProblemException.badRequest(SELF_FOLLOW, "You cannot follow yourself.");
        }
        AppUser target = appUserRepository.findById(targetId)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));

        if (followerRepository.existsByFollowerIdAndFollowingId(userId, targetId)) {
            throw alreadyFollowing();
        }

        if (!target.isPrivateAccount()) {
            // the target may have been private when this pair's request was sent
            int dropped = followRequestRepository.deletePending(userId, targetId);
            try {
                followerRepository.saveAndFlush(new Follower(userId, targetId));
            } catch (DataIntegrityViolationException ex) {
                throw alreadyFollowing();
            }
            if (dropped > 0) {
                log.debug("Dropped stale follow request {} -> {}", userId, targetId);
            }
            log.debug("User {} now follows {}", userId, targetId);
            return MessageResponse.of(NOW_FOLLOWING);
        }

        if (followRequestRepository.existsByRequesterIdAndTargetId(userId, targetId)) {
            throw requestExists();
        }
        try {
            followRequestRepository.saveAndFlush(new FollowRequest(userId, targetId));
        } catch (DataIntegrityViolationException ex) {
            throw requestExists();
        }
        log.debug("User {} requested to follow {}", userId, targetId);
        return MessageResponse.of(REQUEST_SENT);
    }

    /**
     * Called by the target of the request. The requester becomes the follower.
     */
    public MessageResponse acceptFollowRequest(UUID targetId, UUID requesterId) {
        FollowRequest request = followRequestRepository.findByRequesterIdAndTargetId(requesterId, targetId)
                .orElseThrow(FollowService::requestNotFound);

        // the target may have gone public and been followed directly while the request was pending
        if (!followerRepository.existsByFollowerIdAndFollowingId(requesterId, targetId)) {
            followerRepository.save(request.promote());
        }
        followRequestRepository.delete(request);
        log.debug("User {} accepted follow request from {}", targetId, requesterId);
        return MessageResponse.of(REQUEST_ACCEPTED);
    }

    public MessageResponse cancelFollowRequest(UUID requesterId, UUID targetId) {
        FollowRequest request = followRequestRepository.findByRequesterIdAndTargetId(requesterId, targetId)
                .orElseThrow(FollowService::requestNotFound);
        followRequestRepository.delete(request);
        return MessageResponse.of(REQUEST_CANCELED);
    }

    public MessageResponse unfollowUser(UUID targetId, UUID userId) {
        int removed = followerRepository.deleteEdge(userId, targetId);
        if (removed > 0) {
            log.debug("User {} unfollowed {}", userId, targetId);
        }
        return MessageResponse.of(UNFOLLOWED);
    }

    @Transactional(readOnly = true)
    public List<FollowRequestResponse> listPendingRequests(UUID targetId) {
        List<FollowRequest> pending = followRequestRepository.findAllByTargetIdOrderByCreatedAtDesc(targetId);
        if (pending.isEmpty()) {
            return List.of();
        }
        Map<UUID, AppUser> requesters = appUserRepository.findAllById(
                        pending.stream().map(FollowRequest::getRequesterId).toList())
                .stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));

        return pending.stream()
                .filter(request -> requesters.containsKey(request.getRequesterId()))
                .map(request -> {
                    AppUser requester = requesters.get(request.getRequesterId());
                    return new FollowRequestResponse(
                            request.getId(),
                            requester.getId(),
                            requester.getFirstName(),
                            requester.getLastName(),
                            requester.getProfilePicture(),
                            request.getCreatedAt()
                    );
                })
                .toList();
    }

    private static ProblemException alreadyFollowing() {
        return ProblemException.badRequest(ALREADY_FOLLOWING, "You are already following this user.");
    }

    private static ProblemException requestExists() {
        return ProblemException.badRequest(REQUEST_EXISTS, "Follow request already sent.");
    }

    private static ProblemException requestNotFound() {
        return ProblemException.badRequest(REQUEST_NOT_FOUND, "No follow request found.");
    }
}
