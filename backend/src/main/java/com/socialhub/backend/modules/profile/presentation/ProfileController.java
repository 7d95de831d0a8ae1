package com.socialhub.backend.modules.profile.presentation;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.security.JwtAuthenticationPrincipal;
import com.socialhub.backend.global.security.SecurityUtils;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;
import com.socialhub.backend.modules.profile.application.FollowService;
import com.socialhub.backend.modules.profile.application.ProfileService;
import com.socialhub.backend.modules.profile.presentation.dto.EditProfileRequest;
import com.socialhub.backend.modules.profile.presentation.dto.FollowRequestResponse;
import com.socialhub.backend.modules.profile.presentation.dto.ProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final ProfileService profileService;
    private final FollowService followService;

    public ProfileController(ProfileService profileService, FollowService followService) {
        this.profileService = profileService;
        this.followService = followService;
    }

    @Operation(summary = "Own profile", description = "Profile with follower counts and posts, pinned first.")
    @GetMapping
    public ResponseEntity<ProfileResponse> getOwnProfile(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(profileService.getProfile(SecurityUtils.requireUserId(principal)));
    }

    @Operation(summary = "Another user's profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/{userId}")
    public ResponseEntity<ProfileResponse> getProfile(@PathVariable UUID userId) {
        return ResponseEntity.ok(profileService.getProfile(userId));
    }

    @Operation(summary = "Edit own profile", description = "Multipart: a JSON part named profile and an optional profile_picture file.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "400", description = "Unsupported picture type"),
            @ApiResponse(responseCode = "409", description = "Email already in use")
    })
    @PutMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UserResponse> editProfile(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestPart("profile") EditProfileRequest request,
            @RequestPart(value = "profile_picture", required = false) MultipartFile picture
    ) {
        return ResponseEntity.ok(profileService.editProfile(SecurityUtils.requireUserId(principal), request, picture));
    }

    @Operation(summary = "Follow a user", description = "Follows a public account directly, or sends a request to a private one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Followed or request sent"),
            @ApiResponse(responseCode = "400", description = "Already following, request pending or self-follow"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/{targetId}/follow")
    public ResponseEntity<MessageResponse> follow(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID targetId
    ) {
        return ResponseEntity.ok(followService.requestToFollow(SecurityUtils.requireUserId(principal), targetId));
    }

    @Operation(summary = "Unfollow a user", description = "Succeeds even when no edge existed.")
    @DeleteMapping("/{targetId}/follow")
    public ResponseEntity<MessageResponse> unfollow(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID targetId
    ) {
        return ResponseEntity.ok(followService.unfollowUser(targetId, SecurityUtils.requireUserId(principal)));
    }

    @Operation(summary = "Pending follow requests addressed to the caller")
    @GetMapping("/follow-requests")
    public ResponseEntity<List<FollowRequestResponse>> pendingRequests(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(followService.listPendingRequests(SecurityUtils.requireUserId(principal)));
    }

    @Operation(summary = "Accept a follow request")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted"),
            @ApiResponse(responseCode = "400", description = "No follow request found")
    })
    @PostMapping("/follow-requests/{requesterId}/accept")
    public ResponseEntity<MessageResponse> accept(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID requesterId
    ) {
        return ResponseEntity.ok(followService.acceptFollowRequest(SecurityUtils.requireUserId(principal), requesterId));
    }

    @Operation(summary = "Cancel an outgoing follow request")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Canceled"),
            @ApiResponse(responseCode = "400", description = "No follow request found")
    })
    @DeleteMapping("/follow-requests/{targetId}")
    public ResponseEntity<MessageResponse> cancel(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID targetId
    ) {
        return ResponseEntity.ok(followService.cancelFollowRequest(SecurityUtils.requireUserId(principal), targetId));
    }
}
