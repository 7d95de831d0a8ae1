package com.socialhub.backend.modules.profile.application;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;
import com.socialhub.backend.modules.post.infrastructure.persistence.PostRepository;
import com.socialhub.backend.modules.post.presentation.dto.PostResponse;
import com.socialhub.backend.modules.profile.infrastructure.persistence.FollowerRepository;
import com.socialhub.backend.modules.profile.presentation.dto.EditProfileRequest;
import com.socialhub.backend.modules.profile.presentation.dto.ProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

@Service
@Transactional
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    static final Set<String> ALLOWED_PICTURE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif");

    static final String USER_NOT_FOUND = "profile.user_not_found";
    static final String EMAIL_TAKEN = "profile.email_taken";
    static final String INVALID_PICTURE = "profile.invalid_picture";
    static final String EDIT_FAILED = "profile.edit_failed";

    private final AppUserRepository appUserRepository;
    private final PostRepository postRepository;
    private final FollowerRepository followerRepository;
    private final ObjectStorage objectStorage;
    private final Path stagingDir;

    public ProfileService(
            AppUserRepository appUserRepository,
            PostRepository postRepository,
            FollowerRepository followerRepository,
            ObjectStorage objectStorage,
            @Value("${app.storage.staging-dir:uploads/staging}") String stagingDir
    ) {
        this.appUserRepository = appUserRepository;
        this.postRepository = postRepository;
        this.followerRepository = followerRepository;
        this.objectStorage = objectStorage;
        this.stagingDir = Paths.get(stagingDir).toAbsolutePath().normalize();
    }

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(ProfileService::userNotFound);

        List<PostResponse> posts = postRepository.findProfilePosts(userId).stream()
                .map(PostResponse::from)
                .toList();
        return ProfileResponse.of(
                user,
                followerRepository.countByFollowingId(userId),
                followerRepository.countByFollowerId(userId),
                posts
        );
    }

    /**
     * Applies the non-null fields of {@code request} and, when a picture is attached, publishes it
     * through {@link ObjectStorage}. The staged copy of the picture is removed whatever the outcome.
     */
    public UserResponse editProfile(UUID userId, EditProfileRequest request, MultipartFile picture) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(ProfileService::userNotFound);

        if (request.email() != null) {
            String email = request.email().trim().toLowerCase(Locale.ROOT);
            if (!email.equalsIgnoreCase(user.getEmail()) && appUserRepository.existsByEmailIgnoreCase(email)) {
                throw ProblemException.conflict(EMAIL_TAKEN, "Email is already in use");
            }
            user.setEmail(email);
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.isPrivate() != null) {
            user.setPrivateAccount(request.isPrivate());
        }

        Path staged = null;
        try {
            if (picture != null && !picture.isEmpty()) {
                String extension = requireImageExtension(picture);
                staged = stage(picture, extension);
                user.setProfilePicture(objectStorage.upload(staged).secureUrl());
            }
            AppUser saved = appUserRepository.saveAndFlush(user);
            return UserResponse.from(saved);
        } catch (ProblemException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            log.error("Profile update failed for user {}", userId, ex);
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, EDIT_FAILED, "Error in edit profile");
        } finally {
            discard(staged);
        }
    }

    private Path stage(MultipartFile picture, String extension) throws IOException {
        Files.createDirectories(stagingDir);
        Path staged = stagingDir.resolve(UUID.randomUUID() + "." + extension);
        picture.transferTo(staged);
        return staged;
    }

    private void discard(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException ex) {
            log.warn("Could not delete staged upload {}: {}", staged, ex.getMessage());
        }
    }

    private static String requireImageExtension(MultipartFile picture) {
        String extension = StringUtils.getFilenameExtension(picture.getOriginalFilename());
        if (extension == null || !ALLOWED_PICTURE_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            throw ProblemException.badRequest(INVALID_PICTURE, "Only image files are allowed!");
        }
        return extension.toLowerCase(Locale.ROOT);
    }

    private static ProblemException userNotFound() {
        return ProblemException.notFound(USER_NOT_FOUND, "User not found");
    }
}
