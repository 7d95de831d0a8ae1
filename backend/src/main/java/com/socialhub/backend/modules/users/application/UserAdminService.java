package com.socialhub.backend.modules.users.application;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;
import com.socialhub.backend.modules.users.presentation.dto.UpdateUserRequest;
import com.socialhub.backend.modules.users.presentation.dto.UserSearchResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    static final int MAX_LIMIT = 100;

    static final String USER_NOT_FOUND = "users.not_found";
    static final String MISSING_FIRST_NAME = "users.first_name_required";
    static final String INVALID_PAGING = "users.invalid_paging";
    static final String EMAIL_TAKEN = "users.email_taken";

    private final AppUserRepository appUserRepository;

    public UserAdminService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public List<UserResponse> users() {
        return appUserRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(UserResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public UserSearchResponse searchUser(String firstName, int page, int limit) {
        if (firstName == null || firstName.isBlank()) {
            throw ProblemException.badRequest(MISSING_FIRST_NAME, "Please provide a first name to search.");
        }
        if (page < 1 || limit < 1 || limit > MAX_LIMIT) {
            throw ProblemException.badRequest(INVALID_PAGING, "page must be >= 1 and limit between 1 and " + MAX_LIMIT);
        }

        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by("firstName").ascending().and(Sort.by("id")));
        Page<AppUser> result = appUserRepository.searchByFirstName(escapeLike(firstName.trim()), pageable);
        return new UserSearchResponse(
                result.getContent().stream().map(UserResponse::from).toList(),
                result.getTotalElements(),
                page,
                limit
        );
    }

    @Transactional(readOnly = true)
    public UserResponse userById(UUID id) {
        return UserResponse.from(load(id));
    }

    public UserResponse updateUser(UUID id, UpdateUserRequest request) {
        AppUser user = load(id);

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
        if (request.role() != null) {
            user.setRole(request.role());
        }
        if (request.isPrivate() != null) {
            user.setPrivateAccount(request.isPrivate());
        }
        AppUser saved = appUserRepository.save(user);
        log.info("Admin updated user {}", id);
        return UserResponse.from(saved);
    }

    /**
     * Removes the account. Tokens, follow edges, pending requests and posts go with it through
     * the database's cascading foreign keys.
     */
    public MessageResponse delete(UUID id) {
        AppUser user = load(id);
        appUserRepository.delete(user);
        appUserRepository.flush();
        log.info("Admin deleted user {}", id);
        return MessageResponse.of("User with ID " + id + " has been deleted successfully.");
    }

    private AppUser load(UUID id) {
        return appUserRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User with ID " + id + " not found."));
    }

    static String escapeLike(String raw) {
        return raw.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
