package com.socialhub.backend.modules.users.presentation;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;
import com.socialhub.backend.modules.users.application.UserAdminService;
import com.socialhub.backend.modules.users.presentation.dto.UpdateUserRequest;
import com.socialhub.backend.modules.users.presentation.dto.UserSearchResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UsersController {

    private final UserAdminService userAdminService;

    public UsersController(UserAdminService userAdminService) {
        this.userAdminService = userAdminService;
    }

    @Operation(summary = "List all users (admin)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "List of users"),
            @ApiResponse(responseCode = "401", description = "Authentication required"),
            @ApiResponse(responseCode = "403", description = "Admins only")
    })
    @GetMapping
    public ResponseEntity<List<UserResponse>> users() {
        return ResponseEntity.ok(userAdminService.users());
    }

    @Operation(summary = "Search users by first name", description = "Case-insensitive substring match, 1-based pages.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching users"),
            @ApiResponse(responseCode = "400", description = "Missing firstName or bad paging")
    })
    @GetMapping("/search")
    public ResponseEntity<UserSearchResponse> search(
            @RequestParam(required = false) String firstName,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(userAdminService.searchUser(firstName, page, limit));
    }

    @Operation(summary = "Get user by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User details"),
            @ApiResponse(responseCode = "400", description = "Invalid id"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> userById(@PathVariable UUID id) {
        return ResponseEntity.ok(userAdminService.userById(id));
    }

    @Operation(summary = "Update user by id (admin)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "Admins only"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PutMapping("/{id}")
    public ResponseEntity<UserResponse> updateUser(@PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
        return ResponseEntity.ok(userAdminService.updateUser(id, request));
    }

    @Operation(summary = "Delete user by id (admin)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deleted"),
            @ApiResponse(responseCode = "403", description = "Admins only"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id) {
        return ResponseEntity.ok(userAdminService.delete(id));
    }
}
