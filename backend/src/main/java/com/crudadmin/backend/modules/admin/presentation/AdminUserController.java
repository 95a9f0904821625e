package com.crudadmin.backend.modules.admin.presentation;

import java.net.URI;

import com.crudadmin.backend.global.security.AuthenticatedUser;
import com.crudadmin.backend.modules.admin.application.AdminUserService;
import com.crudadmin.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.crudadmin.backend.modules.admin.presentation.dto.CreateUserRequest;
import com.crudadmin.backend.modules.admin.presentation.dto.ResetPasswordRequest;
import com.crudadmin.backend.modules.admin.presentation.dto.UpdateRoleRequest;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
@Tag(name = "Admin users")
public class AdminUserController {

    private final AdminUserService adminUserService;

    public AdminUserController(AdminUserService adminUserService) {
        this.adminUserService = adminUserService;
    }

    @GetMapping
    @Operation(summary = "List users ordered by id")
    public ResponseEntity<AdminUsersResponse> getUsers(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(AdminUsersResponse.from(adminUserService.listUsers(page, size)));
    }

    @GetMapping("/{userId}")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No such user")
    })
    public ResponseEntity<UserResponse> getUser(@PathVariable("userId") long userId) {
        return ResponseEntity.ok(UserResponse.from(adminUserService.getUser(userId)));
    }

    @PostMapping
    @Operation(summary = "Create a user, optionally with the admin flag")
    public ResponseEntity<UserResponse> createUser(
            @AuthenticationPrincipal AuthenticatedUser actor,
            @Valid @RequestBody CreateUserRequest request
    ) {
        UserAccount created = adminUserService.createUser(
                request.username(), request.password(), request.admin(), actor.id());
        return ResponseEntity.created(URI.create("/admin/users/" + created.id())).body(UserResponse.from(created));
    }

    @PatchMapping("/{userId}/role")
    @Operation(summary = "Grant or revoke the admin flag")
    public ResponseEntity<Void> updateRole(
            @AuthenticationPrincipal AuthenticatedUser actor,
            @PathVariable("userId") long userId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        adminUserService.updateRole(userId, request.admin(), actor.id());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deleteUser(
            @AuthenticationPrincipal AuthenticatedUser actor,
            @PathVariable("userId") long userId
    ) {
        adminUserService.deleteUser(userId, actor.id());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{userId}/password")
    @Operation(summary = "Set a new password for a user")
    public ResponseEntity<Void> resetPassword(
            @AuthenticationPrincipal AuthenticatedUser actor,
            @PathVariable("userId") long userId,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        adminUserService.resetPassword(userId, request.newPassword(), actor.id());
        return ResponseEntity.noContent().build();
    }
}
