package com.crudadmin.backend.modules.user.presentation;

import java.net.URI;

import com.crudadmin.backend.global.security.AuthenticatedUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.presentation.dto.UserResponse;
import com.crudadmin.backend.modules.user.application.UserAccountService;
import com.crudadmin.backend.modules.user.presentation.dto.ChangePasswordRequest;
import com.crudadmin.backend.modules.user.presentation.dto.RegisterUserRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
@Tag(name = "Users")
public class UserController {

    private final UserAccountService userAccountService;

    public UserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @PostMapping
    @Operation(summary = "Register a new (non-admin) account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Username already exists"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        UserAccount created = userAccountService.register(request.username(), request.password());
        return ResponseEntity.created(URI.create("/users/" + created.id())).body(UserResponse.from(created));
    }

    @PutMapping("/me/password")
    @Operation(summary = "Change own password")
    public ResponseEntity<Void> changePassword(
            @AuthenticationPrincipal AuthenticatedUser user,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        userAccountService.changePassword(user.id(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
