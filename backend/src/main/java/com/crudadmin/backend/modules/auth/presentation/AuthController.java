package com.crudadmin.backend.modules.auth.presentation;

import com.crudadmin.backend.global.security.AuthenticatedUser;
import com.crudadmin.backend.modules.auth.application.AuthService;
import com.crudadmin.backend.modules.auth.presentation.dto.TokenResponse;
import com.crudadmin.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * Password grant in OAuth2 form encoding. {@code /auth/token} is kept for form-based clients.
     */
    @PostMapping(value = {"/auth/login", "/auth/token"}, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Exchange username and password for an access token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued"),
            @ApiResponse(responseCode = "401", description = "Incorrect username or password"),
            @ApiResponse(responseCode = "503", description = "Credential store unavailable")
    })
    public ResponseEntity<TokenResponse> login(
            @RequestParam("username") String username,
            @RequestParam("password") String password
    ) {
        return ResponseEntity.ok(TokenResponse.from(authService.login(username, password)));
    }

    @GetMapping("/auth/me")
    @Operation(summary = "Current user")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(UserResponse.from(user));
    }
}
