package com.crudadmin.backend.modules.auth.presentation.dto;

import com.crudadmin.backend.modules.auth.application.IssuedToken;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
) {
    public static final String TOKEN_TYPE = "bearer";

    public static TokenResponse from(IssuedToken token) {
        return new TokenResponse(token.token(), TOKEN_TYPE, token.expiresInSeconds());
    }

    @Override
    public String toString() {
        return "TokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
    }
}
