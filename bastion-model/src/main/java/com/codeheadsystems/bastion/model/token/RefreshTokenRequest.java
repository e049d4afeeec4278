package com.codeheadsystems.bastion.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client's refresh request: { refresh_token }.
 *
 * @param refreshToken the refresh token previously issued by the token endpoint
 */
public record RefreshTokenRequest(@JsonProperty("refresh_token") String refreshToken) {
}
