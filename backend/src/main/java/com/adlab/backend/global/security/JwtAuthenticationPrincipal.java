package com.adlab.backend.global.security;

import java.util.UUID;

/**
 * Authenticated caller as stated by the access token. {@code workspaceId} is the workspace the
 * caller selected and may be {@code null}.
 */
public record JwtAuthenticationPrincipal(UUID userId, UUID workspaceId) {
}
