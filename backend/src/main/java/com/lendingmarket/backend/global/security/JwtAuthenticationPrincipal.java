package com.lendingmarket.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Verified identity carried by a bearer token. Capabilities are a snapshot taken at token issue time.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, List<String> capabilities) {

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }
}
