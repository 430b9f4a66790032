package com.lendingmarket.backend.modules.auth.presentation.dto;

public record LoginResponse(TokenResponse tokens, UserProfileResponse user) {
}
