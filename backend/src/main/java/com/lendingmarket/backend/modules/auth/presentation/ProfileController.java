package com.lendingmarket.backend.modules.auth.presentation;

import com.lendingmarket.backend.global.security.JwtAuthenticationPrincipal;
import com.lendingmarket.backend.modules.auth.application.AuthService;
import com.lendingmarket.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/user/profile")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @DeleteMapping("/user/profile")
    public ResponseEntity<Void> deactivate(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        authService.deactivate(principal.userId());
        return ResponseEntity.noContent().build();
    }
}
