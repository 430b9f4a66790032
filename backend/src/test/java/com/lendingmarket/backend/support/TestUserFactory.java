package com.lendingmarket.backend.support;

import java.util.List;

import com.lendingmarket.backend.modules.auth.application.JwtTokenService;
import com.lendingmarket.backend.modules.auth.application.UserCapabilityService;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.auth.domain.UserStatus;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "Secret123";

    private final UserAccountRepository userAccountRepository;
    private final UserCapabilityService userCapabilityService;
    private final JwtTokenService jwtTokenService;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            UserAccountRepository userAccountRepository,
            UserCapabilityService userCapabilityService,
            JwtTokenService jwtTokenService,
            PasswordEncoder passwordEncoder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.userCapabilityService = userCapabilityService;
        this.jwtTokenService = jwtTokenService;
        this.passwordEncoder = passwordEncoder;
    }

    public UserAccount ensureUser(String email, String displayName, Capability... capabilities) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(email)
                .orElseGet(UserAccount::new);
        user.setEmail(email);
        user.setDisplayName(displayName);
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setStatus(UserStatus.ACTIVE);
        user = userAccountRepository.saveAndFlush(user);
        for (Capability capability : capabilities) {
            userCapabilityService.grant(user, capability);
        }
        return user;
    }

    /**
     * Bearer header value for the user's current capabilities.
     */
    @Transactional(readOnly = true)
    public String bearer(UserAccount user) {
        List<String> capabilities = userCapabilityService.activeCapabilityCodes(user.getId());
        return "Bearer " + jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), capabilities).accessToken();
    }
}
