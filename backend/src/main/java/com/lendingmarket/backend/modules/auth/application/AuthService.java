package com.lendingmarket.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.audit.application.AuditLogService;
import com.lendingmarket.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.auth.domain.UserStatus;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lendingmarket.backend.modules.auth.presentation.dto.LoginRequest;
import com.lendingmarket.backend.modules.auth.presentation.dto.LoginResponse;
import com.lendingmarket.backend.modules.auth.presentation.dto.RegisterRequest;
import com.lendingmarket.backend.modules.auth.presentation.dto.TokenResponse;
import com.lendingmarket.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.lendingmarket.backend.modules.invitation.application.InvitationActivationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final UserCapabilityService userCapabilityService;
    private final InvitationActivationService invitationActivationService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            UserCapabilityService userCapabilityService,
            InvitationActivationService invitationActivationService,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.userCapabilityService = userCapabilityService;
        this.invitationActivationService = invitationActivationService;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates the account with the BORROWER capability, then converts any invitations already
     * addressed to the email into lender participations.
     */
    public LoginResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userAccountRepository.findByEmailIgnoreCase(email).isPresent()) {
            throw new ProblemException(ErrorCode.EMAIL_ALREADY_REGISTERED, "Email is already registered");
        }

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setDisplayName(request.name().trim());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setStatus(UserStatus.ACTIVE);
        try {
            user = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ErrorCode.EMAIL_ALREADY_REGISTERED, "Email is already registered");
        }

        userCapabilityService.grant(user, Capability.BORROWER);
        invitationActivationService.activate(user);

        auditLogService.record(new AuditLogCommand(
                "USER_REGISTERED",
                "USER",
                user.getId().toString(),
                user.getId(),
                null
        ));
        log.info("Registered user {}", user.getId());
        return issue(user);
    }

    public LoginResponse login(LoginRequest request) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(ErrorCode.INVALID_CREDENTIALS, "Invalid email or password"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.debug("Rejected login for user {}: bad password", user.getId());
            throw new ProblemException(ErrorCode.INVALID_CREDENTIALS, "Invalid email or password");
        }
        if (user.getStatus() != UserStatus.ACTIVE) {
            throw new ProblemException(ErrorCode.USER_INACTIVE, "User account is inactive");
        }

        invitationActivationService.activate(user);
        return issue(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        UserAccount user = userCapabilityService.requireActiveUser(userId);
        return buildUserProfile(user, userCapabilityService.activeCapabilityCodes(userId));
    }

    /**
     * Soft delete: the account keeps its ledger history but can no longer log in.
     */
    public void deactivate(UUID userId) {
        UserAccount user = userCapabilityService.requireActiveUser(userId);
        user.setStatus(UserStatus.INACTIVE);
        user.setDeactivatedAt(OffsetDateTime.now(clock));
        userAccountRepository.save(user);

        auditLogService.record(new AuditLogCommand(
                "USER_DEACTIVATED",
                "USER",
                userId.toString(),
                userId,
                null
        ));
        log.info("Deactivated user {}", userId);
    }

    private LoginResponse issue(UserAccount user) {
        List<String> capabilities = userCapabilityService.activeCapabilityCodes(user.getId());
        TokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), capabilities);
        return new LoginResponse(tokens, buildUserProfile(user, capabilities));
    }

    private UserProfileResponse buildUserProfile(UserAccount user, List<String> capabilities) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                capabilities,
                capabilities.contains(Capability.BORROWER.name()),
                capabilities.contains(Capability.LENDER.name()),
                capabilities.contains(Capability.ADMIN.name()),
                user.getStatus().name(),
                user.getCreatedAt()
        );
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
