package com.lendingmarket.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemException;
import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;
import com.lendingmarket.backend.modules.auth.domain.UserCapability;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lendingmarket.backend.modules.auth.infrastructure.persistence.UserCapabilityRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Capability lookups and grants. Authorization decisions read capabilities from the database,
 * never from the token snapshot, so a LENDER grant takes effect on the next request.
 */
@Service
@Transactional
public class UserCapabilityService {

    private static final Logger log = LoggerFactory.getLogger(UserCapabilityService.class);

    private final UserAccountRepository userAccountRepository;
    private final UserCapabilityRepository userCapabilityRepository;
    private final Clock clock;

    public UserCapabilityService(
            UserAccountRepository userAccountRepository,
            UserCapabilityRepository userCapabilityRepository,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.userCapabilityRepository = userCapabilityRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public UserAccount requireActiveUser(UUID userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ErrorCode.USER_NOT_FOUND, "User not found"));
        if (!user.isActive()) {
            throw new ProblemException(ErrorCode.USER_INACTIVE, "User account is inactive");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public Set<Capability> activeCapabilities(UUID userId) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (UserCapability capability : userCapabilityRepository.findActiveCapabilities(userId)) {
            capabilities.add(capability.getCapability());
        }
        return capabilities;
    }

    @Transactional(readOnly = true)
    public List<String> activeCapabilityCodes(UUID userId) {
        return activeCapabilities(userId).stream()
                .map(Capability::name)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasCapability(UUID userId, Capability capability) {
        return userCapabilityRepository.existsActive(userId, capability);
    }

    /**
     * Loads the user and fails with {@code INSUFFICIENT_ROLE} unless the capability is held.
     */
    @Transactional(readOnly = true)
    public UserAccount requireCapability(UUID userId, Capability capability) {
        UserAccount user = requireActiveUser(userId);
        if (!userCapabilityRepository.existsActive(userId, capability)) {
            throw new ProblemException(ErrorCode.INSUFFICIENT_ROLE, capability.name() + " capability required");
        }
        return user;
    }

    /**
     * Idempotent: returns false when the capability was already active.
     */
    public boolean grant(UserAccount user, Capability capability) {
        if (userCapabilityRepository.existsActive(user.getId(), capability)) {
            return false;
        }
        UserCapability grant = new UserCapability();
        grant.setUserAccount(user);
        grant.setCapability(capability);
        grant.setGrantedAt(OffsetDateTime.now(clock));
        userCapabilityRepository.save(grant);
        log.info("Granted {} to user {}", capability, user.getId());
        return true;
    }
}
