package com.lendingmarket.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.modules.auth.domain.Capability;
import com.lendingmarket.backend.modules.auth.domain.UserCapability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserCapabilityRepository extends JpaRepository<UserCapability, UUID> {

    @Query("select uc from UserCapability uc where uc.userAccount.id = :userId and uc.revokedAt is null")
    List<UserCapability> findActiveCapabilities(@Param("userId") UUID userId);

    @Query("""
            select case when count(uc) > 0 then true else false end
              from UserCapability uc
             where uc.userAccount.id = :userId
               and uc.capability = :capability
               and uc.revokedAt is null
            """)
    boolean existsActive(@Param("userId") UUID userId, @Param("capability") Capability capability);
}
