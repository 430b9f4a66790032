package com.lendingmarket.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lendingmarket.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select ua from UserAccount ua where lower(ua.email) = lower(:email)")
    Optional<UserAccount> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select ua from UserAccount ua where lower(ua.email) in :emails")
    List<UserAccount> findByEmailsIgnoreCase(@Param("emails") Collection<String> emails);
}
