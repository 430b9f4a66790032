package com.lendingmarket.backend.modules.invitation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.modules.invitation.domain.EmailInvitation;
import com.lendingmarket.backend.modules.invitation.domain.EmailInvitationStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailInvitationRepository extends JpaRepository<EmailInvitation, UUID> {

    @Query("""
            select ei from EmailInvitation ei
             where ei.inviteeEmail = :email
               and ei.status = :status
            """)
    List<EmailInvitation> findByEmailAndStatus(@Param("email") String email,
                                               @Param("status") EmailInvitationStatus status);

    /**
     * Inserts a PENDING invitation unless one is already pending for the email, including one
     * committed concurrently by another loan's batch. Returns the number of rows inserted.
     */
    @Modifying
    @Query(value = """
            insert into email_invitation (id, invitee_email, inviter_id, status, created_at, updated_at)
            values (:id, :email, :inviterId, 'PENDING', :now, :now)
            on conflict (invitee_email) where status = 'PENDING' do nothing
            """, nativeQuery = true)
    int insertPendingIfAbsent(@Param("id") UUID id,
                              @Param("email") String email,
                              @Param("inviterId") UUID inviterId,
                              @Param("now") OffsetDateTime now);
}
