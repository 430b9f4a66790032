package com.lendingmarket.backend.modules.invitation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lendingmarket.backend.global.jpa.AbstractTimestampedEntity;
import com.lendingmarket.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Platform invitation for an email with no account yet. At most one PENDING row exists per email.
 */
@Entity
@Table(name = "email_invitation")
public class EmailInvitation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "invitee_email", nullable = false, length = 320, updatable = false)
    private String inviteeEmail;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "inviter_id", nullable = false, updatable = false)
    private UserAccount inviter;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EmailInvitationStatus status;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    public UUID getId() {
        return id;
    }

    public String getInviteeEmail() {
        return inviteeEmail;
    }

    public void setInviteeEmail(String inviteeEmail) {
        this.inviteeEmail = inviteeEmail;
    }

    public UserAccount getInviter() {
        return inviter;
    }

    public void setInviter(UserAccount inviter) {
        this.inviter = inviter;
    }

    public EmailInvitationStatus getStatus() {
        return status;
    }

    public void setStatus(EmailInvitationStatus status) {
        this.status = status;
    }

    public OffsetDateTime getActivatedAt() {
        return activatedAt;
    }

    public void setActivatedAt(OffsetDateTime activatedAt) {
        this.activatedAt = activatedAt;
    }
}
