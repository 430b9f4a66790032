package com.lendingmarket.backend.modules.invitation.domain;

public enum EmailInvitationStatus {
    PENDING,
    ACTIVATED
}
