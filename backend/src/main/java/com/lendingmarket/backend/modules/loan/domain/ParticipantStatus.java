package com.lendingmarket.backend.modules.loan.domain;

public enum ParticipantStatus {
    PENDING,
    ACCEPTED,
    DECLINED
}
