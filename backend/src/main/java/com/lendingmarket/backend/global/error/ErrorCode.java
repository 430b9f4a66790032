package com.lendingmarket.backend.global.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    // validation
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_AMOUNT(HttpStatus.UNPROCESSABLE_ENTITY),
    MALFORMED_REQUEST(HttpStatus.BAD_REQUEST),

    // authentication / authorization
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED),
    USER_INACTIVE(HttpStatus.FORBIDDEN),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN),

    // lookups
    USER_NOT_FOUND(HttpStatus.NOT_FOUND),
    LOAN_NOT_FOUND(HttpStatus.NOT_FOUND),
    PARTICIPANT_NOT_FOUND(HttpStatus.NOT_FOUND),
    REPAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND),

    // state conflicts
    ALREADY_ACCEPTED(HttpStatus.CONFLICT),
    ALREADY_REVIEWED(HttpStatus.CONFLICT),
    LOAN_FULLY_FUNDED(HttpStatus.CONFLICT),
    LOAN_NOT_OPEN(HttpStatus.CONFLICT),
    LOAN_NOT_ACTIVE(HttpStatus.CONFLICT),
    PARTICIPANT_NOT_ACCEPTED(HttpStatus.CONFLICT),
    DUPLICATE_INVITATION(HttpStatus.CONFLICT),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT),
    DATA_CONFLICT(HttpStatus.CONFLICT),

    // infrastructure
    DATABASE_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
