package com.lendingmarket.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

/**
 * Business-rule failure carrying a stable {@link ErrorCode}. Rendered by {@link RestExceptionHandler}.
 */
public class ProblemException extends ResponseStatusException {

    private final ErrorCode errorCode;
    private final String detail;
    private final transient Object details;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public ProblemException(ErrorCode errorCode, String detail, Object details) {
        super(requireCode(errorCode).status(), errorCode.name());
        this.errorCode = errorCode;
        this.detail = (detail != null && !detail.isBlank()) ? detail : errorCode.name();
        this.details = details;
    }

    private static ErrorCode requireCode(ErrorCode errorCode) {
        if (errorCode == null) {
            throw new IllegalArgumentException("ProblemException code must not be null");
        }
        return errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetailMessage() {
        return detail;
    }

    public Object getDetails() {
        return details;
    }
}
