package com.lendingmarket.backend.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String error,
        String message,
        Object details,
        int status,
        String path,
        String requestId
) {

    public static ProblemResponse of(ErrorCode code, String message, Object details, String path, String requestId) {
        String safeMessage = (message != null && !message.isBlank()) ? message : code.status().getReasonPhrase();
        return new ProblemResponse(code.name(), safeMessage, details, code.status().value(), path, requestId);
    }
}
