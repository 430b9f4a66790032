package com.lendingmarket.backend.global.security;

import java.io.IOException;

import com.lendingmarket.backend.global.error.ErrorCode;
import com.lendingmarket.backend.global.error.ProblemResponse;
import com.lendingmarket.backend.global.web.RequestIdFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public RestAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(
                ErrorCode.INSUFFICIENT_ROLE,
                "Insufficient role for this operation",
                null,
                request.getRequestURI(),
                RequestIdFilter.currentRequestId()
        );

        response.setStatus(ErrorCode.INSUFFICIENT_ROLE.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
