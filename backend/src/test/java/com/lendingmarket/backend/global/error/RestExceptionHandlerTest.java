package com.lendingmarket.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/repayments");

    @Test
    void problemExceptionKeepsCodeMessageAndDetails() {
        ProblemException ex = new ProblemException(ErrorCode.INVALID_AMOUNT, "Amount exceeds balance",
                Map.of("remaining", "100.00"));

        ResponseEntity<ProblemResponse> response = handler.handleProblemException(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error()).isEqualTo("INVALID_AMOUNT");
        assertThat(response.getBody().message()).isEqualTo("Amount exceeds balance");
        assertThat(response.getBody().details()).isEqualTo(Map.of("remaining", "100.00"));
        assertThat(response.getBody().path()).isEqualTo("/repayments");
    }

    @Test
    void persistenceFailureIsRetryable() {
        ResponseEntity<ProblemResponse> response =
                handler.handleDataAccess(new DataAccessResourceFailureException("down"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("5");
        assertThat(response.getBody().error()).isEqualTo("DATABASE_ERROR");
    }

    @Test
    void integrityViolationIsConflict() {
        ResponseEntity<ProblemResponse> response =
                handler.handleIntegrityViolation(new DataIntegrityViolationException("duplicate key"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().error()).isEqualTo("DATA_CONFLICT");
    }

    @Test
    void blankMessageFallsBackToReasonPhrase() {
        ProblemResponse body = ProblemResponse.of(ErrorCode.LOAN_NOT_FOUND, " ", null, "/loans/x", null);

        assertThat(body.message()).isEqualTo("Not Found");
        assertThat(body.status()).isEqualTo(404);
    }
}
