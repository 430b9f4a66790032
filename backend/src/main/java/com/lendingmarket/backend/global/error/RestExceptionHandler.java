package com.lendingmarket.backend.global.error;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lendingmarket.backend.global.web.RequestIdFilter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);
    private static final int DATABASE_RETRY_AFTER_SECONDS = 5;

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(
                ex.getErrorCode(),
                ex.getDetailMessage(),
                ex.getDetails(),
                request.getRequestURI(),
                RequestIdFilter.currentRequestId()
        );
        return ResponseEntity.status(ex.getErrorCode().status()).body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex,
                                                                         HttpServletRequest request) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        ErrorCode code = fallbackCode(status);
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = new ProblemResponse(code.name(), message, null, status.value(),
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                     HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        List<String> parts = new ArrayList<>();
        fieldErrors.forEach((field, message) -> parts.add(field + ": " + message));
        String detail = parts.isEmpty() ? "Validation failed" : String.join("; ", parts);
        return respond(ErrorCode.VALIDATION_ERROR, detail, fieldErrors, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                     HttpServletRequest request) {
        return respond(ErrorCode.VALIDATION_ERROR, ex.getMessage(), null, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        return respond(ErrorCode.MALFORMED_REQUEST, "Request body or parameter could not be parsed", null, request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return respond(ErrorCode.INSUFFICIENT_ROLE, "Insufficient role for this operation", null, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleIntegrityViolation(DataIntegrityViolationException ex,
                                                                    HttpServletRequest request) {
        log.warn("Integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(ErrorCode.DATA_CONFLICT, "Request conflicts with the current ledger state", null, request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Persistence failure on {}", request.getRequestURI(), ex);
        ProblemResponse body = ProblemResponse.of(ErrorCode.DATABASE_ERROR,
                "Database temporarily unavailable. Please retry.", null,
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(ErrorCode.DATABASE_ERROR.status())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(DATABASE_RETRY_AFTER_SECONDS))
                .body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled failure on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ProblemResponse> respond(ErrorCode code, String message, Object details,
                                                    HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(code, message, details,
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(code.status()).body(body);
    }

    private ErrorCode fallbackCode(HttpStatus status) {
        return switch (status) {
            case UNAUTHORIZED -> ErrorCode.UNAUTHORIZED;
            case FORBIDDEN -> ErrorCode.ACCESS_DENIED;
            case BAD_REQUEST -> ErrorCode.MALFORMED_REQUEST;
            case UNPROCESSABLE_ENTITY -> ErrorCode.VALIDATION_ERROR;
            case SERVICE_UNAVAILABLE -> ErrorCode.DATABASE_ERROR;
            default -> ErrorCode.INTERNAL_ERROR;
        };
    }
}
