package com.govledger.exception;

import com.govledger.dto.ApiResponses;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * LEDGER ERROR → HTTP STATUS MAPPING:
 *
 * Exception Type                    | HTTP Status | error code
 * ----------------------------------|-------------|------------------
 * InvalidInputException             | 400         | INVALID_INPUT
 * MethodArgumentNotValidException   | 400         | field → message map
 * ProposalNotFoundException         | 404         | NOT_FOUND
 * ProposalInactiveException         | 409         | INACTIVE
 * ProposalAlreadyClosedException    | 409         | ALREADY_CLOSED
 * DuplicateVoteException            | 409         | DUPLICATE_VOTE
 * DataIntegrityViolationException   | 409         | DUPLICATE_VOTE on uk_vote_records_proposal_voter,
 *                                   |             | CONFLICT for any other constraint
 * UnauthorizedCallerException       | 403         | UNAUTHORIZED
 * Exception (fallback)              | 500         | INTERNAL_SERVER_ERROR
 *
 * The ledger exceptions extend the JDK types below, so handlers are keyed on
 * those and the error code comes from {@link GovernanceViolation}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String VOTE_UNIQUE_CONSTRAINT = "uk_vote_records_proposal_voter";

    // ─────────────────────────────────────────────────────────────────────────
    // 403 FORBIDDEN
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Non-administrator attempted create, close or administrator transfer.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleForbidden(SecurityException ex) {
        return error(HttpStatus.FORBIDDEN, codeOf(ex, "FORBIDDEN"), ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, codeOf(ex, "BAD_REQUEST"), ex.getMessage());
    }

    /**
     * Handles @Valid/@NotBlank/@NotNull failures on request DTOs.
     * Returns a field → message map for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    /**
     * Malformed JSON body or a non-numeric proposal id in the path.
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Malformed request");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, codeOf(ex, "NOT_FOUND"), ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT - proposal lifecycle / duplicate vote
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return error(HttpStatus.CONFLICT, codeOf(ex, "CONFLICT"), ex.getMessage());
    }

    /**
     * A concurrent duplicate vote that slipped past the service-level check
     * hits the unique constraint on vote_records(proposal_id, voter). Any other
     * constraint (e.g. a registration race on members.address) is a plain conflict.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        String cause = String.valueOf(ex.getMostSpecificCause().getMessage());
        log.warn("Data integrity violation: {}", cause);
        if (violates(ex, VOTE_UNIQUE_CONSTRAINT)) {
            return error(HttpStatus.CONFLICT, "DUPLICATE_VOTE", "This address has already voted on this proposal");
        }
        return error(HttpStatus.CONFLICT, "CONFLICT", "The request conflicts with stored data");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Safety net for any unhandled exception.
     * Message is deliberately generic; internal detail must not leak to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please contact support.");
    }

    private static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        String needle = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve
                    && cve.getConstraintName() != null
                    && cve.getConstraintName().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
            if (t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String codeOf(Exception ex, String fallback) {
        return ex instanceof GovernanceViolation violation ? violation.errorCode() : fallback;
    }

    private static ResponseEntity<ApiResponses.ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiResponses.ErrorResponse(code, message));
    }
}
