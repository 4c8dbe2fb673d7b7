package com.eainde.kyc.controller;

import com.eainde.kyc.exception.AuditPersistenceException;
import com.eainde.kyc.exception.KycException;
import com.eainde.kyc.exception.MalformedBatchException;
import com.eainde.kyc.exception.RecordValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;

/**
 * Maps pipeline exceptions to HTTP responses with a uniform {@link ErrorResponse} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RecordValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(RecordValidationException ex) {
        log.warn("Rejected submission: {}", ex.getViolations());
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", ex.getViolations());
    }

    @ExceptionHandler(MalformedBatchException.class)
    public ResponseEntity<ErrorResponse> handleMalformedBatch(MalformedBatchException ex) {
        log.warn("Rejected batch upload: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Request body or parameters could not be read", null);
    }

    @ExceptionHandler(AuditPersistenceException.class)
    public ResponseEntity<ErrorResponse> handleAuditFailure(AuditPersistenceException ex) {
        log.error("Audit log write failed, result discarded", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Verification could not be recorded", null);
    }

    @ExceptionHandler(KycException.class)
    public ResponseEntity<ErrorResponse> handleKycException(KycException ex) {
        log.error("Verification failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, List<String> violations) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .violations(violations)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
