package com.eainde.kyc.exception;

/**
 * Base type for failures surfaced to callers of the verification pipelines.
 */
public class KycException extends RuntimeException {

    public KycException(String message) {
        super(message);
    }

    public KycException(String message, Throwable cause) {
        super(message, cause);
    }
}
