package com.eainde.kyc.exception;

/**
 * Thrown when a batch upload cannot be read at all. No row of such an upload is processed.
 */
public class MalformedBatchException extends KycException {

    public MalformedBatchException(String message) {
        super(message);
    }

    public MalformedBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
