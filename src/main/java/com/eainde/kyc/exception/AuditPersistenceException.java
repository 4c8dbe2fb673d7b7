package com.eainde.kyc.exception;

/**
 * Thrown when a scored record could not be durably written to the audit log.
 * The record must then be treated as not scored.
 */
public class AuditPersistenceException extends KycException {

    public AuditPersistenceException(String message) {
        super(message);
    }

    public AuditPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
