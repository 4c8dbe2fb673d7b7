package com.eainde.kyc.feature;

/**
 * Decides whether a document number has the shape expected for one document type.
 */
@FunctionalInterface
public interface DocumentNumberValidator {

    boolean isWellFormed(String documentNumber);
}
