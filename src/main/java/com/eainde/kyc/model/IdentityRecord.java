package com.eainde.kyc.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A validated identity submission. Only {@code IdentityRecordValidator} creates these from
 * user input, so every instance carries a non-blank name and document number.
 *
 * @param name           holder's full name
 * @param documentNumber document identifier as printed on the document
 * @param address        postal address, empty when not supplied
 * @param documentType   declared document type
 */
public record IdentityRecord(
        String name,
        String documentNumber,
        String address,
        DocumentType documentType
) implements Serializable {

    public IdentityRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(documentNumber, "documentNumber");
        Objects.requireNonNull(documentType, "documentType");
        address = address == null ? "" : address;
    }

    public IdentityRecord(String name, String documentNumber, DocumentType documentType) {
        this(name, documentNumber, "", documentType);
    }
}
