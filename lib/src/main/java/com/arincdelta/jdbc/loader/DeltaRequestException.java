package com.arincdelta.jdbc.loader;

/** Rejected run configuration: unknown record type, unknown region token, or no snapshot at all. */
public final class DeltaRequestException extends Exception {
    public DeltaRequestException(String message) {
        super(message);
    }
}
