package com.arincdelta.jdbc.loader;

/**
 * Checked exception signalling that a snapshot file could not be read. The run that hit it has no
 * usable output.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
