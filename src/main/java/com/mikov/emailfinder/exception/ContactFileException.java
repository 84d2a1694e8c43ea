package com.mikov.emailfinder.exception;

/**
 * The contact file could not be read or lacks a required column.
 */
public class ContactFileException extends RuntimeException {

    public ContactFileException(final String message) {
        super(message);
    }

    public ContactFileException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
