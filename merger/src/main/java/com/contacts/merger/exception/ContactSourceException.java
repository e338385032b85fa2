package com.contacts.merger.exception;

/**
 * A contact source (CSV file or database) could not be read.
 */
public class ContactSourceException extends RuntimeException {

    public ContactSourceException(String message) {
        super(message);
    }

    public ContactSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
