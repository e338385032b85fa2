package com.contacts.merger.exception;

public class ContactExportException extends RuntimeException {

    public ContactExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
