package com.dbtide.backend.exception;

/** The document bytes are not well-formed UTF-8, so no tree can be built for them. */
public class InvalidDocumentEncodingException extends Exception {

    public InvalidDocumentEncodingException(String message) {
        super(message);
    }

    public InvalidDocumentEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
