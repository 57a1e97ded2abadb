package com.dbtide.backend.exception;

public class DocumentNotFoundException extends RuntimeException {

    private final String uri;

    public DocumentNotFoundException(String uri) {
        super("Document is not open: " + uri);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
