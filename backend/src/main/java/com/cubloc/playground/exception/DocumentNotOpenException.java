package com.cubloc.playground.exception;

public class DocumentNotOpenException extends Exception {

    public DocumentNotOpenException(String uri) {
        super("Document is not open: " + uri);
    }
}
