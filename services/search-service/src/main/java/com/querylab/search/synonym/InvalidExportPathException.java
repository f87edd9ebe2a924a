package com.querylab.search.synonym;

public class InvalidExportPathException extends RuntimeException {
    public InvalidExportPathException(String message) {
        super(message);
    }
}
