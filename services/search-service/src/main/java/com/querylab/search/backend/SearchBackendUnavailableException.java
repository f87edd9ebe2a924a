package com.querylab.search.backend;

public class SearchBackendUnavailableException extends RuntimeException {
    public SearchBackendUnavailableException(String message) {
        super(message);
    }

    public SearchBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
