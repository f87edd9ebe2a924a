package com.querylab.search.experiment;

public class ExperimentConflictException extends RuntimeException {
    public ExperimentConflictException(String message) {
        super(message);
    }
}
