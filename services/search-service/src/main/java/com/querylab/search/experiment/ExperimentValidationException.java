package com.querylab.search.experiment;

public class ExperimentValidationException extends RuntimeException {
    public ExperimentValidationException(String message) {
        super(message);
    }
}
