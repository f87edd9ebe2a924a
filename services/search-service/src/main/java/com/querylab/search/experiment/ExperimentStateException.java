package com.querylab.search.experiment;

public class ExperimentStateException extends RuntimeException {
    public ExperimentStateException(String message) {
        super(message);
    }
}
