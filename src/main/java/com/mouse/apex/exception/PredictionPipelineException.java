package com.mouse.apex.exception;

public class PredictionPipelineException extends RuntimeException {
    public PredictionPipelineException() {
        super();
    }

    public PredictionPipelineException(String message) {
        super(message);
    }

    public PredictionPipelineException(String message, Throwable e) {
        super(message, e);
    }
}
