package com.mouse.apex.exception;

public class FixtureAnalysisException extends RuntimeException {
    public FixtureAnalysisException() {
        super();
    }

    public FixtureAnalysisException(String message) {
        super(message);
    }

    public FixtureAnalysisException(String message, Throwable e) {
        super(message, e);
    }
}
