package com.mouse.apex.exception;

public class CollaboratorUnavailableException extends RuntimeException {
    public CollaboratorUnavailableException() {
        super();
    }

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
