package com.mouse.apex.exception;

public class NoHighValueFixturesException extends RuntimeException {
    public NoHighValueFixturesException() {
        super();
    }

    public NoHighValueFixturesException(String message) {
        super(message);
    }

    public NoHighValueFixturesException(String message, Throwable e) {
        super(message, e);
    }
}
