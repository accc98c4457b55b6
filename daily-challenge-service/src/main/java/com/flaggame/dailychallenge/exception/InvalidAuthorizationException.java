package com.flaggame.dailychallenge.exception;

public class InvalidAuthorizationException extends RuntimeException {

    public InvalidAuthorizationException(String message) {
        super(message);
    }

    public InvalidAuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
