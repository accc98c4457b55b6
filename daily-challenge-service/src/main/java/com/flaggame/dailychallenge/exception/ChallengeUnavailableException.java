package com.flaggame.dailychallenge.exception;

public class ChallengeUnavailableException extends RuntimeException {

    public ChallengeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
