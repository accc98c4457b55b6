package com.flaggame.dailychallenge.exception;

public class MalformedAnswerPayloadException extends RuntimeException {

    public MalformedAnswerPayloadException(String message) {
        super(message);
    }
}
