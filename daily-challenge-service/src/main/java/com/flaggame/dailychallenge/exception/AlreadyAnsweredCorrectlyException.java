package com.flaggame.dailychallenge.exception;

public class AlreadyAnsweredCorrectlyException extends RuntimeException {

    public AlreadyAnsweredCorrectlyException() {
        super("You have already answered this challenge correctly.");
    }
}
