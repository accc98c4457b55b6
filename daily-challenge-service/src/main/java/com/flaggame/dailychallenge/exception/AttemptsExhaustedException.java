package com.flaggame.dailychallenge.exception;

public class AttemptsExhaustedException extends RuntimeException {

    public AttemptsExhaustedException() {
        super("No attempts remaining for today's challenge.");
    }
}
