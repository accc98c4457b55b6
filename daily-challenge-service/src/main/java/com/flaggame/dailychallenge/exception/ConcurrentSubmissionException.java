package com.flaggame.dailychallenge.exception;

/**
 * Another submission for the same user and question won the attempt number.
 * The client may resubmit.
 */
public class ConcurrentSubmissionException extends RuntimeException {

    public ConcurrentSubmissionException(Throwable cause) {
        super("Another answer was submitted at the same time, please retry.", cause);
    }
}
