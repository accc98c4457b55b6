package com.flaggame.dailychallenge.exception;

/**
 * Thrown when a rotation track has no country to choose from.
 */
public class NoEligibleItemsException extends RuntimeException {

    public NoEligibleItemsException(String trackKey) {
        super("No eligible countries for rotation track '" + trackKey + "'");
    }
}
