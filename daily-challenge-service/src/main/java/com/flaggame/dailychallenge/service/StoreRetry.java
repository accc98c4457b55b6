package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.exception.ChallengeUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a storage-bound operation, retrying exactly once on a transient
 * data access failure. Attempt numbering and cycle resets are not safe to
 * replay more than that.
 */
@Slf4j
@Component
public class StoreRetry {

    public <T> T once(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException first) {
            log.warn("Transient storage failure during {}, retrying once: {}", operation, first.getMessage());
            try {
                return action.get();
            } catch (TransientDataAccessException second) {
                throw new ChallengeUnavailableException("Storage unavailable during " + operation, second);
            }
        }
    }
}
