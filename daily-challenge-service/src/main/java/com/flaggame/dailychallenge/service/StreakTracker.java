package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.entity.UserStreakState;
import com.flaggame.dailychallenge.repository.UserStreakStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;

/**
 * Keeps per-user day streaks. Called once per finished challenge, never per attempt.
 */
@Slf4j
@Service
public class StreakTracker {

    private final UserStreakStateRepository streakRepository;

    public StreakTracker(UserStreakStateRepository streakRepository) {
        this.streakRepository = streakRepository;
    }

    /**
     * Record the outcome of a finished challenge.
     *
     * @param correct     whether the user found the country
     * @param countryCode country of the challenge, remembered when missed
     * @param date        challenge date
     */
    @Transactional
    public UserStreakState record(Long userId, boolean correct, String countryCode, LocalDate date) {
        UserStreakState state = streakRepository.findByUserId(userId)
                .orElseGet(() -> emptyState(userId));

        state.setTotalCompleted(state.getTotalCompleted() + 1);

        if (correct) {
            LocalDate lastCorrect = state.getLastCorrectDate();
            if (lastCorrect != null && lastCorrect.equals(date.minusDays(1))) {
                state.setCurrentStreak(state.getCurrentStreak() + 1);
            } else {
                state.setCurrentStreak(1);
            }
            state.setLongestStreak(Math.max(state.getLongestStreak(), state.getCurrentStreak()));
            state.setTotalCorrect(state.getTotalCorrect() + 1);
            state.setLastCorrectDate(date);
        } else {
            state.setCurrentStreak(0);
            state.getMissedCountryCodes().add(countryCode);
        }
        state.setLastGuessDate(date);

        log.debug("User {} finished challenge of {} correct={} streak={}",
                userId, date, correct, state.getCurrentStreak());
        return streakRepository.save(state);
    }

    public UserStreakState stateOf(Long userId) {
        return streakRepository.findByUserId(userId).orElseGet(() -> emptyState(userId));
    }

    private static UserStreakState emptyState(Long userId) {
        return UserStreakState.builder()
                .userId(userId)
                .totalCorrect(0)
                .totalCompleted(0)
                .currentStreak(0)
                .longestStreak(0)
                .missedCountryCodes(new HashSet<>())
                .build();
    }
}
