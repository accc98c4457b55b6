package com.flaggame.dailychallenge.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class UserChallengeStatus {
    private boolean hasCompleted;
    private int attemptsUsed;
    private int attemptsRemaining;
    private Boolean correct; // null while still in progress
    private Instant lastAttemptAt;
}
