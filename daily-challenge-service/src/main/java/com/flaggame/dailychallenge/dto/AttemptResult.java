package com.flaggame.dailychallenge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flaggame.dailychallenge.model.AcceptedAnswer;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one submission. {@code correctAnswer} and {@code explanation}
 * are only filled once the challenge is completed for the user.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttemptResult {
    private boolean correct;
    private String explanation;
    private int attemptNumber;
    private int attemptsRemaining;
    private boolean completed;
    private Long attemptId;
    private AcceptedAnswer correctAnswer;
}
