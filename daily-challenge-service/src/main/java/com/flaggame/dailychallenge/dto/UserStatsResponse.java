package com.flaggame.dailychallenge.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
public class UserStatsResponse {
    private Long userId;
    private int totalCorrect;
    private int totalCompleted;
    private int currentStreak;
    private int longestStreak;
    private LocalDate lastCorrectDate;
    private LocalDate lastGuessDate;
    private List<String> missedCountryCodes;
}
