package com.flaggame.dailychallenge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A challenge from an earlier day. The country is no longer secret.
 */
@Data
@Builder
public class PastChallengeSummary {
    private Long id;
    private LocalDate date;
    private CountrySummary country;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private UserAnswerSummary userAnswer; // null when anonymous or not played

    @Data
    @Builder
    public static class CountrySummary {
        private String code;
        private String name;
        private String flagEmoji;
        private String flagSvgUrl;
        private String flagPngUrl;
    }

    @Data
    @Builder
    public static class UserAnswerSummary {
        private boolean correct;
        private int attemptsUsed;
        private Instant answeredAt;
    }
}
