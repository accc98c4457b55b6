package com.flaggame.dailychallenge.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Today's challenge as shown before the answer is known: flag assets only,
 * no country name or code, no accepted answer.
 */
@Data
@Builder
public class ChallengePublicView {
    private Long id;
    private LocalDate date;
    private QuestionView question;
    private FlagView country;
    private UserChallengeStatus userStatus;

    @Data
    @Builder
    public static class QuestionView {
        private Long id;
        private String category;
        private String format;
        private String questionText;
    }

    @Data
    @Builder
    public static class FlagView {
        private String flagEmoji;
        private String flagSvgUrl;
        private String flagPngUrl;
        private String flagAltText;
    }
}
