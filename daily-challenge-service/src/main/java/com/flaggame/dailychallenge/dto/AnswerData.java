package com.flaggame.dailychallenge.dto;

import com.flaggame.dailychallenge.service.AnswerJudge;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User's answer. Which field is read depends on the question format:
 * {@code text} for text input, {@code selectedOption} for multiple choice,
 * {@code answer} for true/false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerData {
    @Size(max = AnswerJudge.MAX_ANSWER_LENGTH)
    private String text;
    @Size(max = AnswerJudge.MAX_ANSWER_LENGTH)
    private String selectedOption;
    private Boolean answer;
}
