package com.flaggame.dailychallenge.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnswerSubmissionRequest {

    @NotNull
    @Valid
    private AnswerData answerData;

    @PositiveOrZero
    private Integer timeTakenSeconds;
}
