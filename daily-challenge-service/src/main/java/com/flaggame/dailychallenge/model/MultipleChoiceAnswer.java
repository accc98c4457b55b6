package com.flaggame.dailychallenge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class MultipleChoiceAnswer extends AcceptedAnswer {
    private String correct;
    private List<String> options = new ArrayList<>();
}
