package com.flaggame.dailychallenge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Display answer plus every lower-cased spelling that counts as correct,
 * sorted and without duplicates.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class TextAnswer extends AcceptedAnswer {
    private String answer;
    private List<String> alternates = new ArrayList<>();
}
