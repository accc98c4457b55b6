package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.config.ChallengeProperties;
import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.entity.Question;
import com.flaggame.dailychallenge.model.AnswerFormat;
import com.flaggame.dailychallenge.model.QuestionCategory;
import com.flaggame.dailychallenge.model.TextAnswer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Derives the flag question of a daily challenge.
 */
@Component
public class QuestionFactory {

    static final String FLAG_QUESTION_TEXT = "Which country does this flag belong to?";

    private final ChallengeProperties properties;

    public QuestionFactory(ChallengeProperties properties) {
        this.properties = properties;
    }

    public Question flagQuestion(DailyChallenge challenge) {
        Country country = challenge.getCountry();
        return Question.builder()
                .challenge(challenge)
                .category(QuestionCategory.FLAG)
                .format(AnswerFormat.TEXT_INPUT)
                .questionText(FLAG_QUESTION_TEXT)
                .correctAnswer(new TextAnswer(country.getName(), acceptedSpellings(country)))
                .build();
    }

    /**
     * Lower-cased name, catalog spellings and configured extras, deduplicated,
     * sorted, blanks dropped.
     */
    List<String> acceptedSpellings(Country country) {
        TreeSet<String> spellings = new TreeSet<>();
        add(spellings, List.of(country.getName()));
        if (country.getAltSpellings() != null) {
            add(spellings, country.getAltSpellings());
        }
        add(spellings, manualAlternates(country.getCode()));
        return new ArrayList<>(spellings);
    }

    private List<String> manualAlternates(String code) {
        for (Map.Entry<String, List<String>> entry : properties.getManualAlternates().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(code) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    private static void add(TreeSet<String> target, Collection<String> spellings) {
        for (String spelling : spellings) {
            if (spelling == null) {
                continue;
            }
            String normalized = spelling.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                target.add(normalized);
            }
        }
    }
}
