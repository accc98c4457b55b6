package com.flaggame.dailychallenge.model;

/**
 * What aspect of a country a question is about
 */
public enum QuestionCategory {
    FLAG("Flag Recognition"),
    CAPITAL("Capital City"),
    POPULATION("Population"),
    CURRENCY("Currency"),
    LANGUAGE("Language(s)");

    private final String title;

    QuestionCategory(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
