package com.flaggame.dailychallenge.model;

/**
 * How a user answers a question
 */
public enum AnswerFormat {
    /**
     * Free text, matched case-insensitively against the accepted spellings
     */
    TEXT_INPUT("text_input", "Text Input"),

    /**
     * One option out of a fixed list, matched exactly
     */
    MULTIPLE_CHOICE("multiple_choice", "Multiple Choice"),

    TRUE_FALSE("true_false", "True/False");

    private final String tag;
    private final String label;

    AnswerFormat(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public String getTag() {
        return tag;
    }

    public String getLabel() {
        return label;
    }
}
