package com.flaggame.dailychallenge.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Correct answer of a question, one subtype per {@link AnswerFormat}.
 * Stored as JSON with the format tag in the {@code format} property; a tag
 * this build does not know reads back as {@link UnknownAnswer}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY,
        property = "format", defaultImpl = UnknownAnswer.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextAnswer.class, name = "text_input"),
        @JsonSubTypes.Type(value = MultipleChoiceAnswer.class, name = "multiple_choice"),
        @JsonSubTypes.Type(value = TrueFalseAnswer.class, name = "true_false")
})
public abstract class AcceptedAnswer {
}
