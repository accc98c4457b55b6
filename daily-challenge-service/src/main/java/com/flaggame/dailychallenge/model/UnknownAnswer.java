package com.flaggame.dailychallenge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Stored answer whose format tag is not recognised. Always judged incorrect.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnknownAnswer extends AcceptedAnswer {

    public static final String DESCRIPTION = "Unknown question format";

    public String getDescription() {
        return DESCRIPTION;
    }
}
