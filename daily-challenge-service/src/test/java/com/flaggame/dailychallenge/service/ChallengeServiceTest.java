package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.entity.ChallengeAttempt;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChallengeServiceTest {

    @Test
    void testAltTextLosesEverySpellingLongestFirst() {
        String redacted = ChallengeService.withoutName(
                "The flag of the United States of America, also called the USA flag.",
                List.of("United States", "united states of america", "usa", "us", "America"));

        assertEquals("The flag of the this country, also called the this country flag.", redacted);
    }

    @Test
    void testShortSpellingOnlyMatchesWholeWords() {
        assertEquals("Thus this country flag shows stars.",
                ChallengeService.withoutName("Thus the US flag shows stars.", List.of("the us", "us")));
    }

    @Test
    void testAltTextWithoutSpellingsIsUnchanged() {
        assertEquals("Red and white.", ChallengeService.withoutName("Red and white.", List.of("Peru", " ")));
        assertNull(ChallengeService.withoutName(null, List.of("Peru")));
    }

    @Test
    void testOnlyAttemptNumberCollisionIsAConflict() {
        DataIntegrityViolationException duplicate = new DataIntegrityViolationException("could not execute statement",
                new ConstraintViolationException("duplicate key", new SQLException("23505"),
                        "PUBLIC." + ChallengeAttempt.UK_ATTEMPT_NUMBER.toUpperCase() + "_INDEX_A"));
        DataIntegrityViolationException tooLong = new DataIntegrityViolationException("could not execute statement",
                new SQLException("Value too long for column \"SUBMITTED_ANSWER\""));

        assertTrue(ChallengeService.isAttemptNumberConflict(duplicate));
        assertFalse(ChallengeService.isAttemptNumberConflict(tooLong));
    }
}
