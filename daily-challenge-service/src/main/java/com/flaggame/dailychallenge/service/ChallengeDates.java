package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.config.ChallengeProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar date in the configured challenge zone
 */
@Component
public class ChallengeDates {

    private final Clock clock;
    private final ZoneId zone;

    public ChallengeDates(Clock clock, ChallengeProperties properties) {
        this.clock = clock;
        this.zone = properties.getTimezone();
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }
}
