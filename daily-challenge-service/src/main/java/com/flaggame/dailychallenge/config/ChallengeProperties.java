package com.flaggame.dailychallenge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the daily challenge engine, bound from {@code challenge.*}.
 */
@Data
@ConfigurationProperties(prefix = "challenge")
public class ChallengeProperties {

    /**
     * Zone in which "today" is computed. Every instance must use the same one.
     */
    private ZoneId timezone = ZoneId.of("America/New_York");

    private int historyPageSize = 20;

    private String selectionAlgorithmVersion = "v2_tier_rotation";

    /**
     * Extra accepted spellings per country code, on top of the catalog's own.
     */
    private Map<String, List<String>> manualAlternates = new HashMap<>();
}
