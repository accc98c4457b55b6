package com.flaggame.dailychallenge.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ChallengeHistoryPage {
    private long count;
    private int page;
    private int pageSize;
    private boolean hasNext;
    private List<PastChallengeSummary> results;
}
