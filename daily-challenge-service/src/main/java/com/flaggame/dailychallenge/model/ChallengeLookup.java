package com.flaggame.dailychallenge.model;

import com.flaggame.dailychallenge.entity.DailyChallenge;
import lombok.Value;

@Value
public class ChallengeLookup {
    DailyChallenge challenge;
    boolean created;
}
