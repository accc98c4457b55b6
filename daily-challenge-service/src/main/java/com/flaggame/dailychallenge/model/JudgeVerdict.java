package com.flaggame.dailychallenge.model;

import lombok.Value;

@Value
public class JudgeVerdict {
    boolean correct;
    String explanation;
}
