package com.flaggame.dailychallenge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DailyChallengeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyChallengeServiceApplication.class, args);
    }
}
