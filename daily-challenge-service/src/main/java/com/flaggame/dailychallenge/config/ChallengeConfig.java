package com.flaggame.dailychallenge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(ChallengeProperties.class)
public class ChallengeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random selectionRandom() {
        return new SecureRandom();
    }
}
