package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.config.ChallengeProperties;
import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.model.ChallengeLookup;
import com.flaggame.dailychallenge.model.Tier;
import com.flaggame.dailychallenge.repository.DailyChallengeRepository;
import com.flaggame.dailychallenge.repository.QuestionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Maps calendar days to their single challenge, creating it on first request.
 * <p>
 * No lock is taken. The unique date column decides which concurrent creator
 * wins; losers read the winner's row. A country selected by a loser stays
 * consumed in the rotation.
 */
@Slf4j
@Service
public class ChallengeCalendar {

    static final int MAX_CREATE_TRIES = 5;

    private final DailyChallengeRepository challengeRepository;
    private final QuestionRepository questionRepository;
    private final RotationTrackService rotation;
    private final QuestionFactory questionFactory;
    private final ChallengeDates dates;
    private final ChallengeProperties properties;
    private final TransactionTemplate newTransaction;

    public ChallengeCalendar(DailyChallengeRepository challengeRepository,
                             QuestionRepository questionRepository,
                             RotationTrackService rotation,
                             QuestionFactory questionFactory,
                             ChallengeDates dates,
                             ChallengeProperties properties,
                             PlatformTransactionManager transactionManager) {
        this.challengeRepository = challengeRepository;
        this.questionRepository = questionRepository;
        this.rotation = rotation;
        this.questionFactory = questionFactory;
        this.dates = dates;
        this.properties = properties;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Today's challenge, in the configured zone
     */
    public ChallengeLookup getOrCreateToday() {
        return getOrCreate(dates.today());
    }

    ChallengeLookup getOrCreate(LocalDate date) {
        for (int attempt = 1; ; attempt++) {
            Optional<DailyChallenge> existing = challengeRepository.findByDate(date);
            if (existing.isPresent()) {
                return new ChallengeLookup(existing.get(), false);
            }

            try {
                Country country = rotation.selectNext(Tier.defaultTier());
                DailyChallenge created = newTransaction.execute(status -> createWithQuestion(date, country));
                log.info("Created daily challenge for {} with country {}", date, country.getCode());
                return new ChallengeLookup(created, true);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // usually another caller created the day's row first
                Optional<DailyChallenge> winner = challengeRepository.findByDate(date);
                if (winner.isPresent()) {
                    log.debug("Daily challenge for {} created concurrently, using it", date);
                    return new ChallengeLookup(winner.get(), false);
                }
                if (attempt >= MAX_CREATE_TRIES) {
                    throw e;
                }
                log.debug("Creating challenge for {} failed on try {}, retrying", date, attempt);
            }
        }
    }

    // challenge and its question commit together or not at all
    private DailyChallenge createWithQuestion(LocalDate date, Country country) {
        DailyChallenge challenge = challengeRepository.saveAndFlush(DailyChallenge.builder()
                .date(date)
                .country(country)
                .tier(Tier.DEFAULT_LABEL)
                .selectionAlgorithmVersion(properties.getSelectionAlgorithmVersion())
                .build());
        questionRepository.saveAndFlush(questionFactory.flagQuestion(challenge));
        return challenge;
    }
}
