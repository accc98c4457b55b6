package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.entity.RotationTrack;
import com.flaggame.dailychallenge.entity.ShownInCycle;
import com.flaggame.dailychallenge.exception.NoEligibleItemsException;
import com.flaggame.dailychallenge.model.Tier;
import com.flaggame.dailychallenge.repository.RotationTrackRepository;
import com.flaggame.dailychallenge.repository.ShownInCycleRepository;
import com.flaggame.dailychallenge.repository.UserStreakStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * No-repeat cycling selection over the countries of a tier.
 * <p>
 * Every country of the eligible set is returned exactly once before any
 * country repeats. When the cycle is exhausted its shown-set is cleared in
 * one statement and the cycle number goes up by one. Concurrent callers on
 * the same track are kept apart by the track's version column and the
 * unique (track, country) constraint; a caller that loses either race runs
 * the whole selection again in a new transaction.
 */
@Slf4j
@Service
public class RotationTrackService {

    static final int MAX_SELECTION_TRIES = 5;

    private final CountryCatalog catalog;
    private final RotationTrackRepository trackRepository;
    private final ShownInCycleRepository shownRepository;
    private final UserStreakStateRepository streakRepository;
    private final ChallengeDates dates;
    private final Random random;
    private final TransactionTemplate newTransaction;

    public RotationTrackService(CountryCatalog catalog,
                                RotationTrackRepository trackRepository,
                                ShownInCycleRepository shownRepository,
                                UserStreakStateRepository streakRepository,
                                ChallengeDates dates,
                                Random selectionRandom,
                                PlatformTransactionManager transactionManager) {
        this.catalog = catalog;
        this.trackRepository = trackRepository;
        this.shownRepository = shownRepository;
        this.streakRepository = streakRepository;
        this.dates = dates;
        this.random = selectionRandom;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Select the next country of the tier's rotation and mark it shown.
     *
     * @throws NoEligibleItemsException if the tier has no countries at all
     * @throws ConcurrencyFailureException if every try lost a race
     */
    public Country selectNext(Tier tier) {
        RotationTrack track = getOrCreateTrack(tier);
        for (int attempt = 1; ; attempt++) {
            try {
                return newTransaction.execute(status -> selectInTransaction(track.getId(), tier));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= MAX_SELECTION_TRIES) {
                    log.warn("Giving up selection on track {} after {} tries", tier.trackKey(), attempt);
                    throw e;
                }
                log.debug("Lost selection race on track {} (try {}), retrying", tier.trackKey(), attempt);
            }
        }
    }

    /**
     * Track for the tier, created on first use. A concurrent creator loses on
     * the unique track key and reads the winner's row.
     */
    public RotationTrack getOrCreateTrack(Tier tier) {
        String key = tier.trackKey();
        return trackRepository.findByTrackKey(key).orElseGet(() -> {
            try {
                return newTransaction.execute(status -> trackRepository.saveAndFlush(RotationTrack.builder()
                        .trackKey(key)
                        .tier(tier.getLabel())
                        .ownerUserId(tier.getOwnerUserId())
                        .cycleNumber(1)
                        .cycleStartDate(dates.today())
                        .build()));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.debug("Rotation track {} created concurrently, reading it", key);
                return trackRepository.findByTrackKey(key)
                        .orElseThrow(() -> new IllegalStateException("Rotation track " + key + " could not be created", e));
            }
        });
    }

    /**
     * Countries a tier rotates over. The only place that branches on tier kind.
     */
    public List<Country> eligibleFor(Tier tier) {
        return switch (tier.getKind()) {
            case DEFAULT -> catalog.listAll();
            case NAMED -> catalog.listByTier(tier.getLabel());
            case USER_CUSTOM -> streakRepository.findByUserId(tier.getOwnerUserId())
                    .map(state -> catalog.listByCodes(state.getMissedCountryCodes()))
                    .orElse(List.of());
        };
    }

    private Country selectInTransaction(Long trackId, Tier tier) {
        RotationTrack track = trackRepository.findById(trackId)
                .orElseThrow(() -> new IllegalStateException("Rotation track " + trackId + " disappeared"));
        LocalDate today = dates.today();

        List<Country> eligible = eligibleFor(tier);
        if (eligible.isEmpty()) {
            throw new NoEligibleItemsException(tier.trackKey());
        }

        Set<String> shown = shownRepository.findShownCountryCodes(trackId);
        List<Country> available = new ArrayList<>();
        for (Country country : eligible) {
            if (!shown.contains(country.getCode())) {
                available.add(country);
            }
        }

        if (available.isEmpty()) {
            int cleared = shownRepository.deleteAllForTrack(trackId);
            // bulk delete clears the persistence context
            track = trackRepository.findById(trackId).orElseThrow();
            track.setCycleNumber(track.getCycleNumber() + 1);
            track.setCycleStartDate(today);
            available = eligible;
            log.info("Rotation track {} exhausted after {} countries, starting cycle {}",
                    tier.trackKey(), cleared, track.getCycleNumber());
        }

        Country selected = available.get(random.nextInt(available.size()));

        shownRepository.saveAndFlush(ShownInCycle.builder()
                .track(track)
                .country(selected)
                .build());

        track.setLastSelectionDate(today);
        trackRepository.saveAndFlush(track);

        log.debug("Track {} cycle {} selected {}", tier.trackKey(), track.getCycleNumber(), selected.getCode());
        return selected;
    }
}
