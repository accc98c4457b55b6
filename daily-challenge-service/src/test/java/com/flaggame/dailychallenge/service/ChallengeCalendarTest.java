package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.AbstractEngineTest;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.entity.Question;
import com.flaggame.dailychallenge.exception.NoEligibleItemsException;
import com.flaggame.dailychallenge.model.AnswerFormat;
import com.flaggame.dailychallenge.model.ChallengeLookup;
import com.flaggame.dailychallenge.model.QuestionCategory;
import com.flaggame.dailychallenge.model.TextAnswer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChallengeCalendarTest extends AbstractEngineTest {

    @Autowired
    private ChallengeCalendar calendar;

    @Autowired
    private ChallengeDates dates;

    @Test
    void firstCallCreatesChallengeAndQuestion() {
        country("TST", "Test Country", null, "Test Republic");

        ChallengeLookup lookup = calendar.getOrCreateToday();

        assertThat(lookup.isCreated()).isTrue();
        DailyChallenge challenge = lookup.getChallenge();
        assertThat(challenge.getDate()).isEqualTo(dates.today());
        assertThat(challenge.getCountry().getCode()).isEqualTo("TST");
        assertThat(challenge.getTier()).isEqualTo("default");
        assertThat(challenge.getSelectionAlgorithmVersion()).isEqualTo("v2_tier_rotation");

        Question question = questionRepository.findByChallengeId(challenge.getId()).orElseThrow();
        assertThat(question.getCategory()).isEqualTo(QuestionCategory.FLAG);
        assertThat(question.getFormat()).isEqualTo(AnswerFormat.TEXT_INPUT);
        TextAnswer answer = (TextAnswer) question.getCorrectAnswer();
        assertThat(answer.getAnswer()).isEqualTo("Test Country");
        // manual alternates for TST come from the test profile
        assertThat(answer.getAlternates())
                .containsExactly("test country", "test republic", "testia", "testland");
    }

    @Test
    void secondCallReturnsSameChallenge() {
        country("AAA", "Aland", null);
        country("BBB", "Bland", null);

        ChallengeLookup first = calendar.getOrCreateToday();
        ChallengeLookup second = calendar.getOrCreateToday();

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        assertThat(second.getChallenge().getId()).isEqualTo(first.getChallenge().getId());
        assertThat(challengeRepository.countByDate(dates.today())).isEqualTo(1);
        // only one selection was consumed
        assertThat(shownRepository.count()).isEqualTo(1);
    }

    @Test
    void consecutiveDaysDoNotRepeatWithinCycle() {
        country("AAA", "Aland", null);
        country("BBB", "Bland", null);
        country("CCC", "Cland", null);
        LocalDate day = LocalDate.of(2024, 1, 1);

        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            codes.add(calendar.getOrCreate(day.plusDays(i)).getChallenge().getCountry().getCode());
        }

        assertThat(codes).containsExactlyInAnyOrder("AAA", "BBB", "CCC");
    }

    @Test
    void emptyCatalogSurfacesNoEligibleItems() {
        assertThatThrownBy(() -> calendar.getOrCreateToday()).isInstanceOf(NoEligibleItemsException.class);
        assertThat(challengeRepository.count()).isZero();
    }

    @Test
    void concurrentCallersShareOneChallenge() throws Exception {
        for (int i = 0; i < 6; i++) {
            country("R0" + i, "Race " + i, null);
        }
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChallengeLookup>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    return calendar.getOrCreateToday();
                }));
            }
            start.countDown();

            Set<Long> ids = new HashSet<>();
            int created = 0;
            for (Future<ChallengeLookup> future : futures) {
                ChallengeLookup lookup = future.get(30, TimeUnit.SECONDS);
                ids.add(lookup.getChallenge().getId());
                if (lookup.isCreated()) {
                    created++;
                }
            }

            assertThat(ids).hasSize(1);
            assertThat(created).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(challengeRepository.countByDate(dates.today())).isEqualTo(1);
        assertThat(questionRepository.count()).isEqualTo(1);
    }
}
