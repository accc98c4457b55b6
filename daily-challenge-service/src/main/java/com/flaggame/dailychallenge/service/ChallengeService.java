package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.config.ChallengeProperties;
import com.flaggame.dailychallenge.dto.AnswerSubmissionRequest;
import com.flaggame.dailychallenge.dto.AttemptResult;
import com.flaggame.dailychallenge.dto.ChallengeHistoryPage;
import com.flaggame.dailychallenge.dto.ChallengePublicView;
import com.flaggame.dailychallenge.dto.PastChallengeSummary;
import com.flaggame.dailychallenge.dto.UserChallengeStatus;
import com.flaggame.dailychallenge.dto.UserStatsResponse;
import com.flaggame.dailychallenge.entity.ChallengeAttempt;
import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.entity.Question;
import com.flaggame.dailychallenge.entity.UserStreakState;
import com.flaggame.dailychallenge.exception.ConcurrentSubmissionException;
import com.flaggame.dailychallenge.exception.MalformedAnswerPayloadException;
import com.flaggame.dailychallenge.model.TextAnswer;
import com.flaggame.dailychallenge.repository.ChallengeAttemptRepository;
import com.flaggame.dailychallenge.repository.DailyChallengeRepository;
import com.flaggame.dailychallenge.repository.QuestionRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Entry point used by the HTTP layer. Shapes engine results into the public
 * views and keeps the answer out of anything shown before it is known.
 */
@Service
public class ChallengeService {

    static final String REDACTED = "this country";

    private final ChallengeCalendar calendar;
    private final AttemptLedger ledger;
    private final StreakTracker streakTracker;
    private final DailyChallengeRepository challengeRepository;
    private final QuestionRepository questionRepository;
    private final ChallengeAttemptRepository attemptRepository;
    private final ChallengeDates dates;
    private final StoreRetry storeRetry;
    private final ChallengeProperties properties;

    public ChallengeService(ChallengeCalendar calendar,
                            AttemptLedger ledger,
                            StreakTracker streakTracker,
                            DailyChallengeRepository challengeRepository,
                            QuestionRepository questionRepository,
                            ChallengeAttemptRepository attemptRepository,
                            ChallengeDates dates,
                            StoreRetry storeRetry,
                            ChallengeProperties properties) {
        this.calendar = calendar;
        this.ledger = ledger;
        this.streakTracker = streakTracker;
        this.challengeRepository = challengeRepository;
        this.questionRepository = questionRepository;
        this.attemptRepository = attemptRepository;
        this.dates = dates;
        this.storeRetry = storeRetry;
        this.properties = properties;
    }

    /**
     * Get today's challenge with the user's progress on it
     */
    public ChallengePublicView getTodaysChallenge(Long userId) {
        return storeRetry.once("get today's challenge", () -> {
            DailyChallenge challenge = calendar.getOrCreateToday().getChallenge();
            Question question = questionRepository.findByChallengeId(challenge.getId())
                    .orElseThrow(() -> new IllegalStateException("Challenge " + challenge.getDate() + " has no question"));
            UserChallengeStatus status = ledger.statusFor(userId, challenge);
            return toPublicView(challenge, question, status);
        });
    }

    /**
     * Submit an answer to today's challenge
     */
    public AttemptResult submitAnswer(Long userId, AnswerSubmissionRequest request) {
        if (request == null || request.getAnswerData() == null) {
            throw new MalformedAnswerPayloadException("answerData is required");
        }
        if (request.getTimeTakenSeconds() != null && request.getTimeTakenSeconds() < 0) {
            throw new MalformedAnswerPayloadException("timeTakenSeconds must not be negative");
        }
        return storeRetry.once("submit answer", () -> {
            DailyChallenge challenge = calendar.getOrCreateToday().getChallenge();
            try {
                return ledger.submit(userId, challenge, request.getAnswerData(), request.getTimeTakenSeconds());
            } catch (DataIntegrityViolationException e) {
                if (isAttemptNumberConflict(e)) {
                    throw new ConcurrentSubmissionException(e);
                }
                throw e;
            }
        });
    }

    /**
     * Past challenges strictly before {@code before}, newest first
     *
     * @param userId caller, or null when anonymous
     * @param before exclusive upper bound, defaults to and is capped at today
     */
    public ChallengeHistoryPage getHistory(Long userId, LocalDate before, int page) {
        LocalDate today = dates.today();
        // today's row stays hidden until tomorrow
        LocalDate bound = before == null || before.isAfter(today) ? today : before;
        int pageSize = properties.getHistoryPageSize();
        Page<DailyChallenge> challenges = challengeRepository.findByDateBeforeOrderByDateDesc(
                bound, PageRequest.of(Math.max(page, 0), pageSize));

        Map<Long, List<ChallengeAttempt>> attemptsByChallenge = userId == null
                ? Map.of()
                : attemptsByChallenge(userId, challenges.getContent());

        List<PastChallengeSummary> results = new ArrayList<>();
        for (DailyChallenge challenge : challenges.getContent()) {
            List<ChallengeAttempt> attempts = attemptsByChallenge.getOrDefault(challenge.getId(), List.of());
            results.add(PastChallengeSummary.builder()
                    .id(challenge.getId())
                    .date(challenge.getDate())
                    .country(toCountrySummary(challenge.getCountry()))
                    .userAnswer(attempts.isEmpty() ? null : toUserAnswer(attempts))
                    .build());
        }

        return ChallengeHistoryPage.builder()
                .count(challenges.getTotalElements())
                .page(challenges.getNumber())
                .pageSize(pageSize)
                .hasNext(challenges.hasNext())
                .results(results)
                .build();
    }

    /**
     * Get user's streak statistics
     */
    public UserStatsResponse getUserStats(Long userId) {
        UserStreakState state = streakTracker.stateOf(userId);
        return UserStatsResponse.builder()
                .userId(userId)
                .totalCorrect(state.getTotalCorrect())
                .totalCompleted(state.getTotalCompleted())
                .currentStreak(state.getCurrentStreak())
                .longestStreak(state.getLongestStreak())
                .lastCorrectDate(state.getLastCorrectDate())
                .lastGuessDate(state.getLastGuessDate())
                .missedCountryCodes(state.getMissedCountryCodes().stream().sorted().collect(Collectors.toList()))
                .build();
    }

    private Map<Long, List<ChallengeAttempt>> attemptsByChallenge(Long userId, List<DailyChallenge> challenges) {
        if (challenges.isEmpty()) {
            return Map.of();
        }
        List<Question> questions = questionRepository.findByChallengeIdIn(
                challenges.stream().map(DailyChallenge::getId).collect(Collectors.toList()));
        Map<Long, Long> challengeByQuestion = questions.stream()
                .collect(Collectors.toMap(Question::getId, q -> q.getChallenge().getId()));
        if (challengeByQuestion.isEmpty()) {
            return Map.of();
        }
        return attemptRepository.findByUserIdAndQuestionIdIn(userId, challengeByQuestion.keySet()).stream()
                .collect(Collectors.groupingBy(a -> challengeByQuestion.get(a.getQuestion().getId())));
    }

    private static PastChallengeSummary.UserAnswerSummary toUserAnswer(List<ChallengeAttempt> attempts) {
        ChallengeAttempt last = attempts.stream()
                .max(Comparator.comparingInt(ChallengeAttempt::getAttemptNumber))
                .orElseThrow();
        return PastChallengeSummary.UserAnswerSummary.builder()
                .correct(attempts.stream().anyMatch(ChallengeAttempt::isCorrect))
                .attemptsUsed(attempts.size())
                .answeredAt(last.getSubmittedAt())
                .build();
    }

    private static PastChallengeSummary.CountrySummary toCountrySummary(Country country) {
        return PastChallengeSummary.CountrySummary.builder()
                .code(country.getCode())
                .name(country.getName())
                .flagEmoji(country.getFlagEmoji())
                .flagSvgUrl(country.getFlagSvgUrl())
                .flagPngUrl(country.getFlagPngUrl())
                .build();
    }

    private static ChallengePublicView toPublicView(DailyChallenge challenge, Question question,
                                                    UserChallengeStatus status) {
        Country country = challenge.getCountry();
        return ChallengePublicView.builder()
                .id(challenge.getId())
                .date(challenge.getDate())
                .question(ChallengePublicView.QuestionView.builder()
                        .id(question.getId())
                        .category(question.getCategory().name().toLowerCase())
                        .format(question.getFormat().getTag())
                        .questionText(question.getQuestionText())
                        .build())
                .country(ChallengePublicView.FlagView.builder()
                        .flagEmoji(country.getFlagEmoji())
                        .flagSvgUrl(country.getFlagSvgUrl())
                        .flagPngUrl(country.getFlagPngUrl())
                        .flagAltText(withoutName(country.getFlagAltText(), spellingsOf(country, question)))
                        .build())
                .userStatus(status)
                .build();
    }

    // two submissions of the same user raced for one attempt number
    static boolean isAttemptNumberConflict(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            String constraint = cause instanceof ConstraintViolationException violation
                    ? violation.getConstraintName()
                    : cause.getMessage();
            if (constraint != null && constraint.toLowerCase(Locale.ROOT).contains(ChallengeAttempt.UK_ATTEMPT_NUMBER)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> spellingsOf(Country country, Question question) {
        List<String> spellings = new ArrayList<>();
        spellings.add(country.getName());
        if (country.getAltSpellings() != null) {
            spellings.addAll(country.getAltSpellings());
        }
        if (question.getCorrectAnswer() instanceof TextAnswer text && text.getAlternates() != null) {
            spellings.addAll(text.getAlternates());
        }
        return spellings;
    }

    // catalog alt texts often spell out the country; longest spelling first so
    // "United States of America" goes before "United States"
    static String withoutName(String altText, Collection<String> spellings) {
        if (altText == null || spellings == null) {
            return altText;
        }
        List<String> longestFirst = spellings.stream()
                .filter(spelling -> spelling != null && !spelling.isBlank())
                .map(String::trim)
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());
        String redacted = altText;
        for (String spelling : longestFirst) {
            Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(spelling) + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            redacted = word.matcher(redacted).replaceAll(Matcher.quoteReplacement(REDACTED));
        }
        return redacted;
    }
}
