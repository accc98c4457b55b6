package com.flaggame.dailychallenge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flaggame.dailychallenge.dto.AnswerData;
import com.flaggame.dailychallenge.dto.AttemptResult;
import com.flaggame.dailychallenge.dto.UserChallengeStatus;
import com.flaggame.dailychallenge.entity.ChallengeAttempt;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.entity.Question;
import com.flaggame.dailychallenge.exception.AlreadyAnsweredCorrectlyException;
import com.flaggame.dailychallenge.exception.AttemptsExhaustedException;
import com.flaggame.dailychallenge.exception.MalformedAnswerPayloadException;
import com.flaggame.dailychallenge.model.JudgeVerdict;
import com.flaggame.dailychallenge.repository.ChallengeAttemptRepository;
import com.flaggame.dailychallenge.repository.QuestionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Bounded-attempt answer workflow for one (user, question) pair:
 * not started, in progress, then solved or locked.
 * <p>
 * Attempt numbers are gapless from 1. Two submissions racing for the same
 * number collide on the (user, question, attempt_number) unique key and the
 * losing transaction rolls back.
 */
@Slf4j
@Service
public class AttemptLedger {

    public static final int MAX_ATTEMPTS = 3;

    static final String INCORRECT = "Incorrect answer.";

    private final ChallengeAttemptRepository attemptRepository;
    private final QuestionRepository questionRepository;
    private final AnswerJudge judge;
    private final StreakTracker streakTracker;
    private final ObjectMapper objectMapper;

    public AttemptLedger(ChallengeAttemptRepository attemptRepository,
                         QuestionRepository questionRepository,
                         AnswerJudge judge,
                         StreakTracker streakTracker) {
        this.attemptRepository = attemptRepository;
        this.questionRepository = questionRepository;
        this.judge = judge;
        this.streakTracker = streakTracker;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Judge and record one answer.
     *
     * @throws AlreadyAnsweredCorrectlyException if the user already solved the challenge
     * @throws AttemptsExhaustedException        if all attempts are used
     * @throws MalformedAnswerPayloadException   if the payload lacks the field the format needs
     */
    @Transactional
    public AttemptResult submit(Long userId, DailyChallenge challenge, AnswerData answer, Integer timeTakenSeconds) {
        Question question = questionFor(challenge);
        judge.requireWellFormed(question.getFormat(), answer);

        List<ChallengeAttempt> prior = attemptRepository
                .findByUserIdAndQuestionIdOrderByAttemptNumberDesc(userId, question.getId());

        if (prior.stream().anyMatch(ChallengeAttempt::isCorrect)) {
            log.debug("User {} resubmitted after solving challenge {}", userId, challenge.getDate());
            throw new AlreadyAnsweredCorrectlyException();
        }
        if (prior.size() >= MAX_ATTEMPTS) {
            log.debug("User {} has no attempts left on challenge {}", userId, challenge.getDate());
            throw new AttemptsExhaustedException();
        }

        JudgeVerdict verdict = judge.judge(question.getCorrectAnswer(), answer);
        int attemptNumber = prior.size() + 1;

        ChallengeAttempt attempt = attemptRepository.saveAndFlush(ChallengeAttempt.builder()
                .userId(userId)
                .question(question)
                .attemptNumber(attemptNumber)
                .submittedAnswer(serialize(answer))
                .correct(verdict.isCorrect())
                .explanation(verdict.getExplanation())
                .timeTakenSeconds(timeTakenSeconds)
                .build());

        int attemptsRemaining = MAX_ATTEMPTS - attemptNumber;
        boolean completed = verdict.isCorrect() || attemptsRemaining == 0;

        if (completed) {
            streakTracker.record(userId, verdict.isCorrect(), challenge.getCountry().getCode(), challenge.getDate());
        }

        return AttemptResult.builder()
                .correct(verdict.isCorrect())
                .attemptNumber(attemptNumber)
                .attemptsRemaining(attemptsRemaining)
                .completed(completed)
                .attemptId(attempt.getId())
                // nothing that names the answer before the user is done
                .explanation(completed ? verdict.getExplanation() : INCORRECT)
                .correctAnswer(completed ? question.getCorrectAnswer() : null)
                .build();
    }

    /**
     * Progress of a user on a challenge, without revealing anything.
     */
    @Transactional(readOnly = true)
    public UserChallengeStatus statusFor(Long userId, DailyChallenge challenge) {
        Question question = questionFor(challenge);
        return summarize(attemptRepository.findByUserIdAndQuestionIdOrderByAttemptNumberDesc(userId, question.getId()));
    }

    /**
     * @param attempts one user's attempts on one question, newest first
     */
    static UserChallengeStatus summarize(List<ChallengeAttempt> attempts) {
        int used = attempts.size();
        boolean solved = attempts.stream().anyMatch(ChallengeAttempt::isCorrect);
        Boolean correct;
        if (solved) {
            correct = Boolean.TRUE;
        } else if (used >= MAX_ATTEMPTS) {
            correct = Boolean.FALSE;
        } else {
            correct = null;
        }
        return UserChallengeStatus.builder()
                .hasCompleted(solved || used >= MAX_ATTEMPTS)
                .attemptsUsed(used)
                .attemptsRemaining(Math.max(0, MAX_ATTEMPTS - used))
                .correct(correct)
                .lastAttemptAt(attempts.isEmpty() ? null : attempts.get(0).getSubmittedAt())
                .build();
    }

    private Question questionFor(DailyChallenge challenge) {
        return questionRepository.findByChallengeId(challenge.getId())
                .orElseThrow(() -> new IllegalStateException("Challenge " + challenge.getDate() + " has no question"));
    }

    private String serialize(AnswerData answer) {
        try {
            return objectMapper.writeValueAsString(answer);
        } catch (JsonProcessingException e) {
            throw new MalformedAnswerPayloadException("Answer could not be stored: " + e.getOriginalMessage());
        }
    }
}
