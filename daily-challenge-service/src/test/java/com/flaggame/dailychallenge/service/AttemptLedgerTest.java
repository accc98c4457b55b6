package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.dto.AnswerData;
import com.flaggame.dailychallenge.dto.AttemptResult;
import com.flaggame.dailychallenge.dto.UserChallengeStatus;
import com.flaggame.dailychallenge.entity.ChallengeAttempt;
import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.entity.DailyChallenge;
import com.flaggame.dailychallenge.entity.Question;
import com.flaggame.dailychallenge.exception.AlreadyAnsweredCorrectlyException;
import com.flaggame.dailychallenge.exception.AttemptsExhaustedException;
import com.flaggame.dailychallenge.exception.MalformedAnswerPayloadException;
import com.flaggame.dailychallenge.model.AnswerFormat;
import com.flaggame.dailychallenge.model.QuestionCategory;
import com.flaggame.dailychallenge.model.TextAnswer;
import com.flaggame.dailychallenge.repository.ChallengeAttemptRepository;
import com.flaggame.dailychallenge.repository.QuestionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttemptLedger")
class AttemptLedgerTest {

    private static final Long USER_ID = 11L;
    private static final LocalDate DATE = LocalDate.of(2024, 6, 1);

    @Mock
    private ChallengeAttemptRepository attemptRepository;
    @Mock
    private QuestionRepository questionRepository;
    @Mock
    private StreakTracker streakTracker;

    private AttemptLedger ledger;
    private DailyChallenge challenge;
    private Question question;

    @BeforeEach
    void setUp() {
        ledger = new AttemptLedger(attemptRepository, questionRepository, new AnswerJudge(), streakTracker);

        Country france = Country.builder().id(1L).code("FRA").name("France").build();
        challenge = DailyChallenge.builder().id(5L).date(DATE).country(france).tier("default").build();
        question = Question.builder()
                .id(9L)
                .challenge(challenge)
                .category(QuestionCategory.FLAG)
                .format(AnswerFormat.TEXT_INPUT)
                .questionText("Which country does this flag belong to?")
                .correctAnswer(new TextAnswer("France", List.of("fra", "france")))
                .build();
        lenient().when(questionRepository.findByChallengeId(5L)).thenReturn(Optional.of(question));
        lenient().when(attemptRepository.saveAndFlush(any(ChallengeAttempt.class))).thenAnswer(inv -> {
            ChallengeAttempt attempt = inv.getArgument(0);
            attempt.setId(100L + attempt.getAttemptNumber());
            return attempt;
        });
    }

    @Test
    @DisplayName("wrong first guess withholds the answer")
    void wrongGuessInProgress() {
        givenPriorAttempts();

        AttemptResult result = ledger.submit(USER_ID, challenge, text("Germany"), 12);

        assertThat(result.isCorrect()).isFalse();
        assertThat(result.getAttemptNumber()).isEqualTo(1);
        assertThat(result.getAttemptsRemaining()).isEqualTo(2);
        assertThat(result.isCompleted()).isFalse();
        assertThat(result.getCorrectAnswer()).isNull();
        assertThat(result.getExplanation()).doesNotContain("France");
        verifyNoInteractions(streakTracker);
    }

    @Test
    @DisplayName("correct guess completes, reveals the answer and records the streak")
    void correctGuess() {
        givenPriorAttempts(attempt(1, false));

        AttemptResult result = ledger.submit(USER_ID, challenge, text(" FRANCE "), null);

        assertThat(result.isCorrect()).isTrue();
        assertThat(result.getAttemptNumber()).isEqualTo(2);
        assertThat(result.getAttemptsRemaining()).isEqualTo(1);
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.getCorrectAnswer()).isEqualTo(question.getCorrectAnswer());
        assertThat(result.getAttemptId()).isEqualTo(102L);
        verify(streakTracker).record(USER_ID, true, "FRA", DATE);
    }

    @Test
    @DisplayName("third wrong guess locks the challenge and reveals the answer")
    void lastWrongGuess() {
        givenPriorAttempts(attempt(2, false), attempt(1, false));

        AttemptResult result = ledger.submit(USER_ID, challenge, text("Italy"), 40);

        assertThat(result.isCorrect()).isFalse();
        assertThat(result.getAttemptNumber()).isEqualTo(3);
        assertThat(result.getAttemptsRemaining()).isZero();
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.getCorrectAnswer()).isEqualTo(question.getCorrectAnswer());
        assertThat(result.getExplanation()).isEqualTo("Correct answer: France");
        verify(streakTracker).record(USER_ID, false, "FRA", DATE);
    }

    @Test
    @DisplayName("attempt is stored with the next number and the submitted payload")
    void storesAttempt() {
        givenPriorAttempts(attempt(1, false));

        ledger.submit(USER_ID, challenge, text("Spain"), 30);

        ArgumentCaptor<ChallengeAttempt> captor = ArgumentCaptor.forClass(ChallengeAttempt.class);
        verify(attemptRepository).saveAndFlush(captor.capture());
        ChallengeAttempt stored = captor.getValue();
        assertThat(stored.getAttemptNumber()).isEqualTo(2);
        assertThat(stored.getUserId()).isEqualTo(USER_ID);
        assertThat(stored.getQuestion()).isSameAs(question);
        assertThat(stored.getSubmittedAnswer()).contains("\"text\":\"Spain\"");
        assertThat(stored.getTimeTakenSeconds()).isEqualTo(30);
    }

    @Test
    @DisplayName("no fourth attempt after three misses")
    void exhausted() {
        givenPriorAttempts(attempt(3, false), attempt(2, false), attempt(1, false));

        assertThatThrownBy(() -> ledger.submit(USER_ID, challenge, text("France"), null))
                .isInstanceOf(AttemptsExhaustedException.class);

        verify(attemptRepository, never()).saveAndFlush(any());
        verify(streakTracker, never()).record(anyLong(), anyBoolean(), anyString(), any());
    }

    @Test
    @DisplayName("no attempt after a correct one")
    void alreadySolved() {
        givenPriorAttempts(attempt(1, true));

        assertThatThrownBy(() -> ledger.submit(USER_ID, challenge, text("France"), null))
                .isInstanceOf(AlreadyAnsweredCorrectlyException.class);

        verify(attemptRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("payload without text is rejected before anything is read or written")
    void malformedPayload() {
        assertThatThrownBy(() -> ledger.submit(USER_ID, challenge, AnswerData.builder().answer(true).build(), null))
                .isInstanceOf(MalformedAnswerPayloadException.class);

        verify(attemptRepository, never()).findByUserIdAndQuestionIdOrderByAttemptNumberDesc(anyLong(), anyLong());
        verify(attemptRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("status reports progress without the answer")
    void statusInProgress() {
        givenPriorAttempts(attempt(1, false));

        UserChallengeStatus status = ledger.statusFor(USER_ID, challenge);

        assertThat(status.isHasCompleted()).isFalse();
        assertThat(status.getAttemptsUsed()).isEqualTo(1);
        assertThat(status.getAttemptsRemaining()).isEqualTo(2);
        assertThat(status.getCorrect()).isNull();
        assertThat(status.getLastAttemptAt()).isNotNull();
    }

    @Test
    @DisplayName("status after three misses is completed and incorrect")
    void statusLocked() {
        UserChallengeStatus status = AttemptLedger.summarize(
                List.of(attempt(3, false), attempt(2, false), attempt(1, false)));

        assertThat(status.isHasCompleted()).isTrue();
        assertThat(status.getCorrect()).isFalse();
        assertThat(status.getAttemptsRemaining()).isZero();
    }

    @Test
    @DisplayName("blank guess is rejected and uses no attempt")
    void blankGuess() {
        assertThatThrownBy(() -> ledger.submit(USER_ID, challenge, text("  \t "), null))
                .isInstanceOf(MalformedAnswerPayloadException.class);

        verify(attemptRepository, never()).findByUserIdAndQuestionIdOrderByAttemptNumberDesc(anyLong(), anyLong());
        verify(attemptRepository, never()).saveAndFlush(any());
    }

    private static AnswerData text(String guess) {
        return AnswerData.builder().text(guess).build();
    }

    private void givenPriorAttempts(ChallengeAttempt... attempts) {
        when(attemptRepository.findByUserIdAndQuestionIdOrderByAttemptNumberDesc(USER_ID, 9L))
                .thenReturn(new ArrayList<>(List.of(attempts)));
    }

    private ChallengeAttempt attempt(int number, boolean correct) {
        return ChallengeAttempt.builder()
                .id((long) number)
                .userId(USER_ID)
                .question(question)
                .attemptNumber(number)
                .correct(correct)
                .submittedAnswer("{}")
                .submittedAt(Instant.parse("2024-06-01T10:00:00Z").plusSeconds(number))
                .build();
    }
}
