package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.dto.AnswerData;
import com.flaggame.dailychallenge.exception.MalformedAnswerPayloadException;
import com.flaggame.dailychallenge.model.AcceptedAnswer;
import com.flaggame.dailychallenge.model.AnswerFormat;
import com.flaggame.dailychallenge.model.JudgeVerdict;
import com.flaggame.dailychallenge.model.MultipleChoiceAnswer;
import com.flaggame.dailychallenge.model.TextAnswer;
import com.flaggame.dailychallenge.model.TrueFalseAnswer;
import com.flaggame.dailychallenge.model.UnknownAnswer;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Compares a submitted answer with a question's accepted answer. Stateless.
 */
@Component
public class AnswerJudge {

    /**
     * Longest text or option accepted. Keeps the stored JSON payload within its column.
     */
    public static final int MAX_ANSWER_LENGTH = 200;

    /**
     * Reject a payload that lacks the field the question format reads.
     * Runs before anything is written.
     */
    public void requireWellFormed(AnswerFormat format, AnswerData answer) {
        if (answer == null) {
            throw new MalformedAnswerPayloadException("answerData is required");
        }
        switch (format) {
            case TEXT_INPUT -> {
                if (answer.getText() == null || answer.getText().isBlank()) {
                    throw new MalformedAnswerPayloadException("text_input answers require a non-blank 'text' field");
                }
            }
            case MULTIPLE_CHOICE -> {
                if (answer.getSelectedOption() == null) {
                    throw new MalformedAnswerPayloadException("multiple_choice answers require a 'selectedOption' field");
                }
            }
            case TRUE_FALSE -> {
                if (answer.getAnswer() == null) {
                    throw new MalformedAnswerPayloadException("true_false answers require an 'answer' boolean field");
                }
            }
        }
        if (tooLong(answer.getText()) || tooLong(answer.getSelectedOption())) {
            throw new MalformedAnswerPayloadException("answers are limited to " + MAX_ANSWER_LENGTH + " characters");
        }
    }

    private static boolean tooLong(String value) {
        return value != null && value.length() > MAX_ANSWER_LENGTH;
    }

    public JudgeVerdict judge(AcceptedAnswer accepted, AnswerData submitted) {
        if (accepted instanceof TextAnswer text) {
            return judgeText(text, submitted.getText());
        }
        if (accepted instanceof MultipleChoiceAnswer choice) {
            boolean correct = choice.getCorrect() != null && choice.getCorrect().equals(submitted.getSelectedOption());
            return new JudgeVerdict(correct, "Correct answer: " + choice.getCorrect());
        }
        if (accepted instanceof TrueFalseAnswer trueFalse) {
            boolean correct = submitted.getAnswer() != null && submitted.getAnswer() == trueFalse.isAnswer();
            return new JudgeVerdict(correct, "The statement is " + trueFalse.isAnswer());
        }
        return new JudgeVerdict(false, UnknownAnswer.DESCRIPTION);
    }

    private JudgeVerdict judgeText(TextAnswer accepted, String submittedText) {
        String normalized = normalize(submittedText);
        String primary = normalize(accepted.getAnswer());
        boolean correct = !normalized.isEmpty()
                && (normalized.equals(primary) || (accepted.getAlternates() != null && accepted.getAlternates().contains(normalized)));
        return new JudgeVerdict(correct, "Correct answer: " + accepted.getAnswer());
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
