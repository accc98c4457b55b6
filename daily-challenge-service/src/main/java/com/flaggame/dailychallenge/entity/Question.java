package com.flaggame.dailychallenge.entity;

import com.flaggame.dailychallenge.model.AcceptedAnswer;
import com.flaggame.dailychallenge.model.AnswerFormat;
import com.flaggame.dailychallenge.model.QuestionCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Question derived from a daily challenge when the challenge is created.
 * The accepted answer must never reach a client before the user has finished.
 */
@Entity
@Table(name = "questions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "challenge_id", nullable = false, unique = true)
    private DailyChallenge challenge;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 30)
    private QuestionCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 30)
    private AnswerFormat format;

    @Column(name = "question_text", nullable = false, length = 500)
    private String questionText;

    @Convert(converter = AcceptedAnswerConverter.class)
    @Column(name = "correct_answer", nullable = false, length = 4000)
    private AcceptedAnswer correctAnswer; // JSON, tagged by format

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
