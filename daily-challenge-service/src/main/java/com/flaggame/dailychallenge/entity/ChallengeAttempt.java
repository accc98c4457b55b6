package com.flaggame.dailychallenge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing one guess of a user against a daily question
 */
@Entity
@Table(name = ChallengeAttempt.TABLE,
        uniqueConstraints = {
                @UniqueConstraint(name = ChallengeAttempt.UK_ATTEMPT_NUMBER,
                        columnNames = {"user_id", "question_id", "attempt_number"})
        },
        indexes = {
                @Index(name = "idx_attempt_user_question", columnList = "user_id, question_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeAttempt {

    static final String TABLE = "challenge_attempts";
    public static final String UK_ATTEMPT_NUMBER = "uk_attempt_user_question_number";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "submitted_answer", nullable = false, length = 2000)
    private String submittedAnswer; // JSON format

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @Column(name = "explanation", length = 500)
    private String explanation;

    @Column(name = "time_taken_seconds")
    private Integer timeTakenSeconds;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @PrePersist
    protected void onCreate() {
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }
}
