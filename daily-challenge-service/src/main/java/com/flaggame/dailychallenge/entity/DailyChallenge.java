package com.flaggame.dailychallenge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * The one challenge of a calendar day. Written once, never updated.
 */
@Entity
@Table(name = "daily_challenges")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyChallenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "challenge_date", nullable = false, unique = true)
    private LocalDate date;

    // plain FK, no cascade: a country used by a challenge cannot be deleted
    @ManyToOne(optional = false)
    @JoinColumn(name = "country_id", nullable = false)
    private Country country;

    @Column(name = "tier", nullable = false, length = 40)
    private String tier;

    @Column(name = "selection_algorithm_version", nullable = false, length = 20)
    private String selectionAlgorithmVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
