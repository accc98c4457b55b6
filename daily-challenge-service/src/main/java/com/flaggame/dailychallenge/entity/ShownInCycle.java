package com.flaggame.dailychallenge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Marks a country as already shown in its track's current cycle.
 */
@Entity
@Table(name = "shown_in_cycle", uniqueConstraints = {
        @UniqueConstraint(name = "uk_shown_in_cycle_track_country", columnNames = {"track_id", "country_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShownInCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "track_id", nullable = false)
    private RotationTrack track;

    @ManyToOne(optional = false)
    @JoinColumn(name = "country_id", nullable = false)
    private Country country;

    @Column(name = "shown_at", nullable = false)
    private Instant shownAt;

    @PrePersist
    protected void onCreate() {
        if (shownAt == null) {
            shownAt = Instant.now();
        }
    }
}
