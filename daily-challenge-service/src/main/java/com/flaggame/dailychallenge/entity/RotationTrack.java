package com.flaggame.dailychallenge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * No-repeat rotation state for one (tier, owner) pair.
 * Only {@code RotationTrackService} mutates rows of this table.
 */
@Entity
@Table(name = "rotation_tracks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RotationTrack {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // tier + owner folded into one non-null key so uniqueness also holds for global tracks
    @Column(name = "track_key", nullable = false, unique = true, length = 80)
    private String trackKey;

    @Column(name = "tier", nullable = false, length = 40)
    private String tier;

    @Column(name = "owner_user_id")
    private Long ownerUserId;

    @Column(name = "cycle_number", nullable = false)
    private int cycleNumber;

    @Column(name = "cycle_start_date", nullable = false)
    private LocalDate cycleStartDate;

    @Column(name = "last_selection_date")
    private LocalDate lastSelectionDate;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
