package com.flaggame.dailychallenge.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Catalog entry for a country. Loaded by the catalog ingestion job and
 * only ever read by the challenge engine.
 */
@Entity
@Table(name = "countries", indexes = {
        @Index(name = "idx_countries_difficulty_tier", columnList = "difficulty_tier")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Country {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false, unique = true, length = 3)
    private String code; // ISO 3166-1 alpha-3

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "flag_emoji", length = 10)
    private String flagEmoji;

    @Column(name = "flag_svg_url", length = 500)
    private String flagSvgUrl;

    @Column(name = "flag_png_url", length = 500)
    private String flagPngUrl;

    @Column(name = "flag_alt_text", length = 1000)
    private String flagAltText;

    @Column(name = "difficulty_tier", length = 10)
    private String difficultyTier;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "country_alt_spellings", joinColumns = @JoinColumn(name = "country_id"))
    @Column(name = "spelling", nullable = false, length = 200)
    private Set<String> altSpellings = new HashSet<>();
}
