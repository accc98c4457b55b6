package com.flaggame.dailychallenge.model;

import java.util.Objects;

/**
 * Partition of the catalog that owns an independent rotation track.
 * <ul>
 *     <li>{@link Kind#DEFAULT}: every country, shared by all users</li>
 *     <li>{@link Kind#NAMED}: countries carrying a difficulty tier label, shared</li>
 *     <li>{@link Kind#USER_CUSTOM}: one user's review rotation over the countries they missed</li>
 * </ul>
 */
public final class Tier {

    public static final String DEFAULT_LABEL = "default";

    public enum Kind {
        DEFAULT,
        NAMED,
        USER_CUSTOM
    }

    private static final Tier DEFAULT = new Tier(Kind.DEFAULT, DEFAULT_LABEL, null);

    private final Kind kind;
    private final String label;
    private final Long ownerUserId;

    private Tier(Kind kind, String label, Long ownerUserId) {
        this.kind = kind;
        this.label = label;
        this.ownerUserId = ownerUserId;
    }

    public static Tier defaultTier() {
        return DEFAULT;
    }

    public static Tier named(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Tier label must not be blank");
        }
        String normalized = label.trim().toLowerCase();
        if (DEFAULT_LABEL.equals(normalized)) {
            return DEFAULT;
        }
        return new Tier(Kind.NAMED, normalized, null);
    }

    public static Tier userCustom(Long userId) {
        Objects.requireNonNull(userId, "userId");
        return new Tier(Kind.USER_CUSTOM, "user", userId);
    }

    public Kind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return owning user, or null for global tracks
     */
    public Long getOwnerUserId() {
        return ownerUserId;
    }

    /**
     * Stable key of the rotation track backing this tier.
     */
    public String trackKey() {
        return switch (kind) {
            case DEFAULT -> DEFAULT_LABEL;
            case NAMED -> "named:" + label;
            case USER_CUSTOM -> "user:" + ownerUserId;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tier)) return false;
        Tier other = (Tier) o;
        return kind == other.kind && label.equals(other.label) && Objects.equals(ownerUserId, other.ownerUserId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, label, ownerUserId);
    }

    @Override
    public String toString() {
        return trackKey();
    }
}
