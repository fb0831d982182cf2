package com.streamfirst.dbsync.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Marks the newest change known to have been applied to a store. Watermarks have millisecond
 * precision, the precision stores persist {@code modifiedAt} with.
 *
 * @param at the instant of the newest applied change
 */
public record Watermark(Instant at) implements Comparable<Watermark> {

    /** Watermark of a store that has not applied any change yet. */
    public static final Watermark EPOCH = new Watermark(Instant.EPOCH);

    public Watermark {
        Objects.requireNonNull(at, "Watermark instant cannot be null");
        at = Instant.ofEpochMilli(at.toEpochMilli());
    }

    public static Watermark of(Instant at) {
        return new Watermark(at);
    }

    public static Watermark ofEpochMilli(long millis) {
        return new Watermark(Instant.ofEpochMilli(millis));
    }

    public long toEpochMilli() {
        return at.toEpochMilli();
    }

    public boolean isAfter(Watermark other) {
        return compareTo(other) > 0;
    }

    public boolean isBefore(Watermark other) {
        return compareTo(other) < 0;
    }

    /** Returns the later of the two watermarks. */
    public Watermark max(Watermark other) {
        return isBefore(other) ? other : this;
    }

    @Override
    public int compareTo(Watermark other) {
        return at.compareTo(other.at);
    }

    @Override
    public String toString() {
        return at.toString();
    }
}
