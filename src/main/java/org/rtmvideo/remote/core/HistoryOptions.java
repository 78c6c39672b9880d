package org.rtmvideo.remote.core;

import java.util.Objects;

/**
 * Bounds the history replayed when a subscription starts. A null bound is not
 * applied, with neither bound set no history is replayed.
 */
public final class HistoryOptions {

    public static final HistoryOptions NONE = new HistoryOptions(null, null);

    private final Long count;
    private final Long ageInSeconds;

    public HistoryOptions(Long count, Long ageInSeconds) {
        if (count != null && count < 0) {
            throw new IllegalArgumentException("negative history count: " + count);
        }
        if (ageInSeconds != null && ageInSeconds < 0) {
            throw new IllegalArgumentException("negative history age: " + ageInSeconds);
        }
        this.count = count;
        this.ageInSeconds = ageInSeconds;
    }

    public static HistoryOptions count(long count) {
        return new HistoryOptions(count, null);
    }

    public static HistoryOptions age(long seconds) {
        return new HistoryOptions(null, seconds);
    }

    public Long getCount() {
        return count;
    }

    public Long getAgeInSeconds() {
        return ageInSeconds;
    }

    public boolean isEmpty() {
        return count == null && ageInSeconds == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoryOptions)) return false;
        HistoryOptions that = (HistoryOptions) o;
        return Objects.equals(count, that.count) && Objects.equals(ageInSeconds, that.ageInSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, ageInSeconds);
    }

    @Override
    public String toString() {
        return "history{count=" + count + ", age=" + ageInSeconds + "}";
    }
}
