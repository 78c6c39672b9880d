package org.rtmvideo.remote.core;

import java.util.Objects;

/**
 * Immutable subscribe options. {@code force} replaces an existing subscription on
 * the same handle, {@code fastForward} lets the subscription jump to the live
 * tail instead of failing or resuming from an old position.
 */
public final class SubscriptionOptions {

    public static final SubscriptionOptions DEFAULT = new SubscriptionOptions(false, true, HistoryOptions.NONE, null);

    private final boolean force;
    private final boolean fastForward;
    private final HistoryOptions history;
    private final ChannelPosition position;

    public SubscriptionOptions(boolean force, boolean fastForward, HistoryOptions history, ChannelPosition position) {
        this.force = force;
        this.fastForward = fastForward;
        this.history = history != null ? history : HistoryOptions.NONE;
        this.position = position;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isFastForward() {
        return fastForward;
    }

    public HistoryOptions getHistory() {
        return history;
    }

    public ChannelPosition getPosition() {
        return position;
    }

    public SubscriptionOptions withForce(boolean force) {
        return new SubscriptionOptions(force, fastForward, history, position);
    }

    public SubscriptionOptions withFastForward(boolean fastForward) {
        return new SubscriptionOptions(force, fastForward, history, position);
    }

    public SubscriptionOptions withHistory(HistoryOptions history) {
        return new SubscriptionOptions(force, fastForward, history, position);
    }

    public SubscriptionOptions withPosition(ChannelPosition position) {
        return new SubscriptionOptions(force, fastForward, history, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionOptions)) return false;
        SubscriptionOptions that = (SubscriptionOptions) o;
        return force == that.force
                && fastForward == that.fastForward
                && history.equals(that.history)
                && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(force, fastForward, history, position);
    }

    @Override
    public String toString() {
        return "options{force=" + force + ", fastForward=" + fastForward + ", " + history + ", position=" + position + "}";
    }
}
