package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.RequestCallbacks;
import org.rtmvideo.remote.core.SubscriptionCallbacks;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;

/**
 * State of one active subscription. Only touched from the io thread.
 */
public class SubscriptionRecord<M> {

    private final SubscriptionHandle handle;
    private final String target;
    private final boolean filter;
    private final SubscriptionOptions options;
    private final SubscriptionCallbacks<M> callbacks;
    private final RequestCallbacks requestCallbacks;

    private ChannelPosition lastPosition;
    private boolean up;
    private boolean acknowledged;
    private SubscriptionRecord<M> replaced;

    public SubscriptionRecord(SubscriptionHandle handle, String target, boolean filter, SubscriptionOptions options,
                              SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        this.handle = handle;
        this.target = target;
        this.filter = filter;
        this.options = options;
        this.callbacks = callbacks;
        this.requestCallbacks = requestCallbacks;
    }

    public SubscriptionHandle getHandle() {
        return handle;
    }

    public String getTarget() {
        return target;
    }

    public boolean isFilter() {
        return filter;
    }

    public SubscriptionOptions getOptions() {
        return options;
    }

    public SubscriptionCallbacks<M> getCallbacks() {
        return callbacks;
    }

    public RequestCallbacks getRequestCallbacks() {
        return requestCallbacks;
    }

    public ChannelPosition getLastPosition() {
        return lastPosition;
    }

    /**
     * Last delivered position, else the position the subscription was asked to
     * start from.
     */
    public ChannelPosition currentPosition() {
        return lastPosition != null ? lastPosition : options.getPosition();
    }

    public boolean isUp() {
        return up;
    }

    public void setUp(boolean up) {
        this.up = up;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    /**
     * Advances the last position. One position per record, so every channel a
     * filter matches must share a single ordered position space with the
     * others, as the channels of one {@code LocalBroker} log do.
     *
     * @return false if the position is not after the last delivered one, i.e.
     * the message was seen already
     */
    public boolean advance(ChannelPosition position) {
        if (position == null) {
            return true;
        }
        if (lastPosition != null && !position.isAfter(lastPosition)) {
            return false;
        }
        lastPosition = position;
        return true;
    }

    /**
     * Options for subscribing again on a new connection: the original ones,
     * resuming after the last delivered message if there is one. With fast
     * forward set the transport skips ahead only if that position expired.
     */
    public SubscriptionOptions replayOptions() {
        return lastPosition != null ? options.withPosition(lastPosition) : options;
    }

    /**
     * Record this one replaced through a forced subscribe, restored if the
     * replacement is refused before its first ack.
     */
    public SubscriptionRecord<M> getReplaced() {
        return replaced;
    }

    public void setReplaced(SubscriptionRecord<M> replaced) {
        this.replaced = replaced;
    }

    @Override
    public String toString() {
        return handle + (filter ? " filter " : " channel ") + target;
    }
}
