package org.rtmvideo.remote.client;

import org.jetlang.core.Callback;
import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.RequestCallbacks;
import org.rtmvideo.remote.core.SubscriptionCallbacks;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;

/**
 * Subscribe side of an rtm client. Subscribe calls return at once, the
 * acknowledgement, data and errors arrive later through the callbacks.
 */
public interface ChannelSubscriber<M> {

    /**
     * Subscribes {@code handle} to one channel. Subscribing a handle that is
     * already in use fails with {@code SUBSCRIPTION_ERROR} unless
     * {@link SubscriptionOptions#isForce()} is set.
     *
     * @param options          null for {@link SubscriptionOptions#DEFAULT}
     * @param requestCallbacks may be null
     */
    void subscribeChannel(SubscriptionHandle handle, String channel, SubscriptionOptions options,
                          SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks);

    void subscribeFilter(SubscriptionHandle handle, String filter, SubscriptionOptions options,
                         SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks);

    /**
     * Idempotent, an unknown handle is acknowledged without doing anything.
     */
    void unsubscribe(SubscriptionHandle handle, RequestCallbacks requestCallbacks);

    /**
     * @return last known position of the subscription or null if unknown
     */
    ChannelPosition position(SubscriptionHandle handle);

    boolean isUp(SubscriptionHandle handle);

    default SubscriptionHandle subscribeChannel(String channel, SubscriptionOptions options,
                                                SubscriptionCallbacks<M> callbacks) {
        return subscribeChannel(channel, options, callbacks, null);
    }

    default SubscriptionHandle subscribeChannel(String channel, SubscriptionOptions options,
                                                SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        SubscriptionHandle handle = SubscriptionHandle.create();
        subscribeChannel(handle, channel, options, callbacks, requestCallbacks);
        return handle;
    }

    default SubscriptionHandle subscribeFilter(String filter, SubscriptionOptions options,
                                               SubscriptionCallbacks<M> callbacks) {
        return subscribeFilter(filter, options, callbacks, null);
    }

    default SubscriptionHandle subscribeFilter(String filter, SubscriptionOptions options,
                                               SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        SubscriptionHandle handle = SubscriptionHandle.create();
        subscribeFilter(handle, filter, options, callbacks, requestCallbacks);
        return handle;
    }

    default void unsubscribe(SubscriptionHandle handle) {
        unsubscribe(handle, null);
    }

    default void position(SubscriptionHandle handle, Callback<ChannelPosition> callback) {
        callback.onMessage(position(handle));
    }

    default void isUp(SubscriptionHandle handle, Callback<Boolean> callback) {
        callback.onMessage(isUp(handle));
    }
}
