package org.rtmvideo.remote.core;

/**
 * Receives the data of one subscription. {@link #onError} reports problems with
 * the subscription itself, e.g. an expired position.
 */
public interface SubscriptionCallbacks<M> extends ErrorCallbacks {

    default void onData(SubscriptionHandle handle, ChannelData<M> data) {
    }
}
