package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.PublishCallbacks;

public interface ChannelPublisher<M> {

    default void publish(String channel, M message) {
        publish(channel, message, null);
    }

    /**
     * @param callbacks may be null for fire and forget
     */
    void publish(String channel, M message, PublishCallbacks callbacks);
}
