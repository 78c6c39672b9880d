package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ErrorCondition;

/**
 * Publisher and subscriber with a start/stop lifecycle.
 */
public interface RtmClient<M> extends ChannelPublisher<M>, ChannelSubscriber<M> {

    /**
     * @return null on success
     */
    ErrorCondition start();

    /**
     * @return null on success
     */
    ErrorCondition stop();
}
