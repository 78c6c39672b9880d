package org.rtmvideo.remote.core;

public interface PublishCallbacks extends ErrorCallbacks {

    /**
     * @param position where the message landed in the channel
     */
    void onOk(ChannelPosition position);
}
