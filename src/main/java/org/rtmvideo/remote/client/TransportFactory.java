package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ErrorCallbacks;

public interface TransportFactory<M> {

    RtmClient<M> newClient(RtmClientConfig config, IoLoop loop, ErrorCallbacks connectionErrors);
}
