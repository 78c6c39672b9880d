package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ErrorCallbacks;

/**
 * Builds a fresh, unstarted low level client per call. Retry policies such as
 * backoff belong in implementations of this interface.
 */
public interface ClientFactory<M> {

    /**
     * @param connectionErrors receives every error of the returned connection
     */
    RtmClient<M> create(ErrorCallbacks connectionErrors);

    static <M> ClientFactory<M> of(TransportFactory<M> transport, RtmClientConfig config, IoLoop loop) {
        final RtmClientConfig fixed = config.copy();
        return connectionErrors -> transport.newClient(fixed, loop, connectionErrors);
    }
}
