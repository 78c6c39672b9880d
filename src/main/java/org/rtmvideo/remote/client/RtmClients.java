package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ErrorCallbacks;

/**
 * Wiring of the client layers: callers talk to a thread affinity wrapper
 * around a resilient client, which owns the connections built by the factory.
 */
public final class RtmClients {

    private RtmClients() {
    }

    public static <M> ResilientClient<M> resilient(IoLoop loop, ClientFactory<M> factory, ErrorCallbacks errorCallbacks) {
        return new ResilientClient<>(loop, factory, errorCallbacks);
    }

    public static <M> RtmClient<M> threadAffine(IoLoop loop, RtmClient<M> client, ErrorCallbacks errorCallbacks) {
        return new ThreadAffinityClient<>(loop, client, errorCallbacks);
    }

    public static <M> RtmClient<M> newClient(IoLoop loop, ClientFactory<M> factory, ErrorCallbacks errorCallbacks) {
        return threadAffine(loop, resilient(loop, factory, errorCallbacks), errorCallbacks);
    }

    public static <M> RtmClient<M> newClient(IoLoop loop, TransportFactory<M> transport, RtmClientConfig config,
                                             ErrorCallbacks errorCallbacks) {
        return newClient(loop, ClientFactory.of(transport, config, loop), errorCallbacks);
    }

    /**
     * Client whose start, stop and reconnect failures are only logged.
     */
    public static <M> RtmClient<M> newClient(IoLoop loop, TransportFactory<M> transport, RtmClientConfig config) {
        return newClient(loop, transport, config, new ErrorCallbacks.Logging(config.toString()));
    }
}
