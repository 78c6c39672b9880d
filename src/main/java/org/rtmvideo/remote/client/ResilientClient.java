package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.ChannelData;
import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.ClientError;
import org.rtmvideo.remote.core.ErrorCallbacks;
import org.rtmvideo.remote.core.ErrorCondition;
import org.rtmvideo.remote.core.PublishCallbacks;
import org.rtmvideo.remote.core.RequestCallbacks;
import org.rtmvideo.remote.core.SubscriptionCallbacks;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client that reconnects on any error reported by the current connection and
 * subscribes every registered subscription again on the new one.
 * <p>
 * All methods must be called from the io thread of the given loop, wrap this
 * client in a {@link ThreadAffinityClient} to call it from other threads.
 * Calls made while there is no connection fail with
 * {@link ClientError#NOT_CONNECTED}, nothing is buffered.
 */
public class ResilientClient<M> implements RtmClient<M> {

    private static final Logger log = LoggerFactory.getLogger(ResilientClient.class);

    public enum State {
        STOPPED, STARTING, CONNECTED, RECONNECTING
    }

    private final IoLoop loop;
    private final ClientFactory<M> factory;
    private final ErrorCallbacks errorCallbacks;
    private final SubscriptionRegistry<M> registry = new SubscriptionRegistry<>();

    private State state = State.STOPPED;
    private RtmClient<M> client;
    // incremented whenever a connection is created or discarded, callbacks carrying an older id are stale
    private int connectionId;
    private int reconnectSeq;
    private boolean reconnectQueued;
    private long reconnects;

    public ResilientClient(IoLoop loop, ClientFactory<M> factory, ErrorCallbacks errorCallbacks) {
        this.loop = loop;
        this.factory = factory;
        this.errorCallbacks = errorCallbacks;
    }

    @Override
    public ErrorCondition start() {
        loop.checkThread("start");
        if (state != State.STOPPED) {
            throw new IllegalStateException("Already started.");
        }
        state = State.STARTING;
        final int id = ++connectionId;
        RtmClient<M> fresh;
        ErrorCondition result;
        try {
            fresh = factory.create(new ConnectionErrors(id));
            result = fresh.start();
        } catch (RuntimeException failed) {
            log.error("Starting client threw", failed);
            abortStart();
            return ClientError.UNKNOWN.condition("start failed: " + failed);
        }
        if (result != null) {
            log.warn("Failed to start client: {}", result);
            abortStart();
            return result;
        }
        client = fresh;
        if (state == State.STARTING) {
            state = State.CONNECTED;
            log.info("Client started");
        }
        return null;
    }

    private void abortStart() {
        reconnectSeq++;
        reconnectQueued = false;
        connectionId++;
        state = State.STOPPED;
    }

    @Override
    public ErrorCondition stop() {
        loop.checkThread("stop");
        reconnectSeq++;
        reconnectQueued = false;
        registry.clear();
        if (state == State.STOPPED) {
            return ClientError.NOT_CONNECTED.condition("client is already stopped");
        }
        log.info("Stopping client in state {}", state);
        boolean broken = state == State.RECONNECTING;
        state = State.STOPPED;
        connectionId++;
        RtmClient<M> current = client;
        client = null;
        if (current == null) {
            return null;
        }
        ErrorCondition result = current.stop();
        if (broken) {
            if (result != null) {
                log.debug("Stopping broken connection: {}", result);
            }
            return null;
        }
        return result;
    }

    @Override
    public void publish(String channel, M message, PublishCallbacks callbacks) {
        loop.checkThread("publish");
        if (state != State.CONNECTED) {
            ErrorCondition error = ClientError.NOT_CONNECTED.condition("cannot publish to " + channel + " while " + state);
            if (callbacks != null) {
                callbacks.onError(error);
            } else {
                log.debug("Dropped message for {}: {}", channel, error);
            }
            return;
        }
        client.publish(channel, message, callbacks != null ? new CurrentPublish(callbacks, connectionId) : null);
    }

    @Override
    public void subscribeChannel(SubscriptionHandle handle, String channel, SubscriptionOptions options,
                                 SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        loop.checkThread("subscribeChannel");
        subscribe(handle, channel, false, options, callbacks, requestCallbacks);
    }

    @Override
    public void subscribeFilter(SubscriptionHandle handle, String filter, SubscriptionOptions options,
                                SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        loop.checkThread("subscribeFilter");
        subscribe(handle, filter, true, options, callbacks, requestCallbacks);
    }

    private void subscribe(SubscriptionHandle handle, String target, boolean filter, SubscriptionOptions options,
                           SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        if (options == null) {
            options = SubscriptionOptions.DEFAULT;
        }
        if (state != State.CONNECTED) {
            failRequest(callbacks, requestCallbacks,
                    ClientError.NOT_CONNECTED.condition("cannot subscribe to " + target + " while " + state));
            return;
        }
        SubscriptionRecord<M> existing = registry.get(handle);
        if (existing != null && !options.isForce()) {
            failRequest(callbacks, requestCallbacks,
                    ClientError.SUBSCRIPTION_ERROR.condition(handle + " is already subscribed to " + existing.getTarget()));
            return;
        }
        SubscriptionRecord<M> record = new SubscriptionRecord<>(handle, target, filter, options, callbacks, requestCallbacks);
        record.setReplaced(registry.put(record));
        subscribeOn(client, record, options, connectionId);
    }

    private void subscribeOn(RtmClient<M> target, SubscriptionRecord<M> record, SubscriptionOptions options, int id) {
        DataTracker tracker = new DataTracker(record, id);
        if (record.isFilter()) {
            target.subscribeFilter(record.getHandle(), record.getTarget(), options, tracker, tracker);
        } else {
            target.subscribeChannel(record.getHandle(), record.getTarget(), options, tracker, tracker);
        }
    }

    private static void failRequest(ErrorCallbacks callbacks, RequestCallbacks requestCallbacks, ErrorCondition error) {
        if (requestCallbacks != null) {
            requestCallbacks.onError(error);
        } else {
            callbacks.onError(error);
        }
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle, RequestCallbacks requestCallbacks) {
        loop.checkThread("unsubscribe");
        SubscriptionRecord<M> record = registry.remove(handle);
        if (record == null) {
            log.info("Ignoring unsubscribe of unknown {}", handle);
            if (requestCallbacks != null) {
                requestCallbacks.onOk();
            }
            return;
        }
        if (state == State.CONNECTED) {
            client.unsubscribe(handle, requestCallbacks != null ? new CurrentRequest(requestCallbacks, connectionId) : null);
        } else if (requestCallbacks != null) {
            // not connected, the record will not be replayed
            requestCallbacks.onOk();
        }
    }

    @Override
    public ChannelPosition position(SubscriptionHandle handle) {
        loop.checkThread("position");
        SubscriptionRecord<M> record = registry.get(handle);
        return record != null ? record.currentPosition() : null;
    }

    @Override
    public boolean isUp(SubscriptionHandle handle) {
        loop.checkThread("isUp");
        SubscriptionRecord<M> record = registry.get(handle);
        return state == State.CONNECTED && record != null && record.isUp();
    }

    public State getState() {
        return state;
    }

    public long getReconnectCount() {
        return reconnects;
    }

    public int getSubscriptionCount() {
        return registry.size();
    }

    private boolean isCurrent(int id) {
        return id == connectionId && state != State.STOPPED;
    }

    private void onConnectionError(int id, ErrorCondition error) {
        if (!isCurrent(id)) {
            log.debug("Discarding error of stale connection {}: {}", id, error);
            return;
        }
        log.warn("Connection {} failed in state {}: {}", id, state, error);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        state = State.RECONNECTING;
        registry.markAllDown();
        if (reconnectQueued) {
            return;
        }
        reconnectQueued = true;
        final int seq = ++reconnectSeq;
        loop.execute(() -> reconnect(seq));
    }

    private void reconnect(int seq) {
        if (seq != reconnectSeq || state != State.RECONNECTING) {
            return;
        }
        reconnectQueued = false;
        teardown();
        reconnects++;
        final int id = ++connectionId;
        RtmClient<M> fresh;
        ErrorCondition startError;
        try {
            fresh = factory.create(new ConnectionErrors(id));
            client = fresh;
            startError = fresh.start();
        } catch (RuntimeException failed) {
            log.error("Reconnect attempt " + reconnects + " threw", failed);
            errorCallbacks.onError(ClientError.UNKNOWN.condition("reconnect failed: " + failed));
            if (isCurrent(id)) {
                scheduleReconnect();
            }
            return;
        }
        if (!isCurrent(id) || reconnectQueued) {
            return;
        }
        if (startError != null) {
            log.warn("Reconnect attempt {} failed: {}", reconnects, startError);
            scheduleReconnect();
            return;
        }
        int replayed = 0;
        for (SubscriptionRecord<M> record : registry.records()) {
            if (!isCurrent(id) || reconnectQueued) {
                return;
            }
            if (registry.isCurrent(record)) {
                subscribeOn(fresh, record, record.replayOptions(), id);
                replayed++;
            }
        }
        if (isCurrent(id) && !reconnectQueued) {
            state = State.CONNECTED;
            log.info("Reconnected after {} attempts, replayed {} subscriptions", reconnects, replayed);
        }
    }

    private void teardown() {
        RtmClient<M> broken = client;
        client = null;
        connectionId++;
        if (broken != null) {
            ErrorCondition result = broken.stop();
            if (result != null) {
                log.debug("Stopping broken connection: {}", result);
            }
        }
    }

    private class ConnectionErrors implements ErrorCallbacks {
        private final int id;

        ConnectionErrors(int id) {
            this.id = id;
        }

        @Override
        public void onError(ErrorCondition error) {
            onConnectionError(id, error);
        }
    }

    /**
     * Subscription and request callbacks handed to the low level client for
     * one record on one connection.
     */
    private class DataTracker implements SubscriptionCallbacks<M>, RequestCallbacks {
        private final SubscriptionRecord<M> record;
        private final int id;

        DataTracker(SubscriptionRecord<M> record, int id) {
            this.record = record;
            this.id = id;
        }

        private boolean live() {
            return isCurrent(id) && registry.isCurrent(record);
        }

        @Override
        public void onData(SubscriptionHandle handle, ChannelData<M> data) {
            if (!live()) {
                return;
            }
            if (record.advance(data.getPosition())) {
                record.getCallbacks().onData(record.getHandle(), data);
            } else {
                log.debug("Dropping already delivered {} for {}", data, record);
            }
        }

        @Override
        public void onOk() {
            if (!live()) {
                return;
            }
            record.setUp(true);
            if (!record.isAcknowledged()) {
                record.setAcknowledged(true);
                record.setReplaced(null);
                if (record.getRequestCallbacks() != null) {
                    record.getRequestCallbacks().onOk();
                }
            }
        }

        @Override
        public void onError(ErrorCondition error) {
            if (!live()) {
                return;
            }
            record.setUp(false);
            if (error.is(ClientError.TRANSPORT_ERROR) || error.is(ClientError.NOT_CONNECTED)) {
                // the connection error that follows replays this record
                log.debug("Subscription {} lost its connection: {}", record, error);
                return;
            }
            if (!record.isAcknowledged()) {
                SubscriptionRecord<M> replaced = record.getReplaced();
                if (replaced != null) {
                    // the transport keeps the subscription it had before the forced one
                    registry.put(replaced);
                } else {
                    registry.remove(record.getHandle());
                }
                failRequest(record.getCallbacks(), record.getRequestCallbacks(), error);
            } else {
                log.warn("Subscription {} failed: {}", record, error);
                record.getCallbacks().onError(error);
            }
        }
    }

    private class CurrentRequest implements RequestCallbacks {
        private final RequestCallbacks target;
        private final int id;

        CurrentRequest(RequestCallbacks target, int id) {
            this.target = target;
            this.id = id;
        }

        @Override
        public void onOk() {
            if (isCurrent(id)) {
                target.onOk();
            }
        }

        @Override
        public void onError(ErrorCondition error) {
            if (isCurrent(id)) {
                target.onError(error);
            }
        }
    }

    private class CurrentPublish implements PublishCallbacks {
        private final PublishCallbacks target;
        private final int id;

        CurrentPublish(PublishCallbacks target, int id) {
            this.target = target;
            this.id = id;
        }

        @Override
        public void onOk(ChannelPosition position) {
            if (isCurrent(id)) {
                target.onOk(position);
            }
        }

        @Override
        public void onError(ErrorCondition error) {
            if (isCurrent(id)) {
                target.onError(error);
            }
        }
    }
}
