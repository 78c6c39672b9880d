package org.rtmvideo.remote.local;

import org.rtmvideo.remote.client.IoLoop;
import org.rtmvideo.remote.client.RtmClient;
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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection to a {@link LocalBroker}. Single use: once stopped or dropped it
 * stays down. Used from its io thread only, all callbacks are posted to it.
 */
public class LocalClient<M> implements RtmClient<M> {

    private final LocalBroker<M> broker;
    private final IoLoop loop;
    private final ErrorCallbacks connectionErrors;
    private final Map<SubscriptionHandle, Subscription<M>> subscriptions = new HashMap<>();
    private boolean started;
    private boolean used;

    LocalClient(LocalBroker<M> broker, IoLoop loop, ErrorCallbacks connectionErrors) {
        this.broker = broker;
        this.loop = loop;
        this.connectionErrors = connectionErrors;
    }

    @Override
    public ErrorCondition start() {
        if (used) {
            throw new IllegalStateException("Client can only be started once.");
        }
        used = true;
        if (!broker.connect(this)) {
            return ClientError.TRANSPORT_ERROR.condition("broker unavailable");
        }
        started = true;
        return null;
    }

    @Override
    public ErrorCondition stop() {
        if (!started) {
            return ClientError.NOT_CONNECTED.condition("not connected");
        }
        started = false;
        subscriptions.clear();
        broker.disconnect(this);
        return null;
    }

    @Override
    public void publish(String channel, M message, PublishCallbacks callbacks) {
        if (!started) {
            if (callbacks != null) {
                post(callbacks, ClientError.TRANSPORT_ERROR.condition("not connected"));
            }
            return;
        }
        if (channel == null || channel.isEmpty()) {
            if (callbacks != null) {
                post(callbacks, ClientError.PUBLISH_ERROR.condition("invalid channel name"));
            }
            return;
        }
        final ChannelPosition position = broker.publish(channel, message);
        if (callbacks != null) {
            loop.execute(() -> callbacks.onOk(position));
        }
    }

    @Override
    public void subscribeChannel(SubscriptionHandle handle, String channel, SubscriptionOptions options,
                                 SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        subscribe(handle, channel, false, options, callbacks, requestCallbacks);
    }

    @Override
    public void subscribeFilter(SubscriptionHandle handle, String filter, SubscriptionOptions options,
                                SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        subscribe(handle, filter, true, options, callbacks, requestCallbacks);
    }

    private void subscribe(SubscriptionHandle handle, String target, boolean filter, SubscriptionOptions options,
                           SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        ErrorCallbacks failure = requestCallbacks != null ? requestCallbacks : callbacks;
        if (options == null) {
            options = SubscriptionOptions.DEFAULT;
        }
        if (!started) {
            post(failure, ClientError.TRANSPORT_ERROR.condition("not connected"));
            return;
        }
        if (target == null || target.isEmpty()) {
            post(failure, ClientError.SUBSCRIBE_ERROR.condition("invalid subscription target"));
            return;
        }
        if (subscriptions.containsKey(handle) && !options.isForce()) {
            post(failure, ClientError.SUBSCRIPTION_ERROR.condition(handle + " is already subscribed"));
            return;
        }
        Subscription<M> subscription = new Subscription<>(handle, callbacks, requestCallbacks);
        Subscription<M> replaced = subscriptions.put(handle, subscription);
        ErrorCondition refused = broker.subscribe(this, subscription, target, filter, options);
        if (refused != null) {
            if (replaced != null) {
                subscriptions.put(handle, replaced);
            } else {
                subscriptions.remove(handle);
            }
            post(failure, refused);
        }
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle, RequestCallbacks requestCallbacks) {
        if (!started) {
            if (requestCallbacks != null) {
                post(requestCallbacks, ClientError.TRANSPORT_ERROR.condition("not connected"));
            }
            return;
        }
        subscriptions.remove(handle);
        broker.unsubscribe(this, handle);
        if (requestCallbacks != null) {
            loop.execute(requestCallbacks::onOk);
        }
    }

    @Override
    public ChannelPosition position(SubscriptionHandle handle) {
        Subscription<M> subscription = subscriptions.get(handle);
        return subscription != null ? subscription.position : null;
    }

    @Override
    public boolean isUp(SubscriptionHandle handle) {
        Subscription<M> subscription = subscriptions.get(handle);
        return started && subscription != null && subscription.up;
    }

    private void post(ErrorCallbacks callbacks, ErrorCondition error) {
        loop.execute(() -> callbacks.onError(error));
    }

    private boolean isActive(Subscription<M> subscription) {
        return started && subscriptions.get(subscription.handle) == subscription;
    }

    // called by the broker, possibly from another thread

    void subscribed(Subscription<M> subscription, List<LocalBroker.Message<M>> backlog) {
        loop.execute(() -> {
            if (!isActive(subscription)) {
                return;
            }
            subscription.up = true;
            if (subscription.requestCallbacks != null) {
                subscription.requestCallbacks.onOk();
            }
            for (LocalBroker.Message<M> message : backlog) {
                dispatch(subscription, message);
            }
        });
    }

    void deliver(Subscription<M> subscription, LocalBroker.Message<M> message) {
        loop.execute(() -> dispatch(subscription, message));
    }

    void connectionLost(ErrorCondition error) {
        loop.execute(() -> {
            if (!started) {
                return;
            }
            started = false;
            subscriptions.clear();
            connectionErrors.onError(error);
        });
    }

    private void dispatch(Subscription<M> subscription, LocalBroker.Message<M> message) {
        if (!isActive(subscription)) {
            return;
        }
        ChannelPosition next = message.position.next();
        subscription.position = next;
        subscription.callbacks.onData(subscription.handle,
                new ChannelData<>(message.channel, message.payload, next, System.currentTimeMillis()));
    }

    static final class Subscription<M> {
        private final SubscriptionHandle handle;
        private final SubscriptionCallbacks<M> callbacks;
        private final RequestCallbacks requestCallbacks;
        private ChannelPosition position;
        private boolean up;

        Subscription(SubscriptionHandle handle, SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
            this.handle = handle;
            this.callbacks = callbacks;
            this.requestCallbacks = requestCallbacks;
        }

        SubscriptionHandle getHandle() {
            return handle;
        }
    }
}
