package org.rtmvideo.remote.client;

import org.jetlang.core.Callback;
import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.ErrorCallbacks;
import org.rtmvideo.remote.core.ErrorCondition;
import org.rtmvideo.remote.core.PublishCallbacks;
import org.rtmvideo.remote.core.RequestCallbacks;
import org.rtmvideo.remote.core.SubscriptionCallbacks;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;

/**
 * Runs every call of the wrapped client on the io thread. Calls made on the io
 * thread run inline, calls from other threads are queued on the io fiber in
 * the order they were made and the caller returns immediately. Callbacks are
 * always invoked on the io thread.
 */
public class ThreadAffinityClient<M> implements RtmClient<M> {

    private final IoLoop loop;
    private final RtmClient<M> client;
    private final ErrorCallbacks errorCallbacks;

    /**
     * @param errorCallbacks receives start and stop failures of calls made off
     *                       the io thread, which cannot return them
     */
    public ThreadAffinityClient(IoLoop loop, RtmClient<M> client, ErrorCallbacks errorCallbacks) {
        this.loop = loop;
        this.client = client;
        this.errorCallbacks = errorCallbacks;
    }

    private void run(Runnable call) {
        if (loop.inLoop()) {
            call.run();
        } else {
            loop.execute(call);
        }
    }

    @Override
    public void publish(String channel, M message, PublishCallbacks callbacks) {
        run(() -> client.publish(channel, message, callbacks));
    }

    @Override
    public void subscribeChannel(SubscriptionHandle handle, String channel, SubscriptionOptions options,
                                 SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        run(() -> client.subscribeChannel(handle, channel, options, callbacks, requestCallbacks));
    }

    @Override
    public void subscribeFilter(SubscriptionHandle handle, String filter, SubscriptionOptions options,
                                SubscriptionCallbacks<M> callbacks, RequestCallbacks requestCallbacks) {
        run(() -> client.subscribeFilter(handle, filter, options, callbacks, requestCallbacks));
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle, RequestCallbacks requestCallbacks) {
        run(() -> client.unsubscribe(handle, requestCallbacks));
    }

    /**
     * Only answers on the io thread, use {@link #position(SubscriptionHandle, Callback)} elsewhere.
     */
    @Override
    public ChannelPosition position(SubscriptionHandle handle) {
        loop.checkThread("position");
        return client.position(handle);
    }

    /**
     * Only answers on the io thread, use {@link #isUp(SubscriptionHandle, Callback)} elsewhere.
     */
    @Override
    public boolean isUp(SubscriptionHandle handle) {
        loop.checkThread("isUp");
        return client.isUp(handle);
    }

    @Override
    public void position(SubscriptionHandle handle, Callback<ChannelPosition> callback) {
        run(() -> callback.onMessage(client.position(handle)));
    }

    @Override
    public void isUp(SubscriptionHandle handle, Callback<Boolean> callback) {
        run(() -> callback.onMessage(client.isUp(handle)));
    }

    /**
     * @return the result when called on the io thread, otherwise null and a
     * failure goes to the error callbacks
     */
    @Override
    public ErrorCondition start() {
        if (loop.inLoop()) {
            return client.start();
        }
        loop.execute(() -> report("start", client.start()));
        return null;
    }

    /**
     * @see #start()
     */
    @Override
    public ErrorCondition stop() {
        if (loop.inLoop()) {
            return client.stop();
        }
        loop.execute(() -> report("stop", client.stop()));
        return null;
    }

    private void report(String operation, ErrorCondition result) {
        if (result != null) {
            errorCallbacks.onError(new ErrorCondition(result.getError(), operation + " failed: " + result.getMessage()));
        }
    }
}
