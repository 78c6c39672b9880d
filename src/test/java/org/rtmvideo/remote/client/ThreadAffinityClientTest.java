package org.rtmvideo.remote.client;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.rtmvideo.remote.EventAssert;
import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.ClientError;
import org.rtmvideo.remote.core.ErrorCondition;
import org.rtmvideo.remote.core.PublishCallbacks;
import org.rtmvideo.remote.core.RequestCallbacks;
import org.rtmvideo.remote.core.SubscriptionCallbacks;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ThreadAffinityClientTest {

    private static final ChannelPosition POSITION = new ChannelPosition(1, 2);

    private IoLoop loop;
    private RecordingClient target;
    private EventAssert<ErrorCondition> errors;
    private ThreadAffinityClient<String> client;

    @Before
    public void setUp() {
        loop = IoLoop.start("io");
        target = new RecordingClient();
        errors = EventAssert.create(1);
        client = new ThreadAffinityClient<>(loop, target, errors::receiveMessage);
    }

    @After
    public void tearDown() {
        loop.dispose();
    }

    private void awaitLoop() throws InterruptedException {
        final CountDownLatch done = new CountDownLatch(1);
        loop.execute(done::countDown);
        assertTrue(done.await(10, TimeUnit.SECONDS));
    }

    @Test
    public void foreignCallsRunOnIoThreadInSubmissionOrder() throws Exception {
        final int perThread = 500;
        List<Thread> producers = new ArrayList<>();
        for (int t = 0; t < 3; t++) {
            final String name = "producer" + t;
            producers.add(new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    client.publish(name, String.valueOf(i));
                }
            }, name));
        }
        for (Thread producer : producers) {
            producer.start();
        }
        for (Thread producer : producers) {
            producer.join();
        }
        awaitLoop();

        assertEquals(3 * perThread, target.calls.size());
        assertFalse(target.foreignThreadSeen.get());
        for (int t = 0; t < 3; t++) {
            int expected = 0;
            for (String call : target.calls) {
                if (call.startsWith("producer" + t + "=")) {
                    assertEquals("producer" + t + "=" + expected, call);
                    expected++;
                }
            }
            assertEquals(perThread, expected);
        }
    }

    @Test
    public void callsOnIoThreadRunInline() throws Exception {
        final AtomicBoolean inline = new AtomicBoolean();
        final CountDownLatch done = new CountDownLatch(1);
        loop.execute(() -> {
            client.publish("ch1", "m");
            inline.set(target.calls.size() == 1);
            done.countDown();
        });
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertTrue(inline.get());
    }

    @Test
    public void subscribeReturnsHandleWithoutBlocking() throws Exception {
        SubscriptionHandle handle = client.subscribeChannel("ch1", SubscriptionOptions.DEFAULT,
                new SubscriptionCallbacks<String>() {
                    @Override
                    public void onError(ErrorCondition error) {
                        fail(error.toString());
                    }
                });
        assertNotNull(handle);
        awaitLoop();
        assertEquals(Collections.singletonList("subscribe:ch1"), target.calls);
        assertSame(handle, target.lastHandle);
    }

    @Test
    public void callbacksRunOnIoThread() throws Exception {
        final EventAssert<Thread> threads = EventAssert.create(2);
        client.publish("ch1", "m", new PublishCallbacks() {
            @Override
            public void onOk(ChannelPosition position) {
                threads.receiveMessage(Thread.currentThread());
            }

            @Override
            public void onError(ErrorCondition error) {
                fail(error.toString());
            }
        });
        client.unsubscribe(SubscriptionHandle.create(), new RequestCallbacks() {
            @Override
            public void onOk() {
                threads.receiveMessage(Thread.currentThread());
            }

            @Override
            public void onError(ErrorCondition error) {
                fail(error.toString());
            }
        });
        threads.assertEvent();
        assertSame(target.ioThread, threads.takeFromReceived());
        assertSame(target.ioThread, threads.takeFromReceived());
    }

    @Test
    public void synchronousReadsOnlyOnIoThread() throws Exception {
        SubscriptionHandle handle = SubscriptionHandle.create();
        try {
            client.isUp(handle);
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
        }
        EventAssert<ChannelPosition> position = EventAssert.create(1);
        client.position(handle, position.createCallback());
        position.assertEvent();
        assertEquals(POSITION, position.takeFromReceived());

        EventAssert<Boolean> up = EventAssert.create(1);
        client.isUp(handle, up.createCallback());
        up.assertEvent();
        assertTrue(up.takeFromReceived());
    }

    @Test
    public void foreignStartFailureGoesToErrorCallbacks() {
        target.startResult = ClientError.TRANSPORT_ERROR.condition("refused");
        assertNull(client.start());
        errors.assertEvent();
        ErrorCondition error = errors.takeFromReceived();
        assertEquals(ClientError.TRANSPORT_ERROR.condition(), error);
        assertTrue(error.getMessage(), error.getMessage().startsWith("start failed"));
    }

    @Test
    public void startOnIoThreadReturnsResult() throws Exception {
        target.startResult = ClientError.TRANSPORT_ERROR.condition();
        final AtomicReference<ErrorCondition> result = new AtomicReference<>();
        final CountDownLatch done = new CountDownLatch(1);
        loop.execute(() -> {
            result.set(client.start());
            done.countDown();
        });
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(ClientError.TRANSPORT_ERROR.condition(), result.get());
        assertEquals(1, errors.latch.getCount());
    }

    /**
     * Records calls and whether any of them ran off the io thread.
     */
    private class RecordingClient implements RtmClient<String> {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());
        final AtomicBoolean foreignThreadSeen = new AtomicBoolean();
        volatile Thread ioThread;
        volatile SubscriptionHandle lastHandle;
        volatile ErrorCondition startResult;

        private void onIoThread() {
            if (!loop.inLoop()) {
                foreignThreadSeen.set(true);
            }
            ioThread = Thread.currentThread();
        }

        @Override
        public void publish(String channel, String message, PublishCallbacks callbacks) {
            onIoThread();
            calls.add(channel + "=" + message);
            if (callbacks != null) {
                callbacks.onOk(POSITION);
            }
        }

        @Override
        public void subscribeChannel(SubscriptionHandle handle, String channel, SubscriptionOptions options,
                                     SubscriptionCallbacks<String> callbacks, RequestCallbacks requestCallbacks) {
            onIoThread();
            lastHandle = handle;
            calls.add("subscribe:" + channel);
        }

        @Override
        public void subscribeFilter(SubscriptionHandle handle, String filter, SubscriptionOptions options,
                                    SubscriptionCallbacks<String> callbacks, RequestCallbacks requestCallbacks) {
            onIoThread();
            lastHandle = handle;
            calls.add("filter:" + filter);
        }

        @Override
        public void unsubscribe(SubscriptionHandle handle, RequestCallbacks requestCallbacks) {
            onIoThread();
            calls.add("unsubscribe");
            if (requestCallbacks != null) {
                requestCallbacks.onOk();
            }
        }

        @Override
        public ChannelPosition position(SubscriptionHandle handle) {
            onIoThread();
            return POSITION;
        }

        @Override
        public boolean isUp(SubscriptionHandle handle) {
            onIoThread();
            return true;
        }

        @Override
        public ErrorCondition start() {
            onIoThread();
            return startResult;
        }

        @Override
        public ErrorCondition stop() {
            onIoThread();
            return null;
        }
    }
}
