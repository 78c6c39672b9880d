package org.rtmvideo.remote.client;

import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;

import java.util.concurrent.Executor;

/**
 * The fiber that owns all client i/o together with the identity of the thread
 * draining it.
 */
public class IoLoop implements Executor {

    private final Fiber fiber;
    private volatile Thread owner;

    /**
     * @param owner thread that executes the fiber's work, e.g. the test thread
     *              for a fiber stub
     */
    public IoLoop(Fiber fiber, Thread owner) {
        this.fiber = fiber;
        this.owner = owner;
    }

    /**
     * Starts a daemon thread fiber. The owner thread is recorded by the first
     * task it runs, until then every caller counts as a foreign thread.
     */
    public static IoLoop start(String threadName) {
        ThreadFiber fiber = new ThreadFiber(new RunnableExecutorImpl(), threadName, true);
        final IoLoop loop = new IoLoop(fiber, null);
        fiber.execute(() -> loop.owner = Thread.currentThread());
        fiber.start();
        return loop;
    }

    public boolean inLoop() {
        return Thread.currentThread() == owner;
    }

    public void checkThread(String operation) {
        if (!inLoop()) {
            throw new IllegalStateException(operation + " called on " + Thread.currentThread().getName()
                    + ", expected " + (owner != null ? owner.getName() : "io thread"));
        }
    }

    @Override
    public void execute(Runnable command) {
        fiber.execute(command);
    }

    public void dispose() {
        fiber.dispose();
    }
}
