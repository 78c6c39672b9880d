package org.rtmvideo.remote.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of one logical subscription. Equality is identity, the id is only
 * there for log output.
 */
public final class SubscriptionHandle {

    private static final AtomicLong ids = new AtomicLong();

    private final long id;

    private SubscriptionHandle(long id) {
        this.id = id;
    }

    public static SubscriptionHandle create() {
        return new SubscriptionHandle(ids.incrementAndGet());
    }

    public long getId() {
        return id;
    }

    @Override
    public String toString() {
        return "sub#" + id;
    }
}
