package org.rtmvideo.remote.client;

import org.rtmvideo.remote.core.SubscriptionHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Active subscriptions in insertion order, keyed by handle. Not thread safe,
 * owned by the resilient client and only used on its io thread.
 */
public class SubscriptionRegistry<M> {

    private final Map<SubscriptionHandle, SubscriptionRecord<M>> records = new LinkedHashMap<>();

    public SubscriptionRecord<M> get(SubscriptionHandle handle) {
        return records.get(handle);
    }

    public boolean contains(SubscriptionHandle handle) {
        return records.containsKey(handle);
    }

    /**
     * Adds the record, replacing one with the same handle in its original slot.
     *
     * @return the replaced record or null
     */
    public SubscriptionRecord<M> put(SubscriptionRecord<M> record) {
        return records.put(record.getHandle(), record);
    }

    public SubscriptionRecord<M> remove(SubscriptionHandle handle) {
        return records.remove(handle);
    }

    /**
     * @return true if {@code record} is the one registered under its handle
     */
    public boolean isCurrent(SubscriptionRecord<M> record) {
        return records.get(record.getHandle()) == record;
    }

    /**
     * @return snapshot in insertion order, safe to iterate while subscribing
     */
    public List<SubscriptionRecord<M>> records() {
        return new ArrayList<>(records.values());
    }

    public void markAllDown() {
        for (SubscriptionRecord<M> record : records.values()) {
            record.setUp(false);
        }
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
