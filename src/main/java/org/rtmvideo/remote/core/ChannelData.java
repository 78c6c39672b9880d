package org.rtmvideo.remote.core;

/**
 * One message delivered to a subscription. The payload is owned by the codec
 * and never looked at by the client.
 */
public final class ChannelData<M> {

    private final String channel;
    private final M payload;
    private final ChannelPosition position;
    private final long arrivalTimeMillis;

    /**
     * @param position position to resume from after this message, resubscribing
     *                 there does not redeliver it. Positions of all channels
     *                 one filter matches must be comparable, duplicates are
     *                 detected by comparing against the last one delivered
     */
    public ChannelData(String channel, M payload, ChannelPosition position, long arrivalTimeMillis) {
        this.channel = channel;
        this.payload = payload;
        this.position = position;
        this.arrivalTimeMillis = arrivalTimeMillis;
    }

    public String getChannel() {
        return channel;
    }

    public M getPayload() {
        return payload;
    }

    public ChannelPosition getPosition() {
        return position;
    }

    public long getArrivalTimeMillis() {
        return arrivalTimeMillis;
    }

    @Override
    public String toString() {
        return "ChannelData{" + channel + "@" + position + "}";
    }
}
