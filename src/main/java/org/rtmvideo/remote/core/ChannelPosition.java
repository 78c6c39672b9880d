package org.rtmvideo.remote.core;

/**
 * Location in a channel's history. The generation grows whenever the log is
 * truncated or rotated, the offset grows inside one generation. Both fields
 * are unsigned: generation fits in 32 bits, offset uses all 64.
 */
public final class ChannelPosition implements Comparable<ChannelPosition> {

    public static final ChannelPosition ZERO = new ChannelPosition(0, 0);

    private static final long MAX_GENERATION = 0xFFFFFFFFL;

    private final long generation;
    private final long offset;

    /**
     * @param generation unsigned 32 bit value held in a long
     * @param offset     unsigned 64 bit value
     */
    public ChannelPosition(long generation, long offset) {
        if (generation < 0 || generation > MAX_GENERATION) {
            throw new IllegalArgumentException("generation out of range: " + generation);
        }
        this.generation = generation;
        this.offset = offset;
    }

    public long getGeneration() {
        return generation;
    }

    public long getOffset() {
        return offset;
    }

    public ChannelPosition next() {
        return new ChannelPosition(generation, offset + 1);
    }

    public boolean isAfter(ChannelPosition other) {
        return compareTo(other) > 0;
    }

    /**
     * Parses {@code "generation:offset"}. Malformed text yields {@link #ZERO},
     * so a genuine zero position cannot be told apart from a parse failure.
     */
    public static ChannelPosition parse(String text) {
        if (text == null) {
            return ZERO;
        }
        int sep = text.indexOf(':');
        if (sep <= 0 || sep == text.length() - 1) {
            return ZERO;
        }
        String gen = text.substring(0, sep);
        String off = text.substring(sep + 1);
        if (!digitsOnly(gen) || !digitsOnly(off)) {
            return ZERO;
        }
        try {
            long generation = Long.parseLong(gen);
            if (generation > MAX_GENERATION) {
                return ZERO;
            }
            return new ChannelPosition(generation, Long.parseUnsignedLong(off));
        } catch (NumberFormatException outOfRange) {
            return ZERO;
        }
    }

    private static boolean digitsOnly(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(ChannelPosition o) {
        int byGeneration = Long.compare(generation, o.generation);
        if (byGeneration != 0) {
            return byGeneration;
        }
        return Long.compareUnsigned(offset, o.offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelPosition)) return false;
        ChannelPosition that = (ChannelPosition) o;
        return generation == that.generation && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(generation) + Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return generation + ":" + Long.toUnsignedString(offset);
    }
}
