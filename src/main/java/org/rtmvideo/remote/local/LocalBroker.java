package org.rtmvideo.remote.local;

import org.rtmvideo.remote.client.IoLoop;
import org.rtmvideo.remote.client.RtmClient;
import org.rtmvideo.remote.client.RtmClientConfig;
import org.rtmvideo.remote.client.TransportFactory;
import org.rtmvideo.remote.core.ChannelPosition;
import org.rtmvideo.remote.core.ClientError;
import org.rtmvideo.remote.core.ErrorCallbacks;
import org.rtmvideo.remote.core.ErrorCondition;
import org.rtmvideo.remote.core.HistoryOptions;
import org.rtmvideo.remote.core.SubscriptionHandle;
import org.rtmvideo.remote.core.SubscriptionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * In process message service. Keeps one bounded log shared by all channels,
 * so positions are comparable across channels and filters can resume too.
 * Thread safe, clients may publish from any io loop.
 */
public class LocalBroker<M> implements TransportFactory<M> {

    private static final Logger log = LoggerFactory.getLogger(LocalBroker.class);

    private final LongSupplier clock;
    private final List<LocalClient<M>> connections = new ArrayList<>();
    private final List<Route<M>> routes = new ArrayList<>();
    private final ArrayDeque<Message<M>> retained = new ArrayDeque<>();
    private long generation;
    private long nextOffset;
    private int maxRetained = 1000;
    private boolean available = true;

    public LocalBroker() {
        this(System::currentTimeMillis);
    }

    public LocalBroker(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public RtmClient<M> newClient(RtmClientConfig config, IoLoop loop, ErrorCallbacks connectionErrors) {
        return new LocalClient<>(this, loop, connectionErrors);
    }

    public synchronized void setMaxRetained(int maxRetained) {
        if (maxRetained < 0) {
            throw new IllegalArgumentException("maxRetained: " + maxRetained);
        }
        this.maxRetained = maxRetained;
        trim();
    }

    /**
     * While unavailable every new connection fails to start with a transport error.
     */
    public synchronized void setAvailable(boolean available) {
        this.available = available;
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public synchronized int getConnectionCount() {
        return connections.size();
    }

    public synchronized int getSubscriptionCount() {
        return routes.size();
    }

    /**
     * Closes every connection, each client reports a transport error on its io thread.
     */
    public void dropConnections() {
        List<LocalClient<M>> dropped;
        synchronized (this) {
            dropped = new ArrayList<>(connections);
            connections.clear();
            routes.clear();
        }
        log.info("Dropping {} connections", dropped.size());
        for (LocalClient<M> client : dropped) {
            client.connectionLost(ClientError.TRANSPORT_ERROR.condition("connection reset by broker"));
        }
    }

    /**
     * Truncates the log and starts a new generation, older positions expire.
     */
    public synchronized void rotate() {
        generation++;
        nextOffset = 0;
        retained.clear();
        log.info("Rotated log to generation {}", generation);
    }

    public ChannelPosition publish(String channel, M payload) {
        List<Route<M>> targets = new ArrayList<>();
        Message<M> message;
        synchronized (this) {
            message = new Message<>(channel, payload, new ChannelPosition(generation, nextOffset++), clock.getAsLong());
            retained.addLast(message);
            trim();
            for (Route<M> route : routes) {
                if (route.matches(channel)) {
                    route.client.deliver(route.subscription, message);
                }
            }
        }
        return message.position;
    }

    synchronized boolean connect(LocalClient<M> client) {
        if (!available) {
            return false;
        }
        connections.add(client);
        return true;
    }

    synchronized void disconnect(LocalClient<M> client) {
        connections.remove(client);
        routes.removeIf(route -> route.client == client);
    }

    /**
     * Registers the route and hands the backlog to the client in one step, so
     * no live message can overtake it.
     *
     * @return null or the reason the subscription was refused
     */
    synchronized ErrorCondition subscribe(LocalClient<M> client, LocalClient.Subscription<M> subscription,
                                          String target, boolean filter, SubscriptionOptions options) {
        if (!connections.contains(client)) {
            return ClientError.TRANSPORT_ERROR.condition("not connected");
        }
        Route<M> route = new Route<>(client, subscription, target, filter);
        List<Message<M>> backlog;
        ChannelPosition position = options.getPosition();
        if (position != null) {
            if (isExpired(position)) {
                if (!options.isFastForward()) {
                    return ClientError.SUBSCRIBE_ERROR.condition("expired_position: " + position);
                }
                backlog = Collections.emptyList();
            } else {
                backlog = from(route, position);
            }
        } else {
            backlog = history(route, options.getHistory());
        }
        removeRoute(client, subscription.getHandle());
        routes.add(route);
        client.subscribed(subscription, backlog);
        return null;
    }

    synchronized void unsubscribe(LocalClient<M> client, SubscriptionHandle handle) {
        removeRoute(client, handle);
    }

    private void removeRoute(LocalClient<M> client, SubscriptionHandle handle) {
        routes.removeIf(route -> route.client == client && route.subscription.getHandle() == handle);
    }

    private boolean isExpired(ChannelPosition position) {
        if (position.getGeneration() != generation) {
            return position.getGeneration() < generation;
        }
        long firstOffset = retained.isEmpty() ? nextOffset : retained.peekFirst().position.getOffset();
        return Long.compareUnsigned(position.getOffset(), firstOffset) < 0;
    }

    private List<Message<M>> from(Route<M> route, ChannelPosition position) {
        List<Message<M>> result = new ArrayList<>();
        for (Message<M> message : retained) {
            if (message.position.compareTo(position) >= 0 && route.matches(message.channel)) {
                result.add(message);
            }
        }
        return result;
    }

    private List<Message<M>> history(Route<M> route, HistoryOptions history) {
        if (history.isEmpty()) {
            return Collections.emptyList();
        }
        long oldest = history.getAgeInSeconds() != null ? clock.getAsLong() - history.getAgeInSeconds() * 1000 : Long.MIN_VALUE;
        ArrayDeque<Message<M>> result = new ArrayDeque<>();
        Iterator<Message<M>> newestFirst = retained.descendingIterator();
        while (newestFirst.hasNext()) {
            Message<M> message = newestFirst.next();
            if (history.getCount() != null && result.size() >= history.getCount()) {
                break;
            }
            if (message.timestamp < oldest) {
                break;
            }
            if (route.matches(message.channel)) {
                result.addFirst(message);
            }
        }
        return new ArrayList<>(result);
    }

    private void trim() {
        while (retained.size() > maxRetained) {
            retained.removeFirst();
        }
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    static final class Message<M> {
        final String channel;
        final M payload;
        final ChannelPosition position;
        final long timestamp;

        Message(String channel, M payload, ChannelPosition position, long timestamp) {
            this.channel = channel;
            this.payload = payload;
            this.position = position;
            this.timestamp = timestamp;
        }
    }

    private static final class Route<M> {
        final LocalClient<M> client;
        final LocalClient.Subscription<M> subscription;
        final String channel;
        final Pattern filter;

        Route(LocalClient<M> client, LocalClient.Subscription<M> subscription, String target, boolean filter) {
            this.client = client;
            this.subscription = subscription;
            this.channel = filter ? null : target;
            this.filter = filter ? globToPattern(target) : null;
        }

        boolean matches(String candidate) {
            return filter != null ? filter.matcher(candidate).matches() : channel.equals(candidate);
        }
    }
}
