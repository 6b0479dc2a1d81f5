package com.nchat.connectors.event;

import com.nchat.connectors.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-connector publish/subscribe channel.
 *
 * <p>{@link #publish(ConnectorEvent)} never blocks: events go into a bounded
 * queue and a single daemon thread delivers them in publication order. When the
 * queue is full the event is dropped with a warning. A listener that throws is
 * logged and the remaining listeners still receive the event.
 *
 * <p>The delivery thread exits after {@link #DEFAULT_KEEP_ALIVE_MS} without
 * work and is started again by the next publish, so a bus that is never
 * closed holds no thread while idle.
 */
public final class ConnectorEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorEventBus.class);

    public static final int  DEFAULT_CAPACITY      = 256;
    public static final long DEFAULT_KEEP_ALIVE_MS = 5_000;

    private final String name;
    private final Map<ConnectorEventType, List<ConnectorEventListener>> listeners = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor delivery;

    public ConnectorEventBus(String name) {
        this(name, DEFAULT_CAPACITY);
    }

    public ConnectorEventBus(String name, int capacity) {
        this(name, capacity, DEFAULT_KEEP_ALIVE_MS);
    }

    public ConnectorEventBus(String name, int capacity, long keepAliveMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        if (keepAliveMs <= 0) {
            throw new IllegalArgumentException("keepAliveMs must be > 0, got: " + keepAliveMs);
        }
        this.name = name;
        this.delivery = new ThreadPoolExecutor(
                1, 1, keepAliveMs, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                new DaemonThreadFactory("connector-events-" + name + "-"),
                (task, executor) -> log.warn("Event queue for '{}' is full or closed; dropping event", name));
        delivery.allowCoreThreadTimeOut(true);
    }

    public void on(ConnectorEventType type, ConnectorEventListener listener) {
        listeners.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void off(ConnectorEventType type, ConnectorEventListener listener) {
        List<ConnectorEventListener> registered = listeners.get(type);
        if (registered != null) {
            registered.remove(listener);
        }
    }

    public int listenerCount(ConnectorEventType type) {
        List<ConnectorEventListener> registered = listeners.get(type);
        return registered == null ? 0 : registered.size();
    }

    /**
     * Queues {@code event} for asynchronous delivery.
     */
    public void publish(ConnectorEvent event) {
        List<ConnectorEventListener> registered = listeners.get(event.getType());
        if (registered == null || registered.isEmpty()) {
            return;
        }
        delivery.execute(() -> deliver(event));
    }

    /**
     * Waits until every event published before this call has been delivered.
     *
     * @return {@code false} if the timeout elapsed or the bus is closed
     */
    public boolean awaitDelivery(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> marker;
        try {
            marker = delivery.submit(() -> { });
        } catch (RejectedExecutionException e) {
            return false;
        }
        try {
            marker.get(timeout, unit);
            return true;
        } catch (ExecutionException | TimeoutException e) {
            return false;
        }
    }

    /** Live delivery threads: 0 or 1. */
    int deliveryThreads() {
        return delivery.getPoolSize();
    }

    @Override
    public void close() {
        delivery.shutdown();
    }

    private void deliver(ConnectorEvent event) {
        List<ConnectorEventListener> registered = listeners.get(event.getType());
        if (registered == null) {
            return;
        }
        for (ConnectorEventListener listener : registered) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} event for '{}'",
                        listener.getClass().getSimpleName(), event.getType().wireName(), name, e);
            }
        }
    }
}
