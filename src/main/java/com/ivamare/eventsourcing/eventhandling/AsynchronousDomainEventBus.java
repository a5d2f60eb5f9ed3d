package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.DomainMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Event bus that delivers published streams to listeners on an executor.
 *
 * <p>Every listener receives streams in publish order. Listener failures never reach the
 * publisher: they are logged and handed to the error callback given at construction.
 * {@link #untilIdle()} completes once no delivery is queued or running, including
 * deliveries caused by listeners publishing further streams.
 */
public class AsynchronousDomainEventBus implements DomainEventBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsynchronousDomainEventBus.class);

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Consumer<Throwable> errorCallback;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final ThreadLocal<Boolean> delivering = ThreadLocal.withInitial(() -> false);

    private final Object lock = new Object();
    private final Map<EventListener, CompletableFuture<Void>> tails = new IdentityHashMap<>();
    private final List<CompletableFuture<Void>> idleWaiters = new ArrayList<>();
    private int inFlight;
    private boolean closed;

    /**
     * Creates a bus backed by its own daemon thread pool.
     *
     * @param errorCallback Receives every exception thrown by a listener
     */
    public AsynchronousDomainEventBus(Consumer<Throwable> errorCallback) {
        this(newExecutor(), errorCallback, true);
    }

    /**
     * Creates a bus delivering on the given executor. The executor is not shut down by {@link #close()}.
     *
     * @param executor Executor running deliveries
     * @param errorCallback Receives every exception thrown by a listener
     */
    public AsynchronousDomainEventBus(Executor executor, Consumer<Throwable> errorCallback) {
        this(executor, errorCallback, false);
    }

    private AsynchronousDomainEventBus(Executor executor, Consumer<Throwable> errorCallback, boolean owned) {
        this.executor = executor;
        this.ownedExecutor = owned ? (ExecutorService) executor : null;
        this.errorCallback = errorCallback;
    }

    private static ExecutorService newExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("domain-event-bus-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public void subscribe(EventListener listener) {
        listeners.add(listener);
        log.debug("Subscribed listener {}", listener.getClass().getSimpleName());
    }

    @Override
    public void publish(DomainEventStream stream) {
        if (stream.isEmpty()) {
            return;
        }
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Event bus is closed");
            }
            for (EventListener listener : listeners) {
                inFlight++;
                CompletableFuture<Void> tail = tails.getOrDefault(listener, CompletableFuture.completedFuture(null));
                CompletableFuture<Void> next = tail
                    .exceptionally(e -> null)
                    .thenRunAsync(() -> deliver(listener, stream), executor)
                    .whenComplete((v, e) -> deliveryFinished(e));
                tails.put(listener, next);
            }
        }
    }

    /**
     * Completes when no delivery is queued or running.
     *
     * @return future completed on the thread that finishes the last delivery, or already completed
     */
    public CompletableFuture<Void> untilIdle() {
        synchronized (lock) {
            if (inFlight == 0) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            idleWaiters.add(waiter);
            return waiter;
        }
    }

    public boolean isIdle() {
        synchronized (lock) {
            return inFlight == 0;
        }
    }

    /**
     * Whether the calling thread is inside a listener invoked by this bus. Such a caller
     * cannot wait for {@link #untilIdle()}: its own delivery is still in flight.
     */
    public boolean isDeliveringOnCurrentThread() {
        return delivering.get();
    }

    private void deliver(EventListener listener, DomainEventStream stream) {
        delivering.set(true);
        try {
            deliverAll(listener, stream);
        } finally {
            delivering.remove();
        }
    }

    private void deliverAll(EventListener listener, DomainEventStream stream) {
        for (DomainMessage message : stream) {
            try {
                listener.handle(message);
            } catch (Exception | AssertionError e) {
                log.warn("Listener {} failed on {} (aggregateId={}, playhead={})",
                    listener.getClass().getSimpleName(), message.payloadType().getSimpleName(),
                    message.aggregateId().value(), message.playhead(), e);
                errorCallback.accept(e);
            }
        }
    }

    private void deliveryFinished(Throwable failure) {
        if (failure != null) {
            // Rejected by the executor, or an Error escaped the listener.
            log.error("Delivery failed", failure);
            errorCallback.accept(failure);
        }
        List<CompletableFuture<Void>> waiters;
        synchronized (lock) {
            inFlight--;
            if (inFlight > 0) {
                return;
            }
            waiters = new ArrayList<>(idleWaiters);
            idleWaiters.clear();
        }
        waiters.forEach(waiter -> waiter.complete(null));
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
