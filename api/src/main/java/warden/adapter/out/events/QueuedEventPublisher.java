package warden.adapter.out.events;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.EventsConfig;
import warden.core.model.event.AuthEvent;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.EventPublisher;
import warden.spi.AuthEventHandler;

/**
 * Outbound event channel backed by a bounded in-process queue.
 *
 * <p>{@link #publish} only enqueues. A single daemon worker drains the queue
 * and hands each event to every available {@link AuthEventHandler} in
 * priority order (highest first), retrying a failing handler with a fixed
 * backoff. When the queue is full, or a handler exhausts its attempts, the
 * event is dropped for that handler and counted.
 */
@ApplicationScoped
public class QueuedEventPublisher implements EventPublisher {

    private static final Logger LOG = Logger.getLogger(QueuedEventPublisher.class);
    private static final long POLL_MILLIS = 500;

    private final List<AuthEventHandler> handlers;
    private final BlockingQueue<AuthEvent> queue;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final AuthMetrics metrics;

    private volatile boolean running;
    private ExecutorService worker;

    @Inject
    public QueuedEventPublisher(EventsConfig config, AuthMetrics metrics) {
        this(loadHandlers(), config.queueCapacity(), config.maxAttempts(), config.retryBackoff(), metrics);
    }

    public QueuedEventPublisher(
            List<AuthEventHandler> handlers,
            int queueCapacity,
            int maxAttempts,
            Duration retryBackoff,
            AuthMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.handlers = handlers.stream()
                .filter(AuthEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(AuthEventHandler::priority).reversed())
                .toList();
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.metrics = metrics;
    }

    private static List<AuthEventHandler> loadHandlers() {
        return ServiceLoader.load(AuthEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    @PostConstruct
    void start() {
        if (handlers.isEmpty()) {
            LOG.warn("No auth event handlers found - events will be discarded");
        } else {
            LOG.infof(
                    "Loaded %d auth event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }
        running = true;
        worker = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "auth-event-publisher");
            thread.setDaemon(true);
            return thread;
        });
        worker.submit(this::drain);
    }

    @PreDestroy
    void shutdown() {
        running = false;
        if (worker != null) {
            worker.shutdownNow();
        }
        if (!queue.isEmpty()) {
            LOG.warnf("Discarding %d undelivered auth event(s) on shutdown", queue.size());
        }
        handlers.forEach(handler -> {
            try {
                handler.close();
            } catch (Exception e) {
                LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
            }
        });
    }

    @Override
    public void publish(AuthEvent event) {
        if (event == null) {
            return;
        }
        if (!queue.offer(event)) {
            LOG.warnf("Auth event queue full, dropping %s for user %s", event.eventName(), event.userId());
            metrics.recordEventDropped(event.eventName());
        }
    }

    /**
     * Number of events waiting for delivery.
     *
     * @return queue depth
     */
    public int pending() {
        return queue.size();
    }

    List<AuthEventHandler> handlers() {
        return handlers;
    }

    private void drain() {
        while (running) {
            final AuthEvent event;
            try {
                event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Auth event worker interrupted, stopping");
                return;
            }
            if (event == null) {
                continue;
            }
            for (var handler : handlers) {
                if (!deliver(handler, event)) {
                    return;
                }
            }
        }
    }

    /**
     * Deliver to one handler with retries.
     *
     * @return false if the worker was interrupted and must stop
     */
    private boolean deliver(AuthEventHandler handler, AuthEvent event) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                handler.handle(event);
                return true;
            } catch (Exception e) {
                if (attempt == maxAttempts) {
                    LOG.errorf(
                            "Handler %s gave up on %s after %d attempt(s): %s",
                            handler.name(), event.eventName(), attempt, e.getMessage());
                    metrics.recordEventDropped(event.eventName());
                    return true;
                }
                LOG.debugf(
                        "Handler %s failed attempt %d for %s: %s",
                        handler.name(), attempt, event.eventName(), e.getMessage());
            }
            try {
                Thread.sleep(retryBackoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Auth event worker interrupted while retrying %s", event.eventName());
                return false;
            }
        }
        return true;
    }
}
