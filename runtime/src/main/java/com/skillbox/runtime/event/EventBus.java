package com.skillbox.runtime.event;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process publish/subscribe backbone.
 *
 * Every component that needs to announce a state change publishes here;
 * external channels subscribe to the topics they care about (or to
 * {@link Topics#WILDCARD}) without depending on the publisher.
 *
 * <p>Delivery guarantees:
 * <ul>
 *   <li>{@link #publish} fans out to all matching handlers concurrently and
 *       returns only once every one of them has finished.</li>
 *   <li>A failing handler is logged and never affects other handlers or
 *       the publisher.</li>
 *   <li>{@link #publishAsync} never throws.</li>
 * </ul>
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object lock = new Object();
    private final Map<String, List<Subscription>> subscriptions = new LinkedHashMap<>();
    private final Map<String, Long> topicCounts = new TreeMap<>();
    private final Deque<Event> history = new ArrayDeque<>();
    private final int historySize;
    private final Clock clock;
    private final ExecutorService dispatcher =
            Executors.newCachedThreadPool(daemonThreads("event-bus-"));

    private long ticketSequence;

    public EventBus(@Value("${skillbox.events.history-size:200}") int historySize, Clock clock) {
        if (historySize < 1) {
            throw new IllegalArgumentException("history size must be positive: " + historySize);
        }
        this.historySize = historySize;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------

    /**
     * Subscribe {@code handler} to {@code topic}.
     *
     * @return a ticket for {@link #unsubscribe}; re-subscribing an equal
     *         handler to the same topic returns the ticket issued first
     */
    public String subscribe(String topic, EventHandler handler) {
        synchronized (lock) {
            List<Subscription> forTopic = subscriptions.computeIfAbsent(topic, t -> new ArrayList<>());
            for (Subscription existing : forTopic) {
                if (existing.handler().equals(handler)) {
                    log.debug("Handler {} already subscribed to '{}'", handler, topic);
                    return existing.ticket();
                }
            }
            String ticket = topic + "#" + (++ticketSequence);
            forTopic.add(new Subscription(ticket, handler));
            log.debug("Subscribed {} to '{}' ({})", handler, topic, ticket);
            return ticket;
        }
    }

    /** @return true if the ticket was known and has been removed */
    public boolean unsubscribe(String ticket) {
        synchronized (lock) {
            for (List<Subscription> forTopic : subscriptions.values()) {
                if (forTopic.removeIf(s -> s.ticket().equals(ticket))) {
                    return true;
                }
            }
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Publishing
    // ------------------------------------------------------------------

    /**
     * Record the event and deliver it to the topic's handlers and to every
     * wildcard handler, waiting for all of them to complete.
     */
    public Event publish(String topic, Map<String, Object> payload, String sender) {
        Event event = new Event(topic, payload, sender, clock.instant());

        List<EventHandler> targets = new ArrayList<>();
        synchronized (lock) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
            topicCounts.merge(topic, 1L, Long::sum);

            subscriptions.getOrDefault(topic, List.of()).forEach(s -> targets.add(s.handler()));
            if (!Topics.WILDCARD.equals(topic)) {
                subscriptions.getOrDefault(Topics.WILDCARD, List.of()).forEach(s -> targets.add(s.handler()));
            }
        }

        if (targets.isEmpty()) {
            return event;
        }

        List<CompletableFuture<Void>> deliveries = new ArrayList<>(targets.size());
        for (EventHandler handler : targets) {
            try {
                deliveries.add(CompletableFuture.runAsync(() -> deliver(handler, event), dispatcher));
            } catch (RejectedExecutionException e) {
                // Dispatcher shut down: deliver on the caller's thread.
                deliver(handler, event);
            }
        }
        CompletableFuture.allOf(deliveries.toArray(CompletableFuture[]::new)).join();
        return event;
    }

    /**
     * Fire-and-forget variant for callers that cannot wait. Falls back to a
     * synchronous {@link #publish} when the dispatcher refuses new work.
     */
    public void publishAsync(String topic, Map<String, Object> payload, String sender) {
        try {
            dispatcher.execute(() -> publish(topic, payload, sender));
        } catch (RejectedExecutionException e) {
            try {
                publish(topic, payload, sender);
            } catch (RuntimeException inner) {
                log.warn("Synchronous fallback delivery of '{}' failed: {}", topic, inner.getMessage());
            }
        } catch (RuntimeException e) {
            log.warn("Could not schedule delivery of '{}': {}", topic, e.getMessage());
        }
    }

    private void deliver(EventHandler handler, Event event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            log.warn("Handler {} failed on '{}' from {}: {}",
                    handler, event.topic(), event.sender(), e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    /** Most recent events, newest last. */
    public List<Event> recentEvents(int limit) {
        synchronized (lock) {
            int skip = Math.max(0, history.size() - Math.max(0, limit));
            return history.stream().skip(skip).toList();
        }
    }

    /** Number of events published per topic since startup. */
    public Map<String, Long> topicCounts() {
        synchronized (lock) {
            return Map.copyOf(topicCounts);
        }
    }

    public Optional<Event> lastEvent(String topic) {
        synchronized (lock) {
            var it = history.descendingIterator();
            while (it.hasNext()) {
                Event e = it.next();
                if (e.topic().equals(topic)) {
                    return Optional.of(e);
                }
            }
            return Optional.empty();
        }
    }

    public int subscriberCount(String topic) {
        synchronized (lock) {
            return subscriptions.getOrDefault(topic, List.of()).size();
        }
    }

    @PreDestroy
    public void shutdown() {
        dispatcher.shutdown();
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private record Subscription(String ticket, EventHandler handler) {}
}
