package com.skillbox.runtime.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A published notification. Immutable once created; the bus keeps only a
 * bounded window of recent events for introspection.
 *
 * @param topic     dotted topic name, see {@link Topics}
 * @param payload   topic-specific fields; values may be null
 * @param sender    component that published the event
 * @param timestamp publication time
 */
public record Event(
        String              topic,
        Map<String, Object> payload,
        String              sender,
        Instant             timestamp) {

    public Event {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
