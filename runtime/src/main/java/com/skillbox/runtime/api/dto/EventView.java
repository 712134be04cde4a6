package com.skillbox.runtime.api.dto;

import com.skillbox.runtime.event.Event;

import java.time.Instant;
import java.util.Map;

public record EventView(String topic, String sender, Instant timestamp, Map<String, Object> payload) {

    public static EventView from(Event e) {
        return new EventView(e.topic(), e.sender(), e.timestamp(), e.payload());
    }
}
