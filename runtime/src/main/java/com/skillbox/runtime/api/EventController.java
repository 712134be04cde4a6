package com.skillbox.runtime.api;

import com.skillbox.runtime.api.dto.EventView;
import com.skillbox.runtime.event.EventBus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Read-only window on the event bus history. */
@RestController
@RequestMapping("/events")
public class EventController {

    private final EventBus eventBus;

    public EventController(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @GetMapping
    public List<EventView> recent(@RequestParam(defaultValue = "50") int limit) {
        return eventBus.recentEvents(limit).stream().map(EventView::from).toList();
    }

    @GetMapping("/stats")
    public Map<String, Long> stats() {
        return eventBus.topicCounts();
    }
}
