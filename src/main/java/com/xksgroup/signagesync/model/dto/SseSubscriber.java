package com.xksgroup.signagesync.model.dto;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Set;

@Data
@Builder
public class SseSubscriber {
    private SseEmitter sseEmitter;
    // Empty means every event type
    private Set<String> eventTypes;

    public boolean accepts(String eventType) {
        return eventTypes == null || eventTypes.isEmpty() || eventTypes.contains(eventType);
    }
}
