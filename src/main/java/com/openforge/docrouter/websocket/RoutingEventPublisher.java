package com.openforge.docrouter.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes {@link RoutingEvent}s to {@code /topic/routing}.
 *
 * Fire-and-forget: a failed delivery is logged and never fails the routing
 * or knowledge write that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutingEventPublisher {

    public static final String TOPIC = "/topic/routing";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(RoutingEvent event) {
        try {
            messagingTemplate.convertAndSend(TOPIC, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event for {}: {}",
                    event.type(), event.reference(), e.getMessage());
        }
    }

    public void publish(EventType type, String reference, Object payload) {
        publish(RoutingEvent.of(type, reference, payload));
    }
}
