package com.openforge.docrouter.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope pushed to STOMP subscribers.
 *
 *   type      - discriminator for the client
 *   reference - the thing the event is about (filename, conflict id, collection)
 *   payload   - structured detail, may be null
 *   timestamp - epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingEvent(
        EventType type,
        String    reference,
        Object    payload,
        long      timestamp
) {

    public static RoutingEvent of(EventType type, String reference, Object payload) {
        return new RoutingEvent(type, reference, payload, System.currentTimeMillis());
    }
}
