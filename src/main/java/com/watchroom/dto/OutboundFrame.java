package com.watchroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Server to client envelope. ackId is only set on acknowledgements.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundFrame(String event, String ackId, Object data) {

    public static OutboundFrame event(String event, Object data) {
        return new OutboundFrame(event, null, data);
    }

    public static OutboundFrame ack(String ackId, Object data) {
        return new OutboundFrame("ack", ackId, data);
    }
}
