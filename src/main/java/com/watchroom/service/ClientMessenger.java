package com.watchroom.service;

import com.watchroom.model.ServerEvent;

/**
 * Outbound side of the transport: delivers one event to one connection.
 * Delivery to a connection that is already gone is a no-op.
 */
public interface ClientMessenger {

    void send(String connectionId, ServerEvent event, Object payload);
}
