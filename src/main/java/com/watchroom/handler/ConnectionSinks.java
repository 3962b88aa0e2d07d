package com.watchroom.handler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchroom.dto.ErrorResponse;
import com.watchroom.dto.OutboundFrame;
import com.watchroom.model.ServerEvent;
import com.watchroom.service.ClientMessenger;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Outbound text frames per connection.
 * Each open connection owns a buffered sink; the WebSocket session drains it.
 */
@Component
public class ConnectionSinks implements ClientMessenger {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSinks.class);
    private static final int BUFFER_SIZE = 1024;

    // Connection ID -> outbound sink
    private final Map<String, Sinks.Many<String>> sinks = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConnectionSinks(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Register a connection and return the stream of frames to write to it.
     */
    public Flux<String> open(String connectionId) {
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(BUFFER_SIZE);
        sinks.put(connectionId, sink);
        return sink.asFlux();
    }

    public void close(String connectionId) {
        Sinks.Many<String> sink = sinks.remove(connectionId);
        if (sink != null) {
            sink.tryEmitComplete();
        }
    }

    @Override
    public void send(String connectionId, ServerEvent event, Object payload) {
        emit(connectionId, OutboundFrame.event(event.getWireName(), payload));
    }

    public void sendAck(String connectionId, String ackId, Object payload) {
        emit(connectionId, OutboundFrame.ack(ackId, payload));
    }

    public void sendError(String connectionId, ErrorResponse error) {
        emit(connectionId, OutboundFrame.event(ServerEvent.ERROR.getWireName(), error.at(clock)));
    }

    public boolean isOpen(String connectionId) {
        return sinks.containsKey(connectionId);
    }

    public int size() {
        return sinks.size();
    }

    private void emit(String connectionId, OutboundFrame frame) {
        Sinks.Many<String> sink = sinks.get(connectionId);
        if (sink == null) {
            logger.debug("No sink for connection {}, dropping {}", connectionId, frame.event());
            return;
        }

        String text;
        try {
            text = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} for {}: {}", frame.event(), connectionId, e.getMessage());
            return;
        }

        // Sinks reject concurrent emitters; timers and other connections both send here
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(text);
        }
        if (result.isFailure()) {
            logger.warn("Failed to emit {} to {}: {}", frame.event(), connectionId, result);
        }
    }
}
