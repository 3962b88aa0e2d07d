package com.watchroom.handler;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.watchroom.dto.ChatRequest;
import com.watchroom.dto.CreateRoomRequest;
import com.watchroom.dto.ErrorResponse;
import com.watchroom.dto.ErrorResponse.ErrorCode;
import com.watchroom.dto.JoinRoomRequest;
import com.watchroom.dto.RoomResponse;
import com.watchroom.model.ChannelState;
import com.watchroom.model.ClientEvent;
import com.watchroom.model.MediaState;
import com.watchroom.model.PlaybackState;
import com.watchroom.model.ServerEvent;
import com.watchroom.model.SignalType;
import com.watchroom.service.RoomEventRouter;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive WebSocket handler for watch rooms.
 *
 * Every text frame is a JSON envelope {"event", "ackId", "data"}. Request events are
 * answered with an "ack" frame carrying the same ackId; notify events get no reply.
 * Frames of one connection are handled strictly in arrival order.
 */
@Component
public class WatchRoomWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(WatchRoomWebSocketHandler.class);

    private final RoomEventRouter router;
    private final ConnectionSinks connectionSinks;
    private final ObjectMapper objectMapper;

    public WatchRoomWebSocketHandler(RoomEventRouter router, ConnectionSinks connectionSinks,
                                     ObjectMapper objectMapper) {
        this.router = router;
        this.connectionSinks = connectionSinks;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = session.getId();
        logger.info("🔌 New watch room connection: {}", connectionId);

        Flux<String> outbound = connectionSinks.open(connectionId);
        connectionSinks.send(connectionId, ServerEvent.CONNECTED, Map.of("connectionId", connectionId));

        Mono<Void> input = session.receive()
            .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
            .map(WebSocketMessage::getPayloadAsText)
            .concatMap(frame -> dispatch(connectionId, frame))
            .doOnError(error -> logger.error("❌ Error receiving from {}: {}", connectionId, error.getMessage()))
            .doFinally(signalType -> handleDisconnect(connectionId))
            .then();

        Mono<Void> output = session.send(outbound.map(session::textMessage));

        // Both directions must finish; closing the input completes the outbound sink
        return Mono.when(input, output);
    }

    /**
     * Parse one inbound frame and route it. Completes once any acknowledgement is queued.
     */
    Mono<Void> dispatch(String connectionId, String frame) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            logger.debug("Malformed frame from {}: {}", connectionId, e.getOriginalMessage());
            connectionSinks.sendError(connectionId, ErrorResponse.of(ErrorCode.VAL_001, "Malformed JSON frame"));
            return Mono.empty();
        }
        if (envelope == null || !envelope.isObject()) {
            connectionSinks.sendError(connectionId, ErrorResponse.of(ErrorCode.VAL_001, "Frame must be a JSON object"));
            return Mono.empty();
        }

        String eventName = envelope.path("event").asText(null);
        Optional<ClientEvent> event = ClientEvent.fromWireName(eventName);
        if (event.isEmpty()) {
            connectionSinks.sendError(connectionId, ErrorResponse.of(ErrorCode.VAL_005, String.valueOf(eventName)));
            return Mono.empty();
        }

        JsonNode data = envelope.path("data");
        logger.debug("📨 {} from {}", eventName, connectionId);

        if (event.get().getCategory() == ClientEvent.Category.NOTIFY) {
            handleNotify(connectionId, event.get(), data);
            return Mono.empty();
        }

        String ackId = envelope.hasNonNull("ackId") ? envelope.get("ackId").asText() : null;
        if (ackId == null) {
            connectionSinks.sendError(connectionId, ErrorResponse.of(ErrorCode.VAL_002, "ackId"));
            return Mono.empty();
        }

        return handleRequest(connectionId, event.get(), data)
            .cast(Object.class)
            .doOnNext(response -> connectionSinks.sendAck(connectionId, ackId, response))
            .onErrorResume(error -> {
                logger.error("Error answering {} from {}", eventName, connectionId, error);
                connectionSinks.sendError(connectionId, ErrorResponse.of(ErrorCode.SRV_001));
                return Mono.empty();
            })
            .then();
    }

    private Mono<?> handleRequest(String connectionId, ClientEvent event, JsonNode data) {
        switch (event) {
            case ROOM_CREATE -> {
                CreateRoomRequest request;
                try {
                    request = readData(data, CreateRoomRequest.class);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    return Mono.just(RoomResponse.failed(ErrorCode.VAL_001));
                }
                return router.createRoom(connectionId, request);
            }
            case ROOM_JOIN -> {
                JoinRoomRequest request;
                try {
                    request = readData(data, JoinRoomRequest.class);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    return Mono.just(RoomResponse.failed(ErrorCode.VAL_001));
                }
                return router.joinRoom(connectionId, request);
            }
            case ROOM_LIST -> {
                return router.listRooms();
            }
            default -> throw new IllegalArgumentException("Not a request event: " + event);
        }
    }

    private void handleNotify(String connectionId, ClientEvent event, JsonNode data) {
        try {
            switch (event) {
                case ROOM_LEAVE -> router.leaveRoom(connectionId);
                case PLAY_UPDATE -> router.playUpdate(connectionId, readState(data, PlaybackState.class, PlaybackState.TYPE));
                case PLAY_CHANGE -> router.playChange(connectionId, readState(data, PlaybackState.class, PlaybackState.TYPE));
                case LIVE_CHANGE -> router.liveChange(connectionId, readState(data, ChannelState.class, ChannelState.TYPE));
                case PLAY_SEEK -> handleSeek(connectionId, data);
                case PLAY_PLAY -> router.playPlay(connectionId);
                case PLAY_PAUSE -> router.playPause(connectionId);
                case CHAT_MESSAGE -> router.chatMessage(connectionId, readData(data, ChatRequest.class));
                case VOICE_OFFER -> handleSignal(connectionId, SignalType.OFFER, data);
                case VOICE_ANSWER -> handleSignal(connectionId, SignalType.ANSWER, data);
                case VOICE_ICE -> handleSignal(connectionId, SignalType.ICE_CANDIDATE, data);
                case HEARTBEAT -> router.heartbeat(connectionId);
                default -> logger.debug("Ignoring {} as notify event", event);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("Dropped {} from {}: {}", event.getWireName(), connectionId, e.getMessage());
        }
    }

    // Seek carries either a bare number or {"currentTime": n}
    private void handleSeek(String connectionId, JsonNode data) {
        JsonNode position = data.isNumber() ? data : data.path("currentTime");
        if (!position.isNumber()) {
            logger.debug("Dropped play:seek from {} without a position", connectionId);
            return;
        }
        router.playSeek(connectionId, position.asDouble());
    }

    private void handleSignal(String connectionId, SignalType type, JsonNode data) {
        String targetUserId = data.path("targetUserId").asText(null);
        router.relaySignal(connectionId, type, targetUserId, data.get(type.getPayloadField()));
    }

    // States are tagged by "type"; an untagged state is taken to be the kind the event implies
    private <T extends MediaState> T readState(JsonNode data, Class<T> type, String tag) throws JsonProcessingException {
        if (data instanceof ObjectNode node && !node.has("type")) {
            node.put("type", tag);
        }
        MediaState state = readData(data, MediaState.class);
        if (state != null && !type.isInstance(state)) {
            throw new IllegalArgumentException("Expected " + tag + " state, got " + state.type());
        }
        return type.cast(state);
    }

    private <T> T readData(JsonNode data, Class<T> type) throws JsonProcessingException {
        if (data == null || data.isMissingNode() || data.isNull()) {
            return null;
        }
        return objectMapper.treeToValue(data, type);
    }

    private void handleDisconnect(String connectionId) {
        logger.info("🔌 Watch room connection closed: {}", connectionId);
        router.disconnect(connectionId);
        connectionSinks.close(connectionId);
    }
}
