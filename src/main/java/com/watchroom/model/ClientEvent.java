package com.watchroom.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Events clients send, with their wire names and delivery category.
 * REQUEST events carry an ackId and always get exactly one acknowledgement;
 * NOTIFY events are fire-and-forget and are silently dropped when not allowed.
 */
public enum ClientEvent {
    ROOM_CREATE("room:create", Category.REQUEST),
    ROOM_JOIN("room:join", Category.REQUEST),
    ROOM_LIST("room:list", Category.REQUEST),
    ROOM_LEAVE("room:leave", Category.NOTIFY),
    PLAY_UPDATE("play:update", Category.NOTIFY),
    PLAY_SEEK("play:seek", Category.NOTIFY),
    PLAY_PLAY("play:play", Category.NOTIFY),
    PLAY_PAUSE("play:pause", Category.NOTIFY),
    PLAY_CHANGE("play:change", Category.NOTIFY),
    LIVE_CHANGE("live:change", Category.NOTIFY),
    CHAT_MESSAGE("chat:message", Category.NOTIFY),
    VOICE_OFFER("voice:offer", Category.NOTIFY),
    VOICE_ANSWER("voice:answer", Category.NOTIFY),
    VOICE_ICE("voice:ice", Category.NOTIFY),
    HEARTBEAT("heartbeat", Category.NOTIFY);

    public enum Category {
        REQUEST,
        NOTIFY
    }

    private static final Map<String, ClientEvent> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(ClientEvent::getWireName, Function.identity()));

    private final String wireName;
    private final Category category;

    ClientEvent(String wireName, Category category) {
        this.wireName = wireName;
        this.category = category;
    }

    public String getWireName() {
        return wireName;
    }

    public Category getCategory() {
        return category;
    }

    public static Optional<ClientEvent> fromWireName(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }
}
