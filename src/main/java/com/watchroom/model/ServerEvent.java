package com.watchroom.model;

/**
 * Events the server pushes to clients, with their wire names.
 */
public enum ServerEvent {
    CONNECTED("connected"),
    ACK("ack"),
    ERROR("error"),
    MEMBER_JOINED("room:member-joined"),
    MEMBER_LEFT("room:member-left"),
    ROOM_DELETED("room:deleted"),
    PLAY_UPDATE("play:update"),
    PLAY_SEEK("play:seek"),
    PLAY_PLAY("play:play"),
    PLAY_PAUSE("play:pause"),
    PLAY_CHANGE("play:change"),
    LIVE_CHANGE("live:change"),
    CHAT_MESSAGE("chat:message"),
    VOICE_OFFER("voice:offer"),
    VOICE_ANSWER("voice:answer"),
    VOICE_ICE("voice:ice");

    private final String wireName;

    ServerEvent(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ServerEvent forSignal(SignalType type) {
        return switch (type) {
            case OFFER -> VOICE_OFFER;
            case ANSWER -> VOICE_ANSWER;
            case ICE_CANDIDATE -> VOICE_ICE;
        };
    }
}
