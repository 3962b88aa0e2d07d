package com.watchroom.model;

/**
 * A chat line as broadcast to every member of a room.
 * Id and timestamp are assigned by the server; messages are never stored.
 */
public record ChatMessage(
        String id,
        String userId,
        String userName,
        String content,
        ChatKind type,
        long timestamp) {
}
