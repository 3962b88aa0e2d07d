package com.watchroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.watchroom.model.MediaState;
import com.watchroom.model.Room;

/**
 * Outbound snapshot of a room.
 * The owner token is only filled in for the create-room reply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomView(
        String id,
        String name,
        String description,
        boolean hasPassword,
        @JsonProperty("isPublic") boolean isPublic,
        String ownerId,
        String ownerName,
        String ownerToken,
        int memberCount,
        MediaState currentState,
        long createdAt,
        long lastOwnerHeartbeat) {

    public static RoomView of(Room room) {
        return of(room, false);
    }

    public static RoomView withOwnerToken(Room room) {
        return of(room, true);
    }

    private static RoomView of(Room room, boolean includeOwnerToken) {
        return new RoomView(
                room.getId(),
                room.getName(),
                room.getDescription(),
                room.hasPassword(),
                room.isPublic(),
                room.getOwnerId(),
                room.getOwnerName(),
                includeOwnerToken ? room.getOwnerToken() : null,
                room.getMemberCount(),
                room.getCurrentState(),
                room.getCreatedAt(),
                room.getLastOwnerHeartbeat());
    }
}
