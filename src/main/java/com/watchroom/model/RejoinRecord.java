package com.watchroom.model;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reconnection record a client keeps after creating or joining a room.
 * Only records younger than the freshness window may be replayed as a join.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RejoinRecord(
        String roomId,
        String roomName,
        String userName,
        String password,
        String ownerToken,
        Boolean isOwner,
        long timestamp) {

    public boolean isFresh(Instant now, Duration freshnessWindow) {
        return isFresh(timestamp, now, freshnessWindow);
    }

    public static boolean isFresh(long recordTimestamp, Instant now, Duration freshnessWindow) {
        return now.toEpochMilli() - recordTimestamp <= freshnessWindow.toMillis();
    }
}
