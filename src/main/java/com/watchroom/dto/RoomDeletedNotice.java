package com.watchroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of "room:deleted". A null reason is the generic deletion notice.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomDeletedNotice(String reason) {

    public static final String OWNER_LEFT = "owner_left";
    public static final String OWNER_TIMEOUT = "owner_timeout";
}
