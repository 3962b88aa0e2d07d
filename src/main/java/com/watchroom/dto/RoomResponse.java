package com.watchroom.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.watchroom.exception.RoomException;
import com.watchroom.model.Member;

/**
 * Acknowledgement of "room:create" and "room:join".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomResponse(
        boolean success,
        RoomView room,
        List<Member> members,
        String error,
        String code) {

    public static RoomResponse created(RoomView room) {
        return new RoomResponse(true, room, null, null, null);
    }

    public static RoomResponse joined(RoomView room, List<Member> members) {
        return new RoomResponse(true, room, members, null, null);
    }

    public static RoomResponse failed(RoomException e) {
        return new RoomResponse(false, null, null, e.getMessage(), e.getCode());
    }

    public static RoomResponse failed(ErrorResponse.ErrorCode errorCode) {
        return new RoomResponse(false, null, null, errorCode.getMessage(), errorCode.getCode());
    }
}
