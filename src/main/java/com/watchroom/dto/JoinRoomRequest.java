package com.watchroom.dto;

import com.watchroom.model.RejoinRecord;
import com.watchroom.validation.MaxUtf8Bytes;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload of "room:join".
 * recordTimestamp is present when the client replays a stored reconnection record.
 */
public class JoinRoomRequest {

    @NotBlank(message = "Room ID is required")
    @Size(max = 64, message = "Room ID must be at most 64 characters")
    private String roomId;

    // BCrypt only reads the first 72 bytes
    @MaxUtf8Bytes(value = 72, message = "Password must be at most 72 bytes")
    private String password;

    @NotBlank(message = "User name is required")
    @Size(max = 32, message = "User name must be at most 32 characters")
    private String userName;

    private String ownerToken;

    private Long recordTimestamp;

    // Default constructor
    public JoinRoomRequest() {}

    public JoinRoomRequest(String roomId, String password, String userName, String ownerToken) {
        this.roomId = roomId;
        this.password = password;
        this.userName = userName;
        this.ownerToken = ownerToken;
    }

    /**
     * Build the join a client sends when it replays a stored reconnection record.
     */
    public static JoinRoomRequest fromRecord(RejoinRecord record) {
        JoinRoomRequest request = new JoinRoomRequest(
                record.roomId(), record.password(), record.userName(), record.ownerToken());
        request.setRecordTimestamp(record.timestamp());
        return request;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }

    public String getOwnerToken() {
        return ownerToken;
    }

    public void setOwnerToken(String ownerToken) {
        this.ownerToken = ownerToken;
    }

    public Long getRecordTimestamp() {
        return recordTimestamp;
    }

    public void setRecordTimestamp(Long recordTimestamp) {
        this.recordTimestamp = recordTimestamp;
    }
}
