package com.watchroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Standardized error payload.
 * Sent as the data of an "error" frame when a frame cannot be dispatched at all.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;

    // Default constructor
    public ErrorResponse() {}

    // Constructor with code and message
    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    /**
     * Stamp the response with the current time of the given clock.
     */
    public ErrorResponse at(Clock clock) {
        this.timestamp = LocalDateTime.now(clock);
        return this;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Authorization errors (AUTH_XXX)
        AUTH_006("AUTH_006", "Unauthorized access"),

        // Room errors (ROOM_XXX)
        ROOM_001("ROOM_001", "Room not found"),
        ROOM_003("ROOM_003", "Invalid room password"),
        ROOM_010("ROOM_010", "Reconnection record expired"),

        // Validation errors (VAL_XXX)
        VAL_001("VAL_001", "Invalid input"),
        VAL_002("VAL_002", "Missing required field"),
        VAL_003("VAL_003", "Field too long"),
        VAL_005("VAL_005", "Unknown event"),

        // Server errors (SRV_XXX)
        SRV_001("SRV_001", "Internal server error");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    // Getters and Setters
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }
}
