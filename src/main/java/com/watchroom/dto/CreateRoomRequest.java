package com.watchroom.dto;

import com.watchroom.validation.MaxUtf8Bytes;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload of "room:create".
 */
public class CreateRoomRequest {

    @NotBlank(message = "Room name is required")
    @Size(max = 64, message = "Room name must be at most 64 characters")
    private String name;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    // BCrypt only reads the first 72 bytes
    @MaxUtf8Bytes(value = 72, message = "Password must be at most 72 bytes")
    private String password;

    private boolean isPublic;

    @NotBlank(message = "User name is required")
    @Size(max = 32, message = "User name must be at most 32 characters")
    private String userName;

    // Default constructor
    public CreateRoomRequest() {}

    public CreateRoomRequest(String name, String description, String password, boolean isPublic, String userName) {
        this.name = name;
        this.description = description;
        this.password = password;
        this.isPublic = isPublic;
        this.userName = userName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean getIsPublic() {
        return isPublic;
    }

    public void setIsPublic(boolean isPublic) {
        this.isPublic = isPublic;
    }

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }
}
