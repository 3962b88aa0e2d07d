package com.watchroom.model;

/**
 * One watch session.
 * Members live in the registry's member map; memberCount mirrors its size and is only
 * written back by the registry after a membership change.
 */
public class Room {
    private final String id;
    private final String name;
    private final String description;
    private final String passwordHash;
    private final boolean publicRoom;
    private String ownerName;
    private final String ownerToken;
    private final long createdAt;

    private String ownerId;
    private int memberCount;
    private MediaState currentState;
    private long lastOwnerHeartbeat;
    private long lastChatTimestamp;

    public Room(String id, String name, String description, String passwordHash, boolean publicRoom,
                String ownerId, String ownerName, String ownerToken, long createdAt) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.passwordHash = passwordHash;
        this.publicRoom = publicRoom;
        this.ownerId = ownerId;
        this.ownerName = ownerName;
        this.ownerToken = ownerToken;
        this.createdAt = createdAt;
        this.lastOwnerHeartbeat = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }

    public boolean isPublic() {
        return publicRoom;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public void setOwnerName(String ownerName) {
        this.ownerName = ownerName;
    }

    public String getOwnerToken() {
        return ownerToken;
    }

    public int getMemberCount() {
        return memberCount;
    }

    /**
     * Registry hook: copies the live size of the member map.
     */
    public void syncMemberCount(int liveMemberCount) {
        this.memberCount = liveMemberCount;
    }

    public MediaState getCurrentState() {
        return currentState;
    }

    public void setCurrentState(MediaState currentState) {
        this.currentState = currentState;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastOwnerHeartbeat() {
        return lastOwnerHeartbeat;
    }

    public void setLastOwnerHeartbeat(long lastOwnerHeartbeat) {
        this.lastOwnerHeartbeat = lastOwnerHeartbeat;
    }

    /**
     * Next chat timestamp for this room, never earlier than the previous one.
     */
    public long nextChatTimestamp(long now) {
        lastChatTimestamp = Math.max(now, lastChatTimestamp);
        return lastChatTimestamp;
    }
}
