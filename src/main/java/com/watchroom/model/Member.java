package com.watchroom.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One participant of a room.
 * The id is the membership identity, fixed at join time; connectionId follows the
 * transport connection and only differs from id after an owner reclaimed a record
 * whose old connection was still registered.
 */
public class Member {
    private final String id;
    private String name;
    private final boolean owner;
    private String connectionId;
    private long lastHeartbeat;

    public Member(String id, String connectionId, String name, boolean owner, long lastHeartbeat) {
        this.id = id;
        this.connectionId = connectionId;
        this.name = name;
        this.owner = owner;
        this.lastHeartbeat = lastHeartbeat;
    }

    public String getId() {
        return id;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public void setConnectionId(String connectionId) {
        this.connectionId = connectionId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonProperty("isOwner")
    public boolean isOwner() {
        return owner;
    }

    public long getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void setLastHeartbeat(long lastHeartbeat) {
        this.lastHeartbeat = lastHeartbeat;
    }
}
