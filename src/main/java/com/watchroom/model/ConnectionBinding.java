package com.watchroom.model;

/**
 * What a live connection currently represents: its room, its membership identity and its role.
 */
public record ConnectionBinding(String roomId, String userId, String userName, boolean owner) {
}
