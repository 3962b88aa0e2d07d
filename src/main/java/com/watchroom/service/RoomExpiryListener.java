package com.watchroom.service;

/**
 * Receives the room deletions decided by {@link CleanupScheduler}.
 * Implementations must re-check the room under their own lock: the condition may have
 * changed between the timer firing and the call.
 */
public interface RoomExpiryListener {

    void onGraceExpired(String roomId);

    void onOwnerTimeout(String roomId);
}
