package com.watchroom.service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.watchroom.config.WatchRoomProperties;
import com.watchroom.model.Room;

import jakarta.annotation.PreDestroy;

/**
 * Timer-driven room deletion.
 *
 * Two independent mechanisms:
 * - a recurring sweep that expires rooms whose owner stopped sending heartbeats
 * - per-room grace timers armed when a room empties, cancelled when someone rejoins
 *
 * At most one grace timer is armed per room. Arming a room that already has one is a
 * programming error; callers cancel first. A timer that fires consumes its own handle.
 */
@Component
public class CleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CleanupScheduler.class);

    // Room ID -> armed grace timer
    private final Map<String, ArmedTimer> graceTimers = new ConcurrentHashMap<>();
    private final AtomicLong armSequence = new AtomicLong();

    private final RoomRegistry roomRegistry;
    private final TaskTimer taskTimer;
    private final Clock clock;
    private final Duration ownerTimeout;
    private final Duration gracePeriod;

    private volatile RoomExpiryListener expiryListener;

    public CleanupScheduler(RoomRegistry roomRegistry, TaskTimer taskTimer, Clock clock,
                            WatchRoomProperties properties) {
        this.roomRegistry = roomRegistry;
        this.taskTimer = taskTimer;
        this.clock = clock;
        this.ownerTimeout = properties.getCleanup().getOwnerTimeout();
        this.gracePeriod = properties.getCleanup().getGracePeriod();
        logger.info("CleanupScheduler initialized: owner timeout {}, grace period {}", ownerTimeout, gracePeriod);
    }

    public void setExpiryListener(RoomExpiryListener expiryListener) {
        this.expiryListener = expiryListener;
    }

    /**
     * Periodic owner heartbeat check.
     * Catches owners that vanished without a close event and owners whose heartbeats stalled.
     */
    @Scheduled(fixedRateString = "${watchroom.cleanup.sweep-interval:PT30S}")
    public void sweepOwnerTimeouts() {
        RoomExpiryListener listener = expiryListener;
        if (listener == null) {
            return;
        }

        long now = clock.millis();
        int expired = 0;
        for (Room room : roomRegistry.allRooms()) {
            if (now - room.getLastOwnerHeartbeat() > ownerTimeout.toMillis()) {
                logger.info("⏰ Room {} owner heartbeat timed out ({}s silent)",
                        room.getId(), (now - room.getLastOwnerHeartbeat()) / 1000);
                listener.onOwnerTimeout(room.getId());
                expired++;
            }
        }

        if (expired > 0) {
            logger.debug("Sweep expired {} rooms. Active rooms: {}", expired, roomRegistry.roomCount());
        }
    }

    /**
     * Arm the grace timer for an empty room using the configured grace period.
     */
    public void arm(String roomId) {
        arm(roomId, gracePeriod);
    }

    public synchronized void arm(String roomId, Duration delay) {
        if (graceTimers.containsKey(roomId)) {
            throw new IllegalStateException("Grace timer already armed for room " + roomId);
        }

        long sequence = armSequence.incrementAndGet();
        TaskTimer.TimerHandle handle = taskTimer.schedule(() -> fire(roomId, sequence), delay);
        graceTimers.put(roomId, new ArmedTimer(sequence, handle));
        logger.info("⏳ Room {} is empty, deleting in {}s unless someone rejoins", roomId, delay.toSeconds());
    }

    /**
     * Disarm the room's grace timer.
     *
     * @return true if a timer was armed
     */
    public synchronized boolean cancel(String roomId) {
        ArmedTimer armed = graceTimers.remove(roomId);
        if (armed == null) {
            return false;
        }
        armed.handle().cancel();
        logger.info("Cancelled deletion timer for room {}", roomId);
        return true;
    }

    public boolean isArmed(String roomId) {
        return graceTimers.containsKey(roomId);
    }

    public int armedCount() {
        return graceTimers.size();
    }

    private void fire(String roomId, long sequence) {
        synchronized (this) {
            ArmedTimer armed = graceTimers.get(roomId);
            if (armed == null || armed.sequence() != sequence) {
                return;
            }
            graceTimers.remove(roomId);
        }

        RoomExpiryListener listener = expiryListener;
        if (listener != null) {
            logger.info("Room {} deletion timer expired", roomId);
            listener.onGraceExpired(roomId);
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        graceTimers.values().forEach(armed -> armed.handle().cancel());
        graceTimers.clear();
    }

    private record ArmedTimer(long sequence, TaskTimer.TimerHandle handle) {}
}
