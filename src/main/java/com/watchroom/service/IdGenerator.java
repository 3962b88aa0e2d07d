package com.watchroom.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

import org.springframework.stereotype.Component;

import com.watchroom.config.WatchRoomProperties;

/**
 * Generates room ids, owner tokens and chat message ids.
 */
@Component
public class IdGenerator {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String ROOM_ID_CHARS = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789"; // Avoid confusing chars
    private static final String MESSAGE_SUFFIX_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int MESSAGE_SUFFIX_LENGTH = 7;

    private final int roomIdLength;
    private final int ownerTokenBytes;
    private final Clock clock;

    public IdGenerator(WatchRoomProperties properties, Clock clock) {
        this.roomIdLength = properties.getRoom().getIdLength();
        this.ownerTokenBytes = properties.getRoom().getOwnerTokenBytes();
        this.clock = clock;
    }

    /**
     * Short, human-shareable room id.
     */
    public String roomId() {
        return randomString(ROOM_ID_CHARS, roomIdLength);
    }

    /**
     * Secret handed to a room's creator, used to reclaim ownership after a reconnect.
     */
    public String ownerToken() {
        byte[] bytes = new byte[ownerTokenBytes];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Chat message id: creation millis plus a random suffix.
     */
    public String messageId() {
        return clock.millis() + "-" + randomString(MESSAGE_SUFFIX_CHARS, MESSAGE_SUFFIX_LENGTH);
    }

    private String randomString(String alphabet, int length) {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int index = SECURE_RANDOM.nextInt(alphabet.length());
            code.append(alphabet.charAt(index));
        }
        return code.toString();
    }
}
