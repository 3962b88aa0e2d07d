package com.watchroom.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import com.watchroom.config.WatchRoomProperties;

/**
 * Service for room-level secrets.
 * Room passwords are kept as BCrypt hashes; owner tokens are compared in constant time.
 */
@Service
public class RoomSecurityService {

    private static final Logger log = LoggerFactory.getLogger(RoomSecurityService.class);

    private final BCryptPasswordEncoder passwordEncoder;

    public RoomSecurityService(WatchRoomProperties properties) {
        int strength = properties.getSecurity().getBcryptStrength();
        this.passwordEncoder = new BCryptPasswordEncoder(strength);
        log.info("RoomSecurityService initialized with BCrypt strength {}", strength);
    }

    /**
     * Hash a room password. An absent or empty password means the room is open.
     */
    public String hashPassword(String password) {
        if (password == null || password.isEmpty()) {
            return null;
        }
        return passwordEncoder.encode(password);
    }

    /**
     * Check a join attempt against the room's stored hash.
     */
    public boolean verifyPassword(String inputPassword, String storedHash) {
        if (storedHash == null) {
            return true;
        }
        if (inputPassword == null || inputPassword.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(inputPassword, storedHash);
    }

    /**
     * Timing-safe owner token comparison.
     */
    public boolean ownerTokenMatches(String presented, String expected) {
        if (presented == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
