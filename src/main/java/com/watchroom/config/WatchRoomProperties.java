package com.watchroom.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for watch room coordination
 * Binds to watchroom.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "watchroom")
public class WatchRoomProperties {

    private String endpoint = "/watch-room";
    private CleanupSettings cleanup = new CleanupSettings();
    private RejoinSettings rejoin = new RejoinSettings();
    private ChatSettings chat = new ChatSettings();
    private RoomSettings room = new RoomSettings();
    private SecuritySettings security = new SecuritySettings();

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public CleanupSettings getCleanup() {
        return cleanup;
    }

    public void setCleanup(CleanupSettings cleanup) {
        this.cleanup = cleanup;
    }

    public RejoinSettings getRejoin() {
        return rejoin;
    }

    public void setRejoin(RejoinSettings rejoin) {
        this.rejoin = rejoin;
    }

    public ChatSettings getChat() {
        return chat;
    }

    public void setChat(ChatSettings chat) {
        this.chat = chat;
    }

    public RoomSettings getRoom() {
        return room;
    }

    public void setRoom(RoomSettings room) {
        this.room = room;
    }

    public SecuritySettings getSecurity() {
        return security;
    }

    public void setSecurity(SecuritySettings security) {
        this.security = security;
    }

    // Inner classes for nested properties
    public static class CleanupSettings {
        private Duration ownerTimeout = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(30);
        private Duration gracePeriod = Duration.ofSeconds(30);

        public Duration getOwnerTimeout() {
            return ownerTimeout;
        }

        public void setOwnerTimeout(Duration ownerTimeout) {
            this.ownerTimeout = ownerTimeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getGracePeriod() {
            return gracePeriod;
        }

        public void setGracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
        }
    }

    public static class RejoinSettings {
        private Duration freshnessWindow = Duration.ofHours(24);

        public Duration getFreshnessWindow() {
            return freshnessWindow;
        }

        public void setFreshnessWindow(Duration freshnessWindow) {
            this.freshnessWindow = freshnessWindow;
        }
    }

    public static class ChatSettings {
        private int maxLength = 1000;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }

    public static class RoomSettings {
        private int idLength = 6;
        private int ownerTokenBytes = 18;

        public int getIdLength() {
            return idLength;
        }

        public void setIdLength(int idLength) {
            this.idLength = idLength;
        }

        public int getOwnerTokenBytes() {
            return ownerTokenBytes;
        }

        public void setOwnerTokenBytes(int ownerTokenBytes) {
            this.ownerTokenBytes = ownerTokenBytes;
        }
    }

    public static class SecuritySettings {
        private int bcryptStrength = 10;
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public int getBcryptStrength() {
            return bcryptStrength;
        }

        public void setBcryptStrength(int bcryptStrength) {
            this.bcryptStrength = bcryptStrength;
        }

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
