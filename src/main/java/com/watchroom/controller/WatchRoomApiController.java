package com.watchroom.controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.watchroom.dto.ErrorResponse;
import com.watchroom.dto.RoomView;
import com.watchroom.handler.ConnectionSinks;
import com.watchroom.service.CleanupScheduler;
import com.watchroom.service.RoomEventRouter;
import com.watchroom.service.RoomRegistry;

import reactor.core.publisher.Mono;

/**
 * Read-only REST view of the watch room server.
 */
@RestController
@RequestMapping("/api/watch-room")
public class WatchRoomApiController {

    private static final Logger logger = LoggerFactory.getLogger(WatchRoomApiController.class);

    private final RoomEventRouter router;
    private final RoomRegistry roomRegistry;
    private final ConnectionSinks connectionSinks;
    private final CleanupScheduler cleanupScheduler;
    private final Clock clock;

    public WatchRoomApiController(RoomEventRouter router, RoomRegistry roomRegistry,
                                  ConnectionSinks connectionSinks, CleanupScheduler cleanupScheduler,
                                  Clock clock) {
        this.router = router;
        this.roomRegistry = roomRegistry;
        this.connectionSinks = connectionSinks;
        this.cleanupScheduler = cleanupScheduler;
        this.clock = clock;
    }

    /**
     * Public rooms, same snapshots as the "room:list" event.
     */
    @GetMapping("/rooms")
    public Mono<List<RoomView>> listRooms() {
        return router.listRooms();
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("rooms", roomRegistry.roomCount());
        status.put("members", roomRegistry.memberTotal());
        status.put("connections", connectionSinks.size());
        status.put("pendingDeletions", cleanupScheduler.armedCount());
        status.put("serverTime", clock.millis());
        return ResponseEntity.ok(status);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        logger.error("Unhandled exception in WatchRoomApiController", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorResponse.ErrorCode.SRV_001).at(clock));
    }
}
