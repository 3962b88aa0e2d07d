package com.watchroom.service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.watchroom.config.WatchRoomProperties;
import com.watchroom.dto.ChatRequest;
import com.watchroom.dto.CreateRoomRequest;
import com.watchroom.dto.ErrorResponse.ErrorCode;
import com.watchroom.dto.JoinRoomRequest;
import com.watchroom.dto.RoomDeletedNotice;
import com.watchroom.dto.RoomResponse;
import com.watchroom.dto.RoomView;
import com.watchroom.exception.RoomException;
import com.watchroom.model.ChannelState;
import com.watchroom.model.ChatKind;
import com.watchroom.model.ChatMessage;
import com.watchroom.model.ConnectionBinding;
import com.watchroom.model.MediaState;
import com.watchroom.model.Member;
import com.watchroom.model.PlaybackState;
import com.watchroom.model.RejoinRecord;
import com.watchroom.model.Room;
import com.watchroom.model.ServerEvent;
import com.watchroom.model.SignalType;
import com.watchroom.service.RoomRegistry.MembershipDelta;
import com.watchroom.service.RoomRegistry.RoomSpec;
import com.watchroom.validation.InputValidator;

import jakarta.annotation.PostConstruct;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Handles every client event of the watch room protocol.
 *
 * The sender's room and identity always come from {@link ConnectionIndex}. All state
 * changes, relays and timer callbacks run under this router's monitor, so the registry
 * and the index only ever see one mutation at a time.
 *
 * Request events (create, join, list) return a Mono with the acknowledgement; a rejected
 * request is an unsuccessful acknowledgement, never an error signal. Notify events return
 * nothing and are dropped silently when the sender is not allowed to send them.
 */
@Service
public class RoomEventRouter implements RoomExpiryListener {

    private static final Logger logger = LoggerFactory.getLogger(RoomEventRouter.class);

    private final RoomRegistry roomRegistry;
    private final ConnectionIndex connectionIndex;
    private final CleanupScheduler cleanupScheduler;
    private final RoomSecurityService roomSecurityService;
    private final InputValidator inputValidator;
    private final IdGenerator idGenerator;
    private final ClientMessenger messenger;
    private final Clock clock;
    private final Duration ownerTimeout;
    private final Duration rejoinFreshness;

    public RoomEventRouter(RoomRegistry roomRegistry,
                           ConnectionIndex connectionIndex,
                           CleanupScheduler cleanupScheduler,
                           RoomSecurityService roomSecurityService,
                           InputValidator inputValidator,
                           IdGenerator idGenerator,
                           ClientMessenger messenger,
                           Clock clock,
                           WatchRoomProperties properties) {
        this.roomRegistry = roomRegistry;
        this.connectionIndex = connectionIndex;
        this.cleanupScheduler = cleanupScheduler;
        this.roomSecurityService = roomSecurityService;
        this.inputValidator = inputValidator;
        this.idGenerator = idGenerator;
        this.messenger = messenger;
        this.clock = clock;
        this.ownerTimeout = properties.getCleanup().getOwnerTimeout();
        this.rejoinFreshness = properties.getRejoin().getFreshnessWindow();
    }

    @PostConstruct
    public void init() {
        cleanupScheduler.setExpiryListener(this);
        logger.info("✅ RoomEventRouter initialized and registered for room expiry");
    }

    // ==========================================
    // REQUEST / RESPONSE EVENTS
    // ==========================================

    /**
     * "room:create": open a room owned by this connection.
     */
    public Mono<RoomResponse> createRoom(String connectionId, CreateRoomRequest request) {
        return Mono.fromCallable(() -> {
                    inputValidator.validate(sanitized(request));
                    // Hash outside the monitor, BCrypt is slow on purpose
                    RoomSpec spec = new RoomSpec(
                            request.getName(),
                            request.getDescription() == null ? "" : request.getDescription(),
                            roomSecurityService.hashPassword(request.getPassword()),
                            request.getIsPublic(),
                            request.getUserName());
                    return completeCreate(connectionId, spec);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> Mono.just(rejection("create", connectionId, e)));
    }

    /**
     * "room:join": enter a room, reclaiming ownership when the owner token matches.
     */
    public Mono<RoomResponse> joinRoom(String connectionId, JoinRoomRequest request) {
        return Mono.fromCallable(() -> {
                    inputValidator.validate(sanitized(request));
                    if (request.getRecordTimestamp() != null
                            && !RejoinRecord.isFresh(request.getRecordTimestamp(), clock.instant(), rejoinFreshness)) {
                        throw new RoomException(ErrorCode.ROOM_010, request.getRoomId());
                    }

                    Room room = roomRegistry.get(request.getRoomId())
                            .orElseThrow(() -> new RoomException(ErrorCode.ROOM_001, request.getRoomId()));
                    if (!roomSecurityService.verifyPassword(request.getPassword(), room.getPasswordHash())) {
                        throw new RoomException(ErrorCode.ROOM_003);
                    }
                    return completeJoin(connectionId, request, room);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> Mono.just(rejection("join", connectionId, e)));
    }

    /**
     * "room:list": snapshots of all public rooms. Always succeeds.
     */
    public Mono<List<RoomView>> listRooms() {
        return Mono.fromCallable(() -> roomRegistry.listPublic().stream()
                .map(RoomView::of)
                .toList());
    }

    private synchronized RoomResponse completeCreate(String connectionId, RoomSpec spec) {
        connectionIndex.lookup(connectionId).ifPresent(previous -> depart(connectionId, previous));

        Room room = roomRegistry.create(spec, connectionId);
        connectionIndex.bind(connectionId, new ConnectionBinding(room.getId(), connectionId, spec.ownerName(), true));
        return RoomResponse.created(RoomView.withOwnerToken(room));
    }

    private synchronized RoomResponse completeJoin(String connectionId, JoinRoomRequest request, Room verified) {
        String roomId = verified.getId();
        // The password was checked against this exact instance; it may have been deleted since
        Room room = roomRegistry.get(roomId)
                .filter(current -> current == verified)
                .orElseThrow(() -> new RoomException(ErrorCode.ROOM_001, roomId));

        Optional<ConnectionBinding> current = connectionIndex.lookup(connectionId);
        if (current.isPresent() && current.get().roomId().equals(roomId)) {
            return RoomResponse.joined(RoomView.of(room), roomRegistry.members(roomId));
        }
        current.ifPresent(previous -> depart(connectionId, previous));

        cleanupScheduler.cancel(roomId);

        long now = clock.millis();
        String userName = request.getUserName();
        Member member;
        if (roomSecurityService.ownerTokenMatches(request.getOwnerToken(), room.getOwnerToken())) {
            member = reclaimOwnership(roomId, connectionId, userName, now);
            logger.info("👑 Owner {} reconnected to room {}", member.getName(), roomId);
        } else {
            member = new Member(connectionId, connectionId, userName, false, now);
            roomRegistry.applyMembership(roomId, MembershipDelta.join(member));
        }

        connectionIndex.bind(connectionId,
                new ConnectionBinding(roomId, member.getId(), member.getName(), member.isOwner()));
        sendToRoom(roomId, ServerEvent.MEMBER_JOINED, member, connectionId);

        logger.info("✅ {} joined room {} (members: {})", member.getName(), roomId, room.getMemberCount());
        return RoomResponse.joined(RoomView.of(room), roomRegistry.members(roomId));
    }

    /**
     * Move ownership to a new connection. A still-registered owner record keeps its
     * membership id and follows the new connection; otherwise a fresh owner joins.
     * Either way the owner takes the name sent with the reconnect.
     */
    private Member reclaimOwnership(String roomId, String connectionId, String userName, long now) {
        Optional<Member> previousOwner = roomRegistry.currentOwner(roomId);
        Member member;
        if (previousOwner.isPresent()) {
            String staleConnectionId = previousOwner.get().getConnectionId();
            connectionIndex.unbind(staleConnectionId);
            member = roomRegistry.rebindConnection(roomId, previousOwner.get().getId(), connectionId, userName)
                    .orElseThrow(() -> new IllegalStateException("Owner record vanished in room " + roomId));
        } else {
            member = new Member(connectionId, connectionId, userName, true, now);
            roomRegistry.applyMembership(roomId, MembershipDelta.join(member));
        }
        roomRegistry.reassignOwner(roomId, connectionId, userName);
        return member;
    }

    // Display strings are cleaned before validation so a name of control characters counts as blank
    private CreateRoomRequest sanitized(CreateRoomRequest request) {
        if (request != null) {
            request.setName(inputValidator.sanitize(request.getName()));
            request.setDescription(inputValidator.sanitize(request.getDescription()));
            request.setUserName(inputValidator.sanitize(request.getUserName()));
        }
        return request;
    }

    private JoinRoomRequest sanitized(JoinRoomRequest request) {
        if (request != null) {
            request.setUserName(inputValidator.sanitize(request.getUserName()));
        }
        return request;
    }

    private RoomResponse rejection(String operation, String connectionId, Throwable error) {
        if (error instanceof RoomException roomException) {
            logger.info("Rejected {} from {}: {}", operation, connectionId, roomException.getMessage());
            return RoomResponse.failed(roomException);
        }
        logger.error("Error handling {} from {}", operation, connectionId, error);
        return RoomResponse.failed(ErrorCode.SRV_001);
    }

    // ==========================================
    // LEAVE / DISCONNECT
    // ==========================================

    /**
     * "room:leave": explicit departure.
     */
    public synchronized void leaveRoom(String connectionId) {
        connectionIndex.lookup(connectionId).ifPresent(binding -> depart(connectionId, binding));
    }

    /**
     * Transport closed: same as leaving.
     */
    public synchronized void disconnect(String connectionId) {
        connectionIndex.lookup(connectionId).ifPresent(binding -> {
            logger.info("🚪 Connection {} lost while in room {}", connectionId, binding.roomId());
            depart(connectionId, binding);
        });
    }

    private void depart(String connectionId, ConnectionBinding binding) {
        connectionIndex.unbind(connectionId);
        String roomId = binding.roomId();
        if (roomRegistry.get(roomId).isEmpty()) {
            return;
        }

        if (binding.owner()) {
            logger.info("Owner left room {}, disbanding", roomId);
            removeRoom(roomId, new RoomDeletedNotice(RoomDeletedNotice.OWNER_LEFT), connectionId);
            return;
        }

        roomRegistry.applyMembership(roomId, MembershipDelta.leave(binding.userId()));
        if (roomRegistry.members(roomId).isEmpty()) {
            cleanupScheduler.arm(roomId);
        } else {
            sendToRoom(roomId, ServerEvent.MEMBER_LEFT, binding.userId(), null);
            logger.info("👋 {} left room {} (remaining: {})", binding.userName(), roomId,
                    roomRegistry.members(roomId).size());
        }
    }

    /**
     * Notify, evict and delete. The departing connection, if any, gets no notice.
     */
    private void removeRoom(String roomId, RoomDeletedNotice notice, String departingConnectionId) {
        for (Member member : roomRegistry.members(roomId)) {
            String memberConnectionId = member.getConnectionId();
            if (memberConnectionId.equals(departingConnectionId)) {
                continue;
            }
            messenger.send(memberConnectionId, ServerEvent.ROOM_DELETED, notice);
            connectionIndex.lookup(memberConnectionId)
                    .filter(binding -> binding.roomId().equals(roomId))
                    .ifPresent(binding -> connectionIndex.unbind(memberConnectionId));
        }
        cleanupScheduler.cancel(roomId);
        roomRegistry.delete(roomId);
    }

    // ==========================================
    // TIMER CALLBACKS
    // ==========================================

    @Override
    public synchronized void onGraceExpired(String roomId) {
        if (roomRegistry.get(roomId).isPresent() && roomRegistry.members(roomId).isEmpty()) {
            removeRoom(roomId, new RoomDeletedNotice(null), null);
        }
    }

    @Override
    public synchronized void onOwnerTimeout(String roomId) {
        roomRegistry.get(roomId)
                .filter(room -> clock.millis() - room.getLastOwnerHeartbeat() > ownerTimeout.toMillis())
                .ifPresent(room -> removeRoom(roomId, new RoomDeletedNotice(RoomDeletedNotice.OWNER_TIMEOUT), null));
    }

    // ==========================================
    // PLAYBACK RELAY
    // ==========================================

    /**
     * "play:update": owner's position report, stored and relayed.
     */
    public synchronized void playUpdate(String connectionId, PlaybackState state) {
        relayOwnerState(connectionId, ServerEvent.PLAY_UPDATE, state);
    }

    /**
     * "play:change": owner switched video or episode.
     */
    public synchronized void playChange(String connectionId, PlaybackState state) {
        relayOwnerState(connectionId, ServerEvent.PLAY_CHANGE, state);
    }

    /**
     * "live:change": owner switched live channel.
     */
    public synchronized void liveChange(String connectionId, ChannelState state) {
        relayOwnerState(connectionId, ServerEvent.LIVE_CHANGE, state);
    }

    // Transport commands are relayed from any member, not only the owner
    public synchronized void playSeek(String connectionId, double currentTime) {
        boundSender(connectionId).ifPresent(binding ->
                sendToRoom(binding.roomId(), ServerEvent.PLAY_SEEK, currentTime, connectionId));
    }

    public synchronized void playPlay(String connectionId) {
        boundSender(connectionId).ifPresent(binding ->
                sendToRoom(binding.roomId(), ServerEvent.PLAY_PLAY, null, connectionId));
    }

    public synchronized void playPause(String connectionId) {
        boundSender(connectionId).ifPresent(binding ->
                sendToRoom(binding.roomId(), ServerEvent.PLAY_PAUSE, null, connectionId));
    }

    private void relayOwnerState(String connectionId, ServerEvent event, MediaState state) {
        Optional<ConnectionBinding> sender = boundSender(connectionId);
        if (sender.isEmpty() || state == null) {
            return;
        }
        if (!sender.get().owner()) {
            logger.debug("Dropped {} from non-owner {}: {}", event.getWireName(), connectionId,
                    ErrorCode.AUTH_006.getMessage());
            return;
        }
        roomRegistry.setState(sender.get().roomId(), state);
        sendToRoom(sender.get().roomId(), event, state, connectionId);
    }

    // ==========================================
    // CHAT, SIGNALING, HEARTBEAT
    // ==========================================

    /**
     * "chat:message": stamp and broadcast to the whole room, sender included.
     */
    public synchronized void chatMessage(String connectionId, ChatRequest request) {
        Optional<ConnectionBinding> sender = boundSender(connectionId);
        if (sender.isEmpty() || request == null || !inputValidator.isValidChatContent(request.getContent())) {
            return;
        }

        ConnectionBinding binding = sender.get();
        Room room = roomRegistry.get(binding.roomId()).orElseThrow();
        ChatMessage message = new ChatMessage(
                idGenerator.messageId(),
                binding.userId(),
                binding.userName(),
                request.getContent(),
                request.getType() == null ? ChatKind.TEXT : request.getType(),
                room.nextChatTimestamp(clock.millis()));
        sendToRoom(binding.roomId(), ServerEvent.CHAT_MESSAGE, message, null);
    }

    /**
     * Voice signaling: forward the payload to one member of the sender's room.
     * The target may be named by membership id or by connection id.
     */
    public synchronized void relaySignal(String connectionId, SignalType type, String targetUserId, JsonNode payload) {
        Optional<ConnectionBinding> sender = boundSender(connectionId);
        if (sender.isEmpty() || targetUserId == null) {
            return;
        }

        Optional<Member> target = roomRegistry.members(sender.get().roomId()).stream()
                .filter(member -> targetUserId.equals(member.getId()) || targetUserId.equals(member.getConnectionId()))
                .findFirst();
        if (target.isEmpty()) {
            logger.debug("Dropped {} to {}: not in room {}", type, targetUserId, sender.get().roomId());
            return;
        }

        Map<String, Object> relay = new LinkedHashMap<>();
        relay.put("userId", sender.get().userId());
        relay.put(type.getPayloadField(), payload);
        messenger.send(target.get().getConnectionId(), ServerEvent.forSignal(type), relay);
    }

    /**
     * "heartbeat": keeps the member, and the room if sent by its owner, alive.
     */
    public synchronized void heartbeat(String connectionId) {
        boundSender(connectionId).ifPresent(binding ->
                roomRegistry.recordHeartbeat(binding.roomId(), binding.userId(), binding.owner()));
    }

    // ==========================================
    // HELPERS
    // ==========================================

    private Optional<ConnectionBinding> boundSender(String connectionId) {
        return connectionIndex.lookup(connectionId)
                .filter(binding -> roomRegistry.get(binding.roomId()).isPresent());
    }

    /**
     * Send to every member of the room except the given connection (null for everyone).
     */
    private void sendToRoom(String roomId, ServerEvent event, Object payload, String exceptConnectionId) {
        for (Member member : roomRegistry.members(roomId)) {
            if (!member.getConnectionId().equals(exceptConnectionId)) {
                messenger.send(member.getConnectionId(), event, payload);
            }
        }
    }
}
