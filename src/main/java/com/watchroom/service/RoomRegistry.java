package com.watchroom.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.watchroom.model.MediaState;
import com.watchroom.model.Member;
import com.watchroom.model.Room;

/**
 * Owns every live room and its member map.
 * Each mutator recomputes memberCount from the member map and re-checks the room's
 * invariants before returning.
 */
@Service
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);
    private static final int MAX_ID_ATTEMPTS = 16;

    // Room ID -> Room
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    // Room ID -> (member ID -> Member), in join order
    private final Map<String, Map<String, Member>> members = new ConcurrentHashMap<>();

    private final IdGenerator idGenerator;
    private final Clock clock;

    public RoomRegistry(IdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Create a room with its creator as the only, owning member.
     */
    public synchronized Room create(RoomSpec spec, String creatorConnectionId) {
        String roomId = freshRoomId();
        long now = clock.millis();

        Room room = new Room(roomId, spec.name(), spec.description(), spec.passwordHash(), spec.isPublic(),
                creatorConnectionId, spec.ownerName(), idGenerator.ownerToken(), now);
        Map<String, Member> roomMembers = new LinkedHashMap<>();
        roomMembers.put(creatorConnectionId,
                new Member(creatorConnectionId, creatorConnectionId, spec.ownerName(), true, now));

        rooms.put(roomId, room);
        members.put(roomId, roomMembers);
        recount(room, roomMembers);

        logger.info("🎬 Room created: {} ({}) by {}", roomId, spec.name(), spec.ownerName());
        return room;
    }

    public Optional<Room> get(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * Rooms visible in listings, oldest first.
     */
    public synchronized List<Room> listPublic() {
        return rooms.values().stream()
                .filter(Room::isPublic)
                .sorted(Comparator.comparingLong(Room::getCreatedAt))
                .toList();
    }

    /**
     * Add, replace or remove one member. Returns the room, or empty if it no longer exists.
     */
    public synchronized Optional<Room> applyMembership(String roomId, MembershipDelta delta) {
        Room room = rooms.get(roomId);
        Map<String, Member> roomMembers = members.get(roomId);
        if (room == null || roomMembers == null) {
            return Optional.empty();
        }

        if (delta.joining() != null) {
            roomMembers.put(delta.joining().getId(), delta.joining());
        } else {
            roomMembers.remove(delta.leavingMemberId());
        }
        recount(room, roomMembers);
        return Optional.of(room);
    }

    /**
     * Point an existing member record at a new transport connection under the given name.
     */
    public synchronized Optional<Member> rebindConnection(String roomId, String memberId, String connectionId,
                                                          String name) {
        Map<String, Member> roomMembers = members.get(roomId);
        if (roomMembers == null || !roomMembers.containsKey(memberId)) {
            return Optional.empty();
        }
        Member member = roomMembers.get(memberId);
        member.setConnectionId(connectionId);
        member.setName(name);
        member.setLastHeartbeat(clock.millis());
        return Optional.of(member);
    }

    /**
     * Hand room ownership to the given connection and restart the owner heartbeat clock.
     */
    public synchronized Optional<Room> reassignOwner(String roomId, String ownerConnectionId, String ownerName) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return Optional.empty();
        }
        room.setOwnerId(ownerConnectionId);
        room.setOwnerName(ownerName);
        room.setLastOwnerHeartbeat(clock.millis());
        recount(room, members.get(roomId));
        return Optional.of(room);
    }

    public synchronized Optional<Room> setState(String roomId, MediaState state) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return Optional.empty();
        }
        room.setCurrentState(state);
        return Optional.of(room);
    }

    /**
     * Refresh a member's heartbeat, and the room's owner heartbeat when the sender owns it.
     */
    public synchronized void recordHeartbeat(String roomId, String memberId, boolean owner) {
        long now = clock.millis();
        Map<String, Member> roomMembers = members.get(roomId);
        if (roomMembers != null) {
            Member member = roomMembers.get(memberId);
            if (member != null) {
                member.setLastHeartbeat(now);
            }
        }
        if (owner) {
            Room room = rooms.get(roomId);
            if (room != null) {
                room.setLastOwnerHeartbeat(now);
            }
        }
    }

    /**
     * Remove a room and its member map. Returns the removed room, if there was one.
     */
    public synchronized Optional<Room> delete(String roomId) {
        Room room = rooms.remove(roomId);
        members.remove(roomId);
        if (room != null) {
            logger.info("🗑️ Room deleted: {} (had {} members)", roomId, room.getMemberCount());
        }
        return Optional.ofNullable(room);
    }

    /**
     * Snapshot of the room's members in join order; empty for unknown rooms.
     */
    public synchronized List<Member> members(String roomId) {
        Map<String, Member> roomMembers = members.get(roomId);
        return roomMembers == null ? List.of() : new ArrayList<>(roomMembers.values());
    }

    public synchronized Optional<Member> member(String roomId, String memberId) {
        Map<String, Member> roomMembers = members.get(roomId);
        return roomMembers == null ? Optional.empty() : Optional.ofNullable(roomMembers.get(memberId));
    }

    public synchronized Optional<Member> currentOwner(String roomId) {
        return members(roomId).stream().filter(Member::isOwner).findFirst();
    }

    public Collection<Room> allRooms() {
        return List.copyOf(rooms.values());
    }

    public int roomCount() {
        return rooms.size();
    }

    public synchronized int memberTotal() {
        return members.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Fails if memberCount drifted from the member map or the room has more than one owner.
     */
    public synchronized void checkInvariants(String roomId) {
        Room room = rooms.get(roomId);
        Map<String, Member> roomMembers = members.get(roomId);
        if (room == null || roomMembers == null) {
            return;
        }
        if (room.getMemberCount() != roomMembers.size()) {
            throw new IllegalStateException("Room " + roomId + " memberCount " + room.getMemberCount()
                    + " does not match " + roomMembers.size() + " members");
        }
        long owners = roomMembers.values().stream().filter(Member::isOwner).count();
        if (owners > 1) {
            throw new IllegalStateException("Room " + roomId + " has " + owners + " owners");
        }
    }

    private void recount(Room room, Map<String, Member> roomMembers) {
        room.syncMemberCount(roomMembers == null ? 0 : roomMembers.size());
        checkInvariants(room.getId());
    }

    private String freshRoomId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.roomId();
            if (!rooms.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique room id");
    }

    /**
     * Owner-supplied room settings. The password is already hashed.
     */
    public record RoomSpec(String name, String description, String passwordHash, boolean isPublic, String ownerName) {}

    /**
     * A single membership change: exactly one of joining / leavingMemberId is set.
     */
    public record MembershipDelta(Member joining, String leavingMemberId) {

        public static MembershipDelta join(Member member) {
            return new MembershipDelta(member, null);
        }

        public static MembershipDelta leave(String memberId) {
            return new MembershipDelta(null, memberId);
        }
    }
}
