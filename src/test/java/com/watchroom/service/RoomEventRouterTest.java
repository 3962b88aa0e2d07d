package com.watchroom.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.watchroom.dto.ChatRequest;
import com.watchroom.dto.CreateRoomRequest;
import com.watchroom.dto.JoinRoomRequest;
import com.watchroom.dto.RoomDeletedNotice;
import com.watchroom.dto.RoomResponse;
import com.watchroom.dto.RoomView;
import com.watchroom.model.ChannelState;
import com.watchroom.model.ChatKind;
import com.watchroom.model.ChatMessage;
import com.watchroom.model.Member;
import com.watchroom.model.PlaybackState;
import com.watchroom.model.Room;
import com.watchroom.model.ServerEvent;
import com.watchroom.model.SignalType;
import com.watchroom.service.RoomRegistry.MembershipDelta;
import com.watchroom.support.RecordingMessenger;
import com.watchroom.support.RecordingMessenger.Sent;
import com.watchroom.support.WatchRoomFixture;

class RoomEventRouterTest {

    private static final Duration GRACE = Duration.ofSeconds(30);
    private static final Duration OWNER_TIMEOUT = Duration.ofMinutes(5);

    private WatchRoomFixture fixture;
    private RoomEventRouter router;
    private RecordingMessenger messenger;

    @BeforeEach
    void setUp() {
        fixture = new WatchRoomFixture();
        router = fixture.router;
        messenger = fixture.messenger;
    }

    private String createRoom(String ownerConnection) {
        RoomResponse response = fixture.create(ownerConnection, "Movie night", "Alice");
        assertThat(response.success()).isTrue();
        return response.room().id();
    }

    private Room room(String roomId) {
        return fixture.registry.get(roomId).orElseThrow();
    }

    private PlaybackState playback(String videoId, double position) {
        return new PlaybackState("https://cdn.example/v.m3u8", position, true, videoId, "Some Film", "2024",
                "Some Film", 1, "source-a");
    }

    // Leaves a room that holds members but no owner record, the state an owner reconnect finds
    private void dropOwnerRecord(String roomId, String ownerConnection) {
        fixture.registry.applyMembership(roomId, MembershipDelta.leave(ownerConnection));
        fixture.connectionIndex.unbind(ownerConnection);
    }

    @Test
    @DisplayName("Creating a room binds the creator as owner and hands out the owner token once")
    void createRoomBindsOwner() {
        RoomResponse response = fixture.create("c1", "Movie night", "secret", false, "Alice");

        assertThat(response.success()).isTrue();
        RoomView view = response.room();
        assertThat(view.id()).hasSize(6);
        assertThat(view.ownerToken()).isNotBlank();
        assertThat(view.ownerId()).isEqualTo("c1");
        assertThat(view.hasPassword()).isTrue();
        assertThat(view.isPublic()).isFalse();
        assertThat(view.memberCount()).isEqualTo(1);
        assertThat(fixture.connectionIndex.lookup("c1")).hasValueSatisfying(binding -> {
            assertThat(binding.roomId()).isEqualTo(view.id());
            assertThat(binding.owner()).isTrue();
        });
        assertThat(room(view.id()).getPasswordHash()).isNotEqualTo("secret");
    }

    @Test
    @DisplayName("Creating a room with a blank name is rejected as a missing field")
    void createRoomWithBlankName() {
        RoomResponse response = router.createRoom("c1", new CreateRoomRequest(" ", "", null, true, "Alice")).block();

        assertThat(response.success()).isFalse();
        assertThat(response.code()).isEqualTo("VAL_002");
        assertThat(fixture.registry.roomCount()).isZero();
        assertThat(fixture.connectionIndex.lookup("c1")).isEmpty();
    }

    @Test
    @DisplayName("Creating a room with an oversized name is rejected as too long")
    void createRoomWithLongName() {
        RoomResponse response = router.createRoom("c1",
                new CreateRoomRequest("x".repeat(65), "", null, true, "Alice")).block();

        assertThat(response.success()).isFalse();
        assertThat(response.code()).isEqualTo("VAL_003");
    }

    @Test
    @DisplayName("Joining returns the room snapshot and member list and notifies the others")
    void joinRoom() {
        String roomId = createRoom("c1");

        RoomResponse response = fixture.join("c2", roomId, "Bob");

        assertThat(response.success()).isTrue();
        assertThat(response.room().ownerToken()).isNull();
        assertThat(response.room().memberCount()).isEqualTo(2);
        assertThat(response.members()).extracting(Member::getName).containsExactly("Alice", "Bob");

        List<Sent> joined = messenger.ofEvent(ServerEvent.MEMBER_JOINED);
        assertThat(joined).hasSize(1);
        assertThat(joined.get(0).connectionId()).isEqualTo("c1");
        assertThat(((Member) joined.get(0).payload()).getName()).isEqualTo("Bob");
    }

    @Test
    @DisplayName("Joining with a wrong password fails without touching membership")
    void joinWithWrongPassword() {
        String roomId = fixture.create("c1", "Private", "secret", false, "Alice").room().id();

        RoomResponse response = fixture.join("c2", roomId, "wrong", "Bob");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isNotBlank();
        assertThat(response.code()).isEqualTo("ROOM_003");
        assertThat(response.room()).isNull();
        assertThat(response.members()).isNull();
        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
        assertThat(fixture.connectionIndex.lookup("c2")).isEmpty();
        assertThat(messenger.ofEvent(ServerEvent.MEMBER_JOINED)).isEmpty();
    }

    @Test
    @DisplayName("Joining with the right password succeeds")
    void joinWithPassword() {
        String roomId = fixture.create("c1", "Private", "secret", false, "Alice").room().id();

        assertThat(fixture.join("c2", roomId, "secret", "Bob").success()).isTrue();
    }

    @Test
    @DisplayName("A password filling the whole 72-byte hash input must match to the last byte")
    void passwordAtHashInputLimit() {
        String password = "p".repeat(71) + "A";
        String roomId = fixture.create("c1", "Private", password, false, "Alice").room().id();

        RoomResponse wrong = fixture.join("c2", roomId, "p".repeat(71) + "B", "Bob");
        RoomResponse right = fixture.join("c3", roomId, password, "Carol");

        assertThat(wrong.success()).isFalse();
        assertThat(wrong.code()).isEqualTo("ROOM_003");
        assertThat(right.success()).isTrue();
        assertThat(room(roomId).getMemberCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("A multi-byte password differing only in its last character is refused")
    void wrongMultiBytePassword() {
        String password = "密".repeat(23) + "A";
        String roomId = fixture.create("c1", "私人", password, false, "Alice").room().id();

        RoomResponse response = fixture.join("c2", roomId, "密".repeat(23) + "B", "Bob");

        assertThat(response.success()).isFalse();
        assertThat(response.code()).isEqualTo("ROOM_003");
        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
        assertThat(fixture.join("c3", roomId, password, "Carol").success()).isTrue();
    }

    @Test
    @DisplayName("Passwords longer than 72 bytes of UTF-8 are rejected as too long on create and join")
    void passwordOverHashInputLimit() {
        // 24 three-byte characters fill the hash input, the 25th character would be cut off
        String tooLong = "密".repeat(24) + "A";
        assertThat(tooLong).hasSizeLessThan(72);

        RoomResponse created = fixture.create("c1", "Private", tooLong, false, "Alice");
        assertThat(created.success()).isFalse();
        assertThat(created.code()).isEqualTo("VAL_003");
        assertThat(fixture.registry.roomCount()).isZero();

        String roomId = fixture.create("c1", "Private", "密".repeat(24), false, "Alice").room().id();
        RoomResponse joined = fixture.join("c2", roomId, tooLong, "Bob");

        assertThat(joined.success()).isFalse();
        assertThat(joined.code()).isEqualTo("VAL_003");
        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A user name made only of control characters counts as missing")
    void controlCharacterUserName() {
        RoomResponse created = fixture.create("c1", "Movie night", "\u0001\u0007");

        assertThat(created.success()).isFalse();
        assertThat(created.code()).isEqualTo("VAL_002");

        String roomId = createRoom("c1");
        RoomResponse joined = fixture.join("c2", roomId, " \u0000 ");

        assertThat(joined.success()).isFalse();
        assertThat(joined.code()).isEqualTo("VAL_002");
        assertThat(messenger.ofEvent(ServerEvent.MEMBER_JOINED)).isEmpty();
    }

    @Test
    @DisplayName("Joining an unknown room fails with room not found")
    void joinUnknownRoom() {
        RoomResponse response = fixture.join("c2", "NOPE42", "Bob");

        assertThat(response.success()).isFalse();
        assertThat(response.code()).isEqualTo("ROOM_001");
    }

    @Test
    @DisplayName("A rejoin based on a record older than the freshness window is refused")
    void joinWithExpiredRecord() {
        String roomId = createRoom("c1");
        JoinRoomRequest request = new JoinRoomRequest(roomId, null, "Bob", null);
        request.setRecordTimestamp(fixture.clock.millis() - Duration.ofHours(25).toMillis());

        RoomResponse response = router.joinRoom("c2", request).block();

        assertThat(response.success()).isFalse();
        assertThat(response.code()).isEqualTo("ROOM_010");
        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Joining the same room twice on one connection is idempotent")
    void joinSameRoomTwice() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        RoomResponse again = fixture.join("c2", roomId, "Bob");

        assertThat(again.success()).isTrue();
        assertThat(again.members()).hasSize(2);
        assertThat(messenger.all()).isEmpty();
    }

    @Test
    @DisplayName("Joining another room leaves the previous one first")
    void joinAnotherRoomLeavesPrevious() {
        String first = createRoom("c1");
        String second = createRoom("c3");
        fixture.join("c2", first, "Bob");

        fixture.join("c2", second, "Bob");

        assertThat(room(first).getMemberCount()).isEqualTo(1);
        assertThat(room(second).getMemberCount()).isEqualTo(2);
        assertThat(messenger.to("c1", ServerEvent.MEMBER_LEFT)).hasSize(1);
        assertThat(fixture.connectionIndex.lookup("c2")).hasValueSatisfying(
                binding -> assertThat(binding.roomId()).isEqualTo(second));
    }

    @Test
    @DisplayName("An owner leaving a three member room disbands it with owner_left")
    void ownerLeavesDisbandsRoom() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        fixture.join("c3", roomId, "Carol");
        messenger.clear();

        router.leaveRoom("c1");

        for (String remaining : List.of("c2", "c3")) {
            List<Sent> deleted = messenger.to(remaining, ServerEvent.ROOM_DELETED);
            assertThat(deleted).hasSize(1);
            assertThat(deleted.get(0).payload()).isEqualTo(new RoomDeletedNotice(RoomDeletedNotice.OWNER_LEFT));
            assertThat(fixture.connectionIndex.lookup(remaining)).isEmpty();
        }
        assertThat(messenger.to("c1")).isEmpty();
        assertThat(fixture.registry.get(roomId)).isEmpty();
        assertThat(fixture.join("c4", roomId, "Dave").code()).isEqualTo("ROOM_001");
    }

    @Test
    @DisplayName("Events referencing a disbanded room do nothing")
    void eventsAfterDisbandAreIgnored() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        router.leaveRoom("c1");
        messenger.clear();

        router.playSeek("c2", 10);
        router.chatMessage("c2", new ChatRequest("hello?", ChatKind.TEXT));
        router.heartbeat("c2");
        router.leaveRoom("c2");

        assertThat(messenger.all()).isEmpty();
        assertThat(fixture.registry.roomCount()).isZero();
    }

    @Test
    @DisplayName("A member leaving a two member room notifies the owner and keeps the room")
    void memberLeavesRoom() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        router.leaveRoom("c2");

        List<Sent> left = messenger.to("c1", ServerEvent.MEMBER_LEFT);
        assertThat(left).hasSize(1);
        assertThat(left.get(0).payload()).isEqualTo("c2");
        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
        assertThat(fixture.cleanupScheduler.isArmed(roomId)).isFalse();
    }

    @Test
    @DisplayName("A disconnect is handled as a leave")
    void disconnectLeavesRoom() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");

        router.disconnect("c2");

        assertThat(room(roomId).getMemberCount()).isEqualTo(1);
        assertThat(fixture.connectionIndex.lookup("c2")).isEmpty();
    }

    @Test
    @DisplayName("An emptied room is deleted once the grace period passes without a join")
    void emptyRoomDeletedAfterGrace() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        dropOwnerRecord(roomId, "c1");

        router.leaveRoom("c2");
        assertThat(fixture.cleanupScheduler.isArmed(roomId)).isTrue();

        fixture.timer.advance(GRACE.minusSeconds(1));
        assertThat(fixture.registry.get(roomId)).isPresent();

        fixture.timer.advance(Duration.ofSeconds(1));
        assertThat(fixture.registry.get(roomId)).isEmpty();
        assertThat(router.listRooms().block()).extracting(RoomView::id).doesNotContain(roomId);
        assertThat(fixture.cleanupScheduler.isArmed(roomId)).isFalse();
    }

    @Test
    @DisplayName("A join during the grace period keeps the room and the timer never fires")
    void joinDuringGraceCancelsDeletion() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        dropOwnerRecord(roomId, "c1");
        router.leaveRoom("c2");

        fixture.timer.advance(Duration.ofSeconds(10));
        assertThat(fixture.join("c3", roomId, "Carol").success()).isTrue();
        fixture.timer.advance(GRACE.multipliedBy(2));

        assertThat(messenger.to("c3", ServerEvent.ROOM_DELETED)).isEmpty();
        assertThat(fixture.registry.get(roomId)).isPresent();
        assertThat(fixture.timer.pendingCount()).isZero();
        assertThat(router.listRooms().block()).extracting(RoomView::id).contains(roomId);
    }

    @Test
    @DisplayName("The owner token reclaims ownership of an emptied room and cancels its deletion")
    void ownerTokenReclaimsEmptyRoom() {
        RoomResponse created = fixture.create("c1", "Movie night", "Alice");
        String roomId = created.room().id();
        fixture.join("c2", roomId, "Bob");
        dropOwnerRecord(roomId, "c1");
        router.leaveRoom("c2");
        assertThat(fixture.cleanupScheduler.isArmed(roomId)).isTrue();

        RoomResponse reclaimed = fixture.reclaim("c9", roomId, "Alice", created.room().ownerToken());

        assertThat(reclaimed.success()).isTrue();
        assertThat(reclaimed.room().ownerId()).isEqualTo("c9");
        assertThat(reclaimed.members()).singleElement().satisfies(member -> {
            assertThat(member.isOwner()).isTrue();
            assertThat(member.getConnectionId()).isEqualTo("c9");
        });
        assertThat(fixture.cleanupScheduler.isArmed(roomId)).isFalse();
        assertThat(fixture.connectionIndex.lookup("c9")).hasValueSatisfying(
                binding -> assertThat(binding.owner()).isTrue());

        fixture.timer.advance(GRACE.multipliedBy(2));
        assertThat(fixture.registry.get(roomId)).isPresent();
    }

    @Test
    @DisplayName("Reclaiming while the old owner record is present moves it to the new connection")
    void ownerTokenReclaimRebindsExistingOwner() {
        RoomResponse created = fixture.create("c1", "Movie night", "Alice");
        String roomId = created.room().id();
        fixture.join("c2", roomId, "Bob");
        fixture.clock.advance(Duration.ofMinutes(2));

        RoomResponse reclaimed = fixture.reclaim("c9", roomId, "Alice", created.room().ownerToken());

        assertThat(reclaimed.success()).isTrue();
        assertThat(reclaimed.room().ownerId()).isEqualTo("c9");
        assertThat(reclaimed.room().lastOwnerHeartbeat()).isEqualTo(fixture.clock.millis());
        assertThat(reclaimed.members()).hasSize(2);
        assertThat(reclaimed.members()).filteredOn(Member::isOwner).singleElement().satisfies(owner -> {
            assertThat(owner.getId()).isEqualTo("c1");
            assertThat(owner.getConnectionId()).isEqualTo("c9");
        });
        assertThat(fixture.connectionIndex.lookup("c1")).isEmpty();

        // The stale connection closing later must not disband the room
        router.disconnect("c1");
        assertThat(fixture.registry.get(roomId)).isPresent();
        assertThatCode(() -> fixture.registry.checkInvariants(roomId)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A reclaiming owner takes the name sent with the reconnect")
    void ownerReclaimUpdatesName() {
        RoomResponse created = fixture.create("c1", "Movie night", "Alice");
        String roomId = created.room().id();
        fixture.join("c2", roomId, "Bob");

        RoomResponse reclaimed = fixture.reclaim("c9", roomId, "Alicia", created.room().ownerToken());

        assertThat(reclaimed.room().ownerName()).isEqualTo("Alicia");
        assertThat(reclaimed.members()).filteredOn(Member::isOwner).singleElement()
                .satisfies(owner -> assertThat(owner.getName()).isEqualTo("Alicia"));
        assertThat(fixture.connectionIndex.lookup("c9")).hasValueSatisfying(
                binding -> assertThat(binding.userName()).isEqualTo("Alicia"));
        assertThat(messenger.to("c2", ServerEvent.MEMBER_JOINED)).singleElement()
                .satisfies(sent -> assertThat(((Member) sent.payload()).getName()).isEqualTo("Alicia"));
    }

    @Test
    @DisplayName("A wrong owner token joins as an ordinary member")
    void wrongOwnerTokenJoinsAsMember() {
        String roomId = createRoom("c1");

        RoomResponse response = fixture.reclaim("c2", roomId, "Mallory", "not-the-token");

        assertThat(response.success()).isTrue();
        assertThat(response.room().ownerId()).isEqualTo("c1");
        assertThat(response.members()).filteredOn(Member::isOwner).extracting(Member::getId).containsExactly("c1");
    }

    @Test
    @DisplayName("The sweep deletes rooms whose owner stopped sending heartbeats")
    void sweepDeletesSilentOwnerRooms() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        // Member heartbeats do not keep the room alive
        fixture.clock.advance(Duration.ofMinutes(4));
        router.heartbeat("c2");
        fixture.clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        fixture.cleanupScheduler.sweepOwnerTimeouts();

        assertThat(fixture.registry.get(roomId)).isEmpty();
        for (String connection : List.of("c1", "c2")) {
            assertThat(messenger.to(connection, ServerEvent.ROOM_DELETED)).singleElement()
                    .extracting(Sent::payload)
                    .isEqualTo(new RoomDeletedNotice(RoomDeletedNotice.OWNER_TIMEOUT));
            assertThat(fixture.connectionIndex.lookup(connection)).isEmpty();
        }
    }

    @Test
    @DisplayName("Owner heartbeats keep the room alive across sweeps")
    void ownerHeartbeatKeepsRoomAlive() {
        String roomId = createRoom("c1");

        fixture.clock.advance(Duration.ofMinutes(4));
        router.heartbeat("c1");
        fixture.clock.advance(Duration.ofMinutes(4));
        fixture.cleanupScheduler.sweepOwnerTimeouts();

        assertThat(fixture.registry.get(roomId)).isPresent();

        fixture.clock.advance(OWNER_TIMEOUT);
        fixture.cleanupScheduler.sweepOwnerTimeouts();
        assertThat(fixture.registry.get(roomId)).isEmpty();
    }

    @Test
    @DisplayName("Owner play changes are stored and relayed to everyone else")
    void ownerPlayChangeRelayed() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        fixture.join("c3", roomId, "Carol");
        messenger.clear();
        PlaybackState state = playback("v1", 0);

        router.playChange("c1", state);

        assertThat(room(roomId).getCurrentState()).isEqualTo(state);
        assertThat(messenger.ofEvent(ServerEvent.PLAY_CHANGE)).extracting(Sent::connectionId)
                .containsExactlyInAnyOrder("c2", "c3");
    }

    @Test
    @DisplayName("Play and live changes from a non-owner are dropped")
    void nonOwnerChangesDropped() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        PlaybackState ownerState = playback("v1", 12);
        router.playUpdate("c1", ownerState);
        messenger.clear();

        router.playChange("c2", playback("v2", 0));
        router.liveChange("c2", new ChannelState("ch1", "News", "https://live.example/ch1"));
        router.playUpdate("c2", playback("v3", 99));

        assertThat(room(roomId).getCurrentState()).isEqualTo(ownerState);
        assertThat(messenger.all()).isEmpty();
    }

    @Test
    @DisplayName("Owner live changes replace the stored state")
    void ownerLiveChange() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        ChannelState channel = new ChannelState("ch1", "News", "https://live.example/ch1");

        router.liveChange("c1", channel);

        assertThat(room(roomId).getCurrentState()).isEqualTo(channel);
        assertThat(messenger.to("c2", ServerEvent.LIVE_CHANGE)).singleElement()
                .extracting(Sent::payload).isEqualTo(channel);
    }

    @Test
    @DisplayName("Seek, play and pause are relayed from any member without storing state")
    void transportCommandsFromAnyMember() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        router.playSeek("c2", 42.5);
        router.playPause("c2");
        router.playPlay("c2");

        assertThat(messenger.to("c1")).extracting(Sent::event)
                .containsExactly(ServerEvent.PLAY_SEEK, ServerEvent.PLAY_PAUSE, ServerEvent.PLAY_PLAY);
        assertThat(messenger.to("c1").get(0).payload()).isEqualTo(42.5);
        assertThat(messenger.to("c2")).isEmpty();
        assertThat(room(roomId).getCurrentState()).isNull();
    }

    @Test
    @DisplayName("Chat reaches every member including the sender with identical content")
    void chatBroadcastIncludesSender() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        fixture.join("c3", roomId, "Carol");
        messenger.clear();

        router.chatMessage("c2", new ChatRequest("hi all", ChatKind.TEXT));

        List<Sent> chat = messenger.ofEvent(ServerEvent.CHAT_MESSAGE);
        assertThat(chat).extracting(Sent::connectionId).containsExactlyInAnyOrder("c1", "c2", "c3");
        ChatMessage message = (ChatMessage) chat.get(0).payload();
        assertThat(chat).extracting(Sent::payload).containsOnly(message);
        assertThat(message.id()).startsWith(fixture.clock.millis() + "-");
        assertThat(message.userId()).isEqualTo("c2");
        assertThat(message.userName()).isEqualTo("Bob");
        assertThat(message.content()).isEqualTo("hi all");
        assertThat(message.type()).isEqualTo(ChatKind.TEXT);
    }

    @Test
    @DisplayName("Chat timestamps never decrease within a room even if the clock steps back")
    void chatTimestampsMonotonic() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");

        router.chatMessage("c1", new ChatRequest("first", ChatKind.TEXT));
        fixture.clock.advance(Duration.ofSeconds(-5));
        router.chatMessage("c2", new ChatRequest("😀", ChatKind.EMOJI));

        List<Long> timestamps = messenger.to("c1", ServerEvent.CHAT_MESSAGE).stream()
                .map(sent -> ((ChatMessage) sent.payload()).timestamp())
                .toList();
        assertThat(timestamps).hasSize(2).isSorted();
    }

    @Test
    @DisplayName("Blank, oversized or unbound chat messages are dropped")
    void invalidChatDropped() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        router.chatMessage("c2", new ChatRequest("   ", ChatKind.TEXT));
        router.chatMessage("c2", new ChatRequest("x".repeat(1001), ChatKind.TEXT));
        router.chatMessage("stranger", new ChatRequest("hello", ChatKind.TEXT));

        assertThat(messenger.all()).isEmpty();
    }

    @Test
    @DisplayName("Voice signals go only to the named member, tagged with the sender")
    void voiceSignalRelayedToTarget() {
        String roomId = createRoom("c1");
        fixture.join("c2", roomId, "Bob");
        fixture.join("c3", roomId, "Carol");
        messenger.clear();
        TextNode offer = JsonNodeFactory.instance.textNode("v=0 sdp");

        router.relaySignal("c2", SignalType.OFFER, "c3", offer);

        assertThat(messenger.all()).singleElement().satisfies(sent -> {
            assertThat(sent.connectionId()).isEqualTo("c3");
            assertThat(sent.event()).isEqualTo(ServerEvent.VOICE_OFFER);
            assertThat(sent.payload()).isEqualTo(Map.of("userId", "c2", "offer", offer));
        });
    }

    @Test
    @DisplayName("Voice signals to connections outside the sender's room are dropped")
    void voiceSignalOutsideRoomDropped() {
        String roomId = createRoom("c1");
        createRoom("c5");
        fixture.join("c2", roomId, "Bob");
        messenger.clear();

        router.relaySignal("c2", SignalType.ICE_CANDIDATE, "c5", JsonNodeFactory.instance.objectNode());
        router.relaySignal("stranger", SignalType.ANSWER, "c1", JsonNodeFactory.instance.objectNode());

        assertThat(messenger.all()).isEmpty();
    }

    @Test
    @DisplayName("Only public rooms are listed")
    void listOnlyPublicRooms() {
        String open = createRoom("c1");
        fixture.create("c2", "Hidden", null, false, "Bob");

        assertThat(router.listRooms().block()).extracting(RoomView::id).containsExactly(open);
    }

    @Test
    @DisplayName("Member count and single ownership hold through a busy session")
    void invariantsHoldThroughChurn() {
        RoomResponse created = fixture.create("c1", "Movie night", "Alice");
        String roomId = created.room().id();
        fixture.join("c2", roomId, "Bob");
        fixture.join("c3", roomId, "Carol");
        router.leaveRoom("c2");
        fixture.join("c4", roomId, "Dave");
        fixture.reclaim("c5", roomId, "Alice", created.room().ownerToken());
        router.disconnect("c3");
        fixture.join("c2", roomId, "Bob");

        Room room = room(roomId);
        List<Member> members = fixture.registry.members(roomId);
        assertThat(room.getMemberCount()).isEqualTo(members.size()).isEqualTo(3);
        assertThat(members).filteredOn(Member::isOwner).hasSize(1);
        assertThatCode(() -> fixture.registry.checkInvariants(roomId)).doesNotThrowAnyException();
    }
}
