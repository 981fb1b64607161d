package com.example.collab.session.service;

import com.example.collab.session.dto.CollaborationPayload;
import com.example.collab.session.dto.CreateRoomRequest;
import com.example.collab.session.dto.UpdateRoomRequest;
import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.frame.OutboundFrame;
import com.example.collab.session.frame.OutboundType;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.Participant;
import com.example.collab.session.model.ParticipantRole;
import com.example.collab.session.model.Room;
import com.example.collab.session.model.RoomKind;
import com.example.collab.session.model.RoomSettings;
import com.example.collab.session.model.SessionEvent;
import com.example.collab.session.model.SessionEventType;
import com.example.collab.session.repository.RoomRepository;
import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.exception.InsufficientPermissionsException;
import com.example.collab.shared.exception.ResourceConflictException;
import com.example.collab.shared.exception.ResourceNotFoundException;
import com.example.collab.shared.exception.RoomFullException;
import com.example.collab.shared.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Room membership, permissions and shared room data. Every mutation of a room runs on the room's
 * sequencer key and is persisted before any frame goes out.
 */
@Service
@Slf4j
@Monitored("service")
public class RoomCoordinator {

    private final RoomRepository roomRepository;
    private final ConnectionRegistry connectionRegistry;
    private final PermissionPolicy permissionPolicy;
    private final SessionEventLog eventLog;
    private final FrameFactory frameFactory;
    private final KeyedSequencer sequencer;
    private final AppProperties appProperties;
    private final Clock clock;

    public RoomCoordinator(RoomRepository roomRepository,
                           ConnectionRegistry connectionRegistry,
                           PermissionPolicy permissionPolicy,
                           SessionEventLog eventLog,
                           FrameFactory frameFactory,
                           KeyedSequencer sequencer,
                           AppProperties appProperties,
                           Clock clock) {
        this.roomRepository = roomRepository;
        this.connectionRegistry = connectionRegistry;
        this.permissionPolicy = permissionPolicy;
        this.eventLog = eventLog;
        this.frameFactory = frameFactory;
        this.sequencer = sequencer;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public Room createRoom(String roomId, CreateRoomRequest request) {
        requireId(roomId);
        CreateRoomRequest body = request != null ? request : new CreateRoomRequest();
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            if (roomRepository.findById(roomId).isPresent()) {
                throw new ResourceConflictException("Room already exists: " + roomId);
            }
            long now = clock.millis();
            RoomSettings settings = RoomSettings.builder()
                    .allowAnonymous(Boolean.TRUE.equals(body.getAllowAnonymous()))
                    .requireAuth(body.getRequireAuth() == null || body.getRequireAuth())
                    .autoSave(body.getAutoSave() == null || body.getAutoSave())
                    .versionHistory(body.getVersionHistory() == null || body.getVersionHistory())
                    .build();
            Room room = Room.builder()
                    .id(roomId)
                    .name(body.getName() != null ? body.getName() : roomId)
                    .kind(body.getType() != null ? body.getType() : RoomKind.DOCUMENT)
                    .ownerUserId(body.getOwnerId())
                    .data(body.getInitialData() != null ? new LinkedHashMap<>(body.getInitialData()) : new LinkedHashMap<>())
                    .createdAt(now)
                    .lastActivityAt(now)
                    .maxParticipants(body.getMaxParticipants() != null
                            ? body.getMaxParticipants()
                            : appProperties.getSession().getDefaultMaxParticipants())
                    .settings(settings)
                    .build();
            roomRepository.save(room);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("type", room.getKind().value());
            details.put("maxParticipants", room.getMaxParticipants());
            logEvent(SessionEventType.ROOM_CREATED, room.getId(), room.getOwnerUserId(), null, details);
            log.info("Room {} created by {} ({}, max {} participants)", roomId, room.getOwnerUserId(), room.getKind().value(), room.getMaxParticipants());
            return room;
        });
    }

    public Room getRoom(String roomId) {
        requireId(roomId);
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room not found"));
    }

    public Optional<Room> findRoom(String roomId) {
        return roomRepository.findById(roomId);
    }

    public Room updateRoom(String roomId, UpdateRoomRequest request, String requestingUserId) {
        requireId(roomId);
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Room room = getRoom(roomId);
            requireOwner(room, requestingUserId, "update");
            List<String> updatedFields = new ArrayList<>();
            if (request.getName() != null) {
                room.setName(request.getName());
                updatedFields.add("name");
            }
            if (request.getData() != null) {
                room.setData(new LinkedHashMap<>(request.getData()));
                updatedFields.add("data");
            }
            if (request.getMaxParticipants() != null) {
                if (request.getMaxParticipants() < room.getParticipants().size()) {
                    throw new IllegalArgumentException("maxParticipants is below the current participant count");
                }
                room.setMaxParticipants(request.getMaxParticipants());
                updatedFields.add("maxParticipants");
            }
            if (request.getLocked() != null) {
                room.setLocked(request.getLocked());
                updatedFields.add("locked");
            }
            if (request.getSettings() != null) {
                room.setSettings(request.getSettings());
                updatedFields.add("settings");
            }
            room.setLastActivityAt(clock.millis());
            roomRepository.save(room);
            logEvent(SessionEventType.ROOM_UPDATED, roomId, requestingUserId, null, Map.of("updatedFields", updatedFields));
            return room;
        });
    }

    /**
     * Notifies every participant with {@code room_deleted}, then removes the room.
     *
     * @return ids of the sessions whose live connections were in the room
     * @throws ResourceNotFoundException if the room does not exist
     */
    public Set<String> deleteRoom(String roomId, String requestingUserId) {
        requireId(roomId);
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Room room = getRoom(roomId);
            requireOwner(room, requestingUserId, "delete");
            roomRepository.delete(roomId);
            OutboundFrame notice = frameFactory.roomDeleted(roomId);
            Set<String> affectedSessions = new LinkedHashSet<>();
            for (Participant participant : room.getParticipants()) {
                connectionRegistry.find(participant.getConnectionId()).ifPresent(connection -> {
                    connection.getRoomIds().remove(roomId);
                    affectedSessions.add(connection.getSessionId());
                    connectionRegistry.send(connection, notice);
                });
            }
            logEvent(SessionEventType.ROOM_DELETED, roomId, requestingUserId, null, null);
            log.info("Room {} deleted, {} participants notified", roomId, room.getParticipants().size());
            return affectedSessions;
        });
    }

    /**
     * Adds the connection to the room. Joining a room the connection is already in is a no-op.
     */
    public Room join(String roomId, Connection connection) {
        requireId(roomId);
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Room room = roomRepository.findById(roomId)
                    .orElseThrow(() -> new ResourceNotFoundException("Room not found"));
            if (room.participant(connection.getId()).isPresent()) {
                connection.getRoomIds().add(roomId);
                return room;
            }
            if (room.isLocked()) {
                throw new InsufficientPermissionsException("Room is locked");
            }
            if (room.isFull()) {
                throw new RoomFullException(roomId);
            }

            long now = clock.millis();
            String userId = connection.getOwnerUserId();
            ParticipantRole role = userId != null && userId.equals(room.getOwnerUserId())
                    ? ParticipantRole.OWNER
                    : ParticipantRole.EDITOR;
            room.getParticipants().add(Participant.builder()
                    .userId(userId)
                    .connectionId(connection.getId())
                    .joinedAt(now)
                    .role(role)
                    .permissions(permissionPolicy.defaultPermissions(room.getKind(), role))
                    .build());
            room.setLastActivityAt(now);
            roomRepository.save(room);
            connection.getRoomIds().add(roomId);

            broadcast(room, frameFactory.userJoinedRoom(roomId, userId, connection.getId()), connection.getId());
            logEvent(SessionEventType.ROOM_JOINED, roomId, userId, connection.getId(), Map.of("role", role.value()));
            log.debug("Connection {} joined room {} as {}", connection.getId(), roomId, role.value());
            return room;
        });
    }

    /**
     * Removes the connection from the room, deleting the room once its last participant leaves.
     *
     * @return false if the room or the participant was not found
     */
    public boolean leave(String roomId, String connectionId) {
        connectionRegistry.find(connectionId).ifPresent(c -> c.getRoomIds().remove(roomId));
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Optional<Room> found = roomRepository.findById(roomId);
            if (found.isEmpty()) {
                return false;
            }
            Room room = found.get();
            boolean removed = room.getParticipants().removeIf(p -> p.getConnectionId().equals(connectionId));
            if (!removed) {
                return false;
            }
            if (room.getParticipants().isEmpty()) {
                roomRepository.delete(roomId);
                logEvent(SessionEventType.ROOM_LEFT, roomId, null, connectionId, null);
                logEvent(SessionEventType.ROOM_DELETED, roomId, null, null, Map.of("reason", "empty"));
                log.info("Room {} deleted after its last participant left", roomId);
                return true;
            }
            room.setLastActivityAt(clock.millis());
            roomRepository.save(room);
            broadcast(room, frameFactory.userLeftRoom(roomId, connectionId), null);
            logEvent(SessionEventType.ROOM_LEFT, roomId, null, connectionId, null);
            return true;
        });
    }

    /**
     * Applies a collaboration operation for a participant and relays it to the rest of the room.
     *
     * @throws InsufficientPermissionsException if the connection is not a participant or its role
     *                                          does not allow the operation
     */
    public Room applyCollaboration(Connection connection, CollaborationPayload payload) {
        if (payload == null || payload.getRoomId() == null || payload.getRoomId().isBlank()) {
            throw new IllegalArgumentException("Room ID required for collaboration");
        }
        String roomId = payload.getRoomId();
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Room room = roomRepository.findById(roomId)
                    .orElseThrow(() -> new ResourceNotFoundException("Room not found"));
            Participant participant = room.participant(connection.getId()).orElse(null);
            if (participant == null || !permissionPolicy.hasPermission(participant.getRole(), payload.getOperation())) {
                throw new InsufficientPermissionsException("Insufficient permissions");
            }

            Object data = frameFactory.toPlain(payload.getData());
            RoomOperation.of(payload.getOperation()).ifPresent(op -> applyOperation(room, op, data));
            long now = clock.millis();
            room.setLastActivityAt(now);
            roomRepository.save(room);

            OutboundFrame update = OutboundFrame.builder()
                    .type(OutboundType.COLLABORATION_UPDATE)
                    .roomId(roomId)
                    .operation(payload.getOperation())
                    .data(data)
                    .userId(connection.getOwnerUserId())
                    .connectionId(connection.getId())
                    .timestamp(now)
                    .build();
            broadcast(room, update, connection.getId());
            return room;
        });
    }

    /**
     * Changes a participant's role and resets its permission set to the defaults for that role.
     */
    public Room setParticipantRole(String roomId, String connectionId, ParticipantRole role, String requestingUserId) {
        requireId(roomId);
        return sequencer.call(KeyedSequencer.roomKey(roomId), () -> {
            Room room = getRoom(roomId);
            requireOwner(room, requestingUserId, "change roles in");
            Participant participant = room.participant(connectionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Participant not found"));
            participant.setRole(role);
            participant.setPermissions(permissionPolicy.defaultPermissions(room.getKind(), role));
            room.setLastActivityAt(clock.millis());
            roomRepository.save(room);
            logEvent(SessionEventType.ROOM_UPDATED, roomId, requestingUserId, connectionId, Map.of("role", role.value()));
            return room;
        });
    }

    public int broadcast(String roomId, OutboundFrame frame, String excludeConnectionId) {
        return roomRepository.findById(roomId)
                .map(room -> broadcast(room, frame, excludeConnectionId))
                .orElse(0);
    }

    public List<Room> listUserRooms(String userId) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        return roomRepository.findAll().stream()
                .filter(room -> room.getParticipants().stream().anyMatch(p -> userId.equals(p.getUserId())))
                .collect(Collectors.toList());
    }

    public List<SessionEvent> roomHistory(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            return List.of();
        }
        return eventLog.roomHistory(roomId);
    }

    public int activeRooms() {
        return roomRepository.count();
    }

    private int broadcast(Room room, OutboundFrame frame, String excludeConnectionId) {
        List<String> connectionIds = room.getParticipants().stream()
                .map(Participant::getConnectionId)
                .collect(Collectors.toList());
        return connectionRegistry.sendAll(connectionIds, frame, excludeConnectionId);
    }

    @SuppressWarnings("unchecked")
    private static void applyOperation(Room room, RoomOperation operation, Object data) {
        switch (operation) {
            case UPDATE_DATA:
                if (!(data instanceof Map)) {
                    throw new IllegalArgumentException("update_data requires an object payload");
                }
                room.getData().putAll((Map<String, Object>) data);
                break;
            case APPEND_DATA:
                Object existing = room.getData().get("items");
                List<Object> items = existing instanceof List
                        ? new ArrayList<>((List<Object>) existing)
                        : new ArrayList<>();
                items.add(data);
                room.getData().put("items", items);
                break;
            case CLEAR_DATA:
                room.getData().clear();
                break;
            default:
                break;
        }
    }

    private static void requireOwner(Room room, String requestingUserId, String action) {
        if (room.getOwnerUserId() != null && !room.getOwnerUserId().equals(requestingUserId)) {
            throw new UnauthorizedException("Unauthorized to " + action + " room");
        }
    }

    private static void requireId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("Room ID required");
        }
    }

    private void logEvent(SessionEventType type, String roomId, String userId, String connectionId, Map<String, Object> data) {
        eventLog.append(SessionEvent.builder()
                .type(type)
                .sessionId("")
                .roomId(roomId)
                .userId(userId)
                .connectionId(connectionId)
                .timestamp(clock.millis())
                .data(data)
                .build());
    }
}
