package com.example.collab.session.controller;

import com.example.collab.session.dto.CreateRoomRequest;
import com.example.collab.session.dto.ParticipantRoleRequest;
import com.example.collab.session.dto.UpdateRoomRequest;
import com.example.collab.session.model.Room;
import com.example.collab.session.service.RoomCoordinator;
import com.example.collab.session.service.SessionCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/room")
@RequiredArgsConstructor
@Slf4j
public class RoomController {

    private final RoomCoordinator roomCoordinator;
    private final SessionCoordinator sessionCoordinator;

    @GetMapping("/{roomId}")
    public Mono<ResponseEntity<Room>> getRoom(@PathVariable String roomId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(roomCoordinator.getRoom(roomId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{roomId}")
    public Mono<ResponseEntity<Room>> createRoom(@PathVariable String roomId,
                                                 @Valid @RequestBody(required = false) CreateRoomRequest request) {
        log.info("Creating room {}", roomId);
        return Mono.fromCallable(() -> roomCoordinator.createRoom(roomId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(room -> ResponseEntity.status(HttpStatus.CREATED).body(room));
    }

    @PutMapping("/{roomId}")
    public Mono<ResponseEntity<Room>> updateRoom(@PathVariable String roomId,
                                                 @RequestParam(required = false) String userId,
                                                 @Valid @RequestBody UpdateRoomRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(roomCoordinator.updateRoom(roomId, request, userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{roomId}")
    public Mono<ResponseEntity<Map<String, Object>>> deleteRoom(@PathVariable String roomId,
                                                                @RequestParam(required = false) String userId) {
        log.info("Delete request for room {} by user {}", roomId, userId);
        return Mono.fromCallable(() -> {
                    sessionCoordinator.deleteRoom(roomId, userId);
                    return ResponseEntity.ok(Map.<String, Object>of("success", true));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{roomId}/role")
    public Mono<ResponseEntity<Room>> setParticipantRole(@PathVariable String roomId,
                                                         @RequestParam(required = false) String userId,
                                                         @Valid @RequestBody ParticipantRoleRequest request) {
        log.info("Setting role of {} in room {} to {}", request.getConnectionId(), roomId, request.getRole());
        return Mono.fromCallable(() -> ResponseEntity.ok(
                        roomCoordinator.setParticipantRole(roomId, request.getConnectionId(), request.getRole(), userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @RequestMapping(value = {"", "/"}, method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE})
    public Mono<ResponseEntity<Room>> missingRoomId() {
        return Mono.error(new IllegalArgumentException("Room ID required"));
    }
}
