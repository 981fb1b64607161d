package com.example.collab.session.controller;

import com.example.collab.session.service.RoomCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/collaboration")
@RequiredArgsConstructor
public class CollaborationController {

    private final RoomCoordinator roomCoordinator;

    @GetMapping("/list-rooms")
    public Mono<ResponseEntity<Map<String, Object>>> listRooms(@RequestParam(required = false) String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of("rooms", roomCoordinator.listUserRooms(userId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/room-history")
    public Mono<ResponseEntity<Map<String, Object>>> roomHistory(@RequestParam(required = false) String roomId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of("history", roomCoordinator.roomHistory(roomId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{action}")
    public Mono<ResponseEntity<Map<String, Object>>> unknownAction(@PathVariable String action) {
        return Mono.error(new IllegalArgumentException("Invalid action"));
    }
}
