package com.example.collab.session.controller;

import com.example.collab.session.service.CoordinatorStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final CoordinatorStatus coordinatorStatus;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
                    Map<String, Object> health = coordinatorStatus.health();
                    HttpStatus status = coordinatorStatus.isHealthy(health) ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
                    return ResponseEntity.status(status).body(health);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Object>>> stats() {
        return Mono.fromCallable(() -> ResponseEntity.ok(coordinatorStatus.stats()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
