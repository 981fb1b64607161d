package com.example.collab.session.controller;

import com.example.collab.session.service.CoordinatorAlarm;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.exception.UnauthorizedException;
import com.example.collab.shared.quota.QuotaCounter;
import com.example.collab.shared.quota.QuotaPeriod;
import com.example.collab.shared.quota.QuotaService;
import com.example.collab.shared.quota.QuotaUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator actions. Every request must carry {@code X-Admin-Token} matching {@code collab.admin.token};
 * with no token configured the endpoints refuse all requests.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final CoordinatorAlarm coordinatorAlarm;
    private final SessionCoordinator sessionCoordinator;
    private final QuotaService quotaService;
    private final AppProperties appProperties;

    @PostMapping("/cleanup")
    public Mono<ResponseEntity<Map<String, Object>>> cleanup(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken) {
        requireAdmin(adminToken);
        log.info("Admin cleanup requested");
        return Mono.fromCallable(() -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.putAll(coordinatorAlarm.runMaintenance());
                    return ResponseEntity.ok(body);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/force-disconnect")
    public Mono<ResponseEntity<Map<String, Object>>> forceDisconnect(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @RequestParam(required = false) String connectionId) {
        requireAdmin(adminToken);
        if (connectionId == null || connectionId.isBlank()) {
            return Mono.error(new IllegalArgumentException("Connection ID required"));
        }
        log.info("Admin force-disconnect of connection {}", connectionId);
        return Mono.fromCallable(() -> {
                    boolean disconnected = sessionCoordinator.forceDisconnect(connectionId, SessionCoordinator.REASON_ADMIN);
                    return ResponseEntity.ok(Map.<String, Object>of("success", disconnected));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/quota/{identifier}/{quotaType}")
    public Mono<ResponseEntity<QuotaUsage>> quotaUsage(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @PathVariable String identifier,
            @PathVariable String quotaType,
            @RequestParam(required = false) String period) {
        requireAdmin(adminToken);
        return Mono.fromCallable(() -> ResponseEntity.ok(quotaService.getUsage(identifier, quotaType, periodOf(period))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/quota/{identifier}/{quotaType}/reset")
    public Mono<ResponseEntity<Map<String, Object>>> resetQuota(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @PathVariable String identifier,
            @PathVariable String quotaType,
            @RequestParam(required = false) String period) {
        requireAdmin(adminToken);
        return Mono.fromCallable(() -> {
                    boolean reset = quotaService.resetQuota(identifier, quotaType, periodOf(period));
                    return ResponseEntity.ok(Map.<String, Object>of("success", true, "existed", reset));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/quota/{identifier}/{quotaType}/override")
    public Mono<ResponseEntity<QuotaCounter>> overrideQuota(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @PathVariable String identifier,
            @PathVariable String quotaType,
            @RequestParam long limit,
            @RequestParam(required = false) String period) {
        requireAdmin(adminToken);
        return Mono.fromCallable(() -> ResponseEntity.ok(quotaService.setOverride(identifier, quotaType, limit, periodOf(period))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/quota/invalidate")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateQuotaCache(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @RequestParam(required = false) String identifier) {
        requireAdmin(adminToken);
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of("invalidated", quotaService.invalidateCache(identifier))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{action}")
    public Mono<ResponseEntity<Map<String, Object>>> unknownAction(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @PathVariable String action) {
        requireAdmin(adminToken);
        return Mono.error(new IllegalArgumentException("Invalid action"));
    }

    private static QuotaPeriod periodOf(String period) {
        return period == null || period.isBlank() ? null : QuotaPeriod.fromValue(period);
    }

    private void requireAdmin(String presented) {
        String expected = appProperties.getAdmin().getToken();
        if (expected == null || expected.isBlank()) {
            throw new UnauthorizedException("Admin endpoints are disabled");
        }
        if (presented == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Invalid admin token");
        }
    }
}
