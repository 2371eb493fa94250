package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.service.loading.LoadingStateRegistry;
import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Loading indicators registered by the host, each guarded by a watchdog while busy.
 */
@RestController
@RequestMapping("/api/loading")
class LoadingStateController {

    private final RecoveryCoordinator coordinator;
    private final LoadingStateRegistry registry;

    LoadingStateController(RecoveryCoordinator coordinator, LoadingStateRegistry registry) {
        this.coordinator = coordinator;
        this.registry = registry;
    }

    @PutMapping("/{id}")
    ResponseEntity<Map<String, Object>> set(@PathVariable String id, @Valid @RequestBody LoadingRequest request) {
        if (request.timeoutMs() == null) {
            coordinator.registerLoadingState(id, request.busy());
        } else {
            registry.set(id, request.busy(), Duration.ofMillis(request.timeoutMs()));
        }
        return ResponseEntity.ok(body(id));
    }

    @GetMapping("/{id}")
    ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        return ResponseEntity.ok(body(id));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> unregister(@PathVariable String id) {
        registry.unregister(id);
        return ResponseEntity.noContent().build();
    }

    private Map<String, Object> body(String id) {
        return Map.of("id", id, "busy", registry.get(id));
    }

    record LoadingRequest(@NotNull Boolean busy, @Positive @Max(600_000) Long timeoutMs) {
    }
}
