package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.domain.VisibilityState;
import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import com.phillippitts.resumeguard.service.visibility.HttpVisibilitySource;
import com.phillippitts.resumeguard.service.visibility.VisibilitySubscription;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Visibility signal and consumer attachment for the host front end.
 *
 * <p>A consumer id can hold at most one subscription; attaching it again is a no-op.
 */
@RestController
@RequestMapping("/api/visibility")
class VisibilityController {

    private static final Logger LOG = LogManager.getLogger(VisibilityController.class);

    private final RecoveryCoordinator coordinator;
    private final HttpVisibilitySource source;
    private final Map<String, VisibilitySubscription> subscriptions = new ConcurrentHashMap<>();

    VisibilityController(RecoveryCoordinator coordinator, HttpVisibilitySource source) {
        this.coordinator = coordinator;
        this.source = source;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> report(@Valid @RequestBody VisibilityRequest request) {
        int delivered = source.publish(request.state());
        LOG.debug("Visibility {} reported; delivered to {} listener(s)", request.state(), delivered);
        return ResponseEntity.ok(Map.of(
                "state", request.state(),
                "delivered", delivered
        ));
    }

    @PostMapping("/consumers/{consumerId}")
    ResponseEntity<Map<String, Object>> attach(@PathVariable String consumerId) {
        boolean[] created = {false};
        subscriptions.computeIfAbsent(consumerId, id -> {
            created[0] = true;
            return coordinator.attach(id);
        });
        return ResponseEntity.status(created[0] ? HttpStatus.CREATED : HttpStatus.OK).body(Map.of(
                "consumerId", consumerId,
                "attachedConsumers", coordinator.status().attachedConsumers()
        ));
    }

    @DeleteMapping("/consumers/{consumerId}")
    ResponseEntity<Void> release(@PathVariable String consumerId) {
        VisibilitySubscription subscription = subscriptions.remove(consumerId);
        if (subscription == null) {
            return ResponseEntity.notFound().build();
        }
        subscription.release();
        return ResponseEntity.noContent().build();
    }

    @PreDestroy
    void releaseAll() {
        subscriptions.values().forEach(VisibilitySubscription::release);
        subscriptions.clear();
    }

    record VisibilityRequest(@NotNull VisibilityState state) {
    }
}
