package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import com.phillippitts.resumeguard.service.recovery.RecoveryStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual refresh action and coordinator status.
 */
@RestController
@RequestMapping("/api/recovery")
class RecoveryController {

    private static final Logger LOG = LogManager.getLogger(RecoveryController.class);

    private final RecoveryCoordinator coordinator;

    RecoveryController(RecoveryCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * 202 when a manual run started, 409 when one is already in flight.
     */
    @PostMapping("/refresh")
    ResponseEntity<Map<String, Object>> refresh() {
        boolean started = coordinator.forceRefresh();
        LOG.info("Manual refresh requested; started={}", started);
        return ResponseEntity.status(started ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
                .body(Map.of("started", started));
    }

    @GetMapping("/status")
    ResponseEntity<RecoveryStatus> status() {
        return ResponseEntity.ok(coordinator.status());
    }
}
