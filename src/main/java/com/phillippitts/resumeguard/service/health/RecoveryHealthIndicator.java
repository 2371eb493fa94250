package com.phillippitts.resumeguard.service.health;

import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import com.phillippitts.resumeguard.service.recovery.RecoveryStatus;
import com.phillippitts.resumeguard.service.session.RecoveryReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Health indicator for session recovery.
 *
 * <ul>
 *   <li>UP: data is fresh and the last run (if any) did not exhaust</li>
 *   <li>STALE: the host was hidden past the stale threshold and has not refreshed yet</li>
 *   <li>DOWN: the last recovery run exhausted; cleared by the next successful run</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecoveryHealthIndicator implements HealthIndicator {

    private final RecoveryCoordinator coordinator;

    public RecoveryHealthIndicator(RecoveryCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        RecoveryStatus status = coordinator.status();
        RecoveryStatus.LastRun last = status.lastRun();

        Health.Builder builder = new Health.Builder();
        if (last != null && last.status() == RecoveryReport.Status.EXHAUSTED) {
            builder.down().withDetail("status", "Session recovery exhausted; user action required");
        } else if (status.stale()) {
            builder.status("STALE").withDetail("status", "Data may be outdated");
        } else {
            builder.up().withDetail("status", "Fresh");
        }

        builder.withDetail("recoveryInFlight", status.recoveryInFlight())
                .withDetail("attachedConsumers", status.attachedConsumers())
                .withDetail("visibility", status.visibility().name());
        if (last != null) {
            builder.withDetail("lastRun", last.type().wireName() + ':' + last.status().name().toLowerCase(Locale.ROOT));
        }
        return builder.build();
    }
}
