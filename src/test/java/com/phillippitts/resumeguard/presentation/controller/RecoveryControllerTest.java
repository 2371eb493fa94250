package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.domain.VisibilityState;
import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import com.phillippitts.resumeguard.service.recovery.RecoveryStatus;
import com.phillippitts.resumeguard.service.recovery.RecoveryType;
import com.phillippitts.resumeguard.service.session.RecoveryReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RecoveryController.class)
class RecoveryControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RecoveryCoordinator coordinator;

    @Test
    void refreshReturnsAcceptedWhenRunStarts() throws Exception {
        when(coordinator.forceRefresh()).thenReturn(true);

        mvc.perform(post("/api/recovery/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.started").value(true));
    }

    @Test
    void refreshReturnsConflictWhileRunInFlight() throws Exception {
        when(coordinator.forceRefresh()).thenReturn(false);

        mvc.perform(post("/api/recovery/refresh"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.started").value(false));
    }

    @Test
    void statusExposesSnapshot() throws Exception {
        RecoveryStatus.LastRun lastRun = new RecoveryStatus.LastRun(RecoveryType.AGGRESSIVE,
                RecoveryReport.Status.RECOVERED, 125_000, Instant.parse("2025-01-01T00:02:05Z"));
        when(coordinator.status()).thenReturn(new RecoveryStatus(true, false, 3, VisibilityState.ACTIVE, lastRun));

        mvc.perform(get("/api/recovery/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stale").value(true))
                .andExpect(jsonPath("$.attachedConsumers").value(3))
                .andExpect(jsonPath("$.visibility").value("ACTIVE"))
                .andExpect(jsonPath("$.lastRun.type").value("aggressive"))
                .andExpect(jsonPath("$.lastRun.status").value("RECOVERED"))
                .andExpect(jsonPath("$.lastRun.timeHiddenMs").value(125000));
    }
}
