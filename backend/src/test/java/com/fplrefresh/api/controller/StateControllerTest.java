package com.fplrefresh.api.controller;

import com.fplrefresh.api.config.ApiConfig;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.Regime;
import com.fplrefresh.queue.JobContext;
import com.fplrefresh.queue.JobContextEnricher;
import com.fplrefresh.state.RegimeService;
import com.fplrefresh.state.StateSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = StateController.class, properties = "fplrefresh.security.cron-secret=test-secret")
@Import(ApiConfig.class)
class StateControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    RegimeService regimeService;
    @MockBean
    JobContextEnricher jobContextEnricher;

    @Test
    void state_returnsRegimeLabel() {
        when(regimeService.currentState())
                .thenReturn(new StateSnapshot(Regime.PRE_DEADLINE, Map.of("minutesToDeadline", 120)));

        webTestClient.get().uri("/api/v1/state")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.state").isEqualTo("pre-deadline")
                .jsonPath("$.details.minutesToDeadline").isEqualTo(120);
    }

    @Test
    void jobContext_unknownType_badRequest() {
        webTestClient.get().uri("/api/v1/jobs/weekly-refresh/context")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_JOB_TYPE");
    }

    @Test
    void jobContext_returnsEnrichedContext() {
        JobContext context = new JobContext(JobType.LIVE_REFRESH, "live", 4, null, "api", 1,
                Regime.LIVE_MATCH, true, Instant.parse("2024-09-14T15:00:00Z"));
        when(jobContextEnricher.buildContext(JobType.LIVE_REFRESH, "api")).thenReturn(context);

        webTestClient.get().uri("/api/v1/jobs/live-refresh/context")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.context.priority").isEqualTo(1)
                .jsonPath("$.context.regime").isEqualTo("live-match");
    }
}
