package com.fplrefresh.api.controller;

import com.fplrefresh.api.config.ApiConfig;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import com.fplrefresh.queue.JobNotFoundException;
import com.fplrefresh.queue.JobOptions;
import com.fplrefresh.queue.RefreshJobQueue;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = QueueController.class, properties = "fplrefresh.security.cron-secret=test-secret")
@Import(ApiConfig.class)
class QueueControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    RefreshJobQueue queue;

    @Test
    void enqueue_returnsAccepted() {
        when(queue.enqueue(eq(JobType.HOURLY_REFRESH), anyMap(), any())).thenReturn(Optional.of(job("j-1", JobStatus.WAITING)));

        webTestClient.post().uri("/api/v1/queue/hourly-refresh")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"gameweek\":12,\"jobId\":\"hourly-1\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.queued").isEqualTo(true)
                .jsonPath("$.jobId").isEqualTo("j-1")
                .jsonPath("$.queue").isEqualTo("hourly-refresh");

        ArgumentCaptor<JobOptions> options = ArgumentCaptor.forClass(JobOptions.class);
        verify(queue).enqueue(eq(JobType.HOURLY_REFRESH), eq(Map.of("gameweek", 12)), options.capture());
        assertThat(options.getValue().jobId()).isEqualTo("hourly-1");
        assertThat(options.getValue().triggeredBy()).isEqualTo("api");
    }

    @Test
    void enqueue_duplicateJobId_notQueued() {
        when(queue.enqueue(eq(JobType.LIVE_REFRESH), anyMap(), any())).thenReturn(Optional.empty());

        webTestClient.post().uri("/api/v1/queue/live-refresh")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"jobId\":\"live-1\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.queued").isEqualTo(false);
    }

    @Test
    void enqueue_gameweekOutOfRange_badRequest() {
        webTestClient.post().uri("/api/v1/queue/hourly-refresh")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"gameweek\":39}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_GAMEWEEK");
        verifyNoInteractions(queue);
    }

    @Test
    void unknownQueue_badRequest() {
        webTestClient.get().uri("/api/v1/queue/weekly-refresh/jobs")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_JOB_TYPE");
    }

    @Test
    void retry_unknownJob_notFound() {
        when(queue.retry("missing")).thenThrow(new JobNotFoundException("missing"));

        webTestClient.post().uri("/api/v1/queue/jobs/missing/retry")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void retry_activeJob_conflict() {
        when(queue.retry("j-2")).thenThrow(new IllegalStateException("Only failed jobs can be retried"));

        webTestClient.post().uri("/api/v1/queue/jobs/j-2/retry")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-secret")
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    private static RefreshJob job(String id, JobStatus status) {
        RefreshJob job = new RefreshJob();
        job.setId(id);
        job.setJobType(JobType.HOURLY_REFRESH);
        job.setStatus(status);
        job.setCreatedAt(Instant.parse("2025-03-15T12:00:00Z"));
        return job;
    }
}
