package com.fplrefresh.api.controller;

import com.fplrefresh.api.dto.ErrorBody;
import com.fplrefresh.api.dto.JobContextResponse;
import com.fplrefresh.api.dto.StateResponse;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.queue.JobContextEnricher;
import com.fplrefresh.state.RegimeService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * GET /api/v1/state (current regime) and GET /api/v1/jobs/{jobType}/context (what a job would see now).
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StateController {

    private final RegimeService regimeService;
    private final JobContextEnricher jobContextEnricher;

    @GetMapping("/state")
    public Mono<StateResponse> currentState() {
        return Mono.fromCallable(regimeService::currentState)
                .subscribeOn(Schedulers.boundedElastic())
                .map(s -> new StateResponse(true, s.regime().label(), s.details()));
    }

    @GetMapping("/jobs/{jobType}/context")
    public Mono<ResponseEntity<?>> jobContext(@PathVariable String jobType,
                                              @RequestParam(defaultValue = "api") String source) {
        Optional<JobType> type = JobType.parse(jobType);
        if (type.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_JOB_TYPE", "Unknown job type: " + jobType)));
        }
        return Mono.fromCallable(() -> jobContextEnricher.buildContext(type.get(), source))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(ctx -> ResponseEntity.ok(new JobContextResponse(true, ctx.toMap())));
    }
}
