package com.fplrefresh.api.controller;

import com.fplrefresh.api.dto.ErrorBody;
import com.fplrefresh.api.dto.RefreshResponse;
import com.fplrefresh.refresh.RefreshManager;
import com.fplrefresh.refresh.RefreshResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Supplier;

/**
 * Synchronous refresh triggers for external cron callers: GET or POST /api/v1/refresh/{type}.
 * The refresh runs on the bounded-elastic pool since it blocks on upstream and MongoDB.
 */
@RestController
@RequestMapping("/api/v1/refresh")
@RequiredArgsConstructor
public class RefreshController {

    private final RefreshManager refreshManager;

    @RequestMapping(path = "/{type}", method = { RequestMethod.GET, RequestMethod.POST })
    public Mono<ResponseEntity<?>> refresh(@PathVariable String type,
                                           @RequestParam(required = false) String adminId) {
        Supplier<RefreshResult> operation = operationFor(type, adminId);
        if (operation == null) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_REFRESH_TYPE", "Unknown refresh type: " + type)));
        }
        return Mono.fromCallable(operation::get)
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(result -> ResponseEntity.ok(RefreshResponse.of(type, result)));
    }

    @PostMapping("/player/{playerId}")
    public Mono<ResponseEntity<RefreshResponse>> refreshPlayer(@PathVariable int playerId) {
        return Mono.fromCallable(() -> refreshManager.performPlayerRefresh(playerId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(RefreshResponse.of(RefreshManager.TYPE_PLAYER, result)));
    }

    private Supplier<RefreshResult> operationFor(String type, String adminId) {
        return switch (type) {
            case RefreshManager.TYPE_LIVE -> refreshManager::performLiveRefresh;
            case RefreshManager.TYPE_POST_MATCH -> refreshManager::performPostMatchRefresh;
            case RefreshManager.TYPE_PRE_DEADLINE -> refreshManager::performPreDeadlineRefresh;
            case RefreshManager.TYPE_REGULAR -> refreshManager::performRegularRefresh;
            case RefreshManager.TYPE_INCREMENTAL, "hourly" -> refreshManager::performIncrementalRefresh;
            case RefreshManager.TYPE_FULL, "daily" -> refreshManager::performFullRefresh;
            case RefreshManager.TYPE_SCHEDULE -> refreshManager::performScheduleUpdate;
            case RefreshManager.TYPE_MANUAL -> () -> refreshManager.performManualRefresh(adminId);
            default -> null;
        };
    }
}
