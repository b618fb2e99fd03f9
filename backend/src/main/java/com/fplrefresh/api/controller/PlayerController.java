package com.fplrefresh.api.controller;

import com.fplrefresh.api.dto.PlayersResponse;
import com.fplrefresh.cache.EnrichedPlayerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /api/v1/players, optionally filtered by team and position (element type).
 */
@RestController
@RequestMapping("/api/v1/players")
@RequiredArgsConstructor
public class PlayerController {

    private final EnrichedPlayerService enrichedPlayerService;

    @GetMapping
    public Mono<PlayersResponse> players(@RequestParam(required = false) Integer teamId,
                                         @RequestParam(required = false) Integer position) {
        return Mono.fromCallable(() -> enrichedPlayerService.getPlayers(teamId, position))
                .subscribeOn(Schedulers.boundedElastic())
                .map(players -> new PlayersResponse(true, players.size(), players));
    }
}
