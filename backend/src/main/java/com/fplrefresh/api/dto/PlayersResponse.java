package com.fplrefresh.api.dto;

import com.fplrefresh.cache.EnrichedPlayer;

import java.util.List;

public record PlayersResponse(boolean success, int count, List<EnrichedPlayer> players) {
}
