package com.fplrefresh.api.dto;

import java.util.Map;

public record StateResponse(boolean success, String state, Map<String, Object> details) {
}
