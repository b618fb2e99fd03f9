package com.fplrefresh.api.dto;

import java.util.Map;

public record JobContextResponse(boolean success, Map<String, Object> context) {
}
