package com.fplrefresh.refresh;

import com.fplrefresh.domain.RefreshLog;
import com.fplrefresh.domain.RefreshLogRepository;
import com.fplrefresh.domain.SystemMeta;
import com.fplrefresh.domain.SystemMetaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends refresh_logs rows and keeps the {@code last_refresh} marker in system_meta current.
 * A failure to write the audit trail is logged and does not fail the refresh it describes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RefreshLogService {

    private final RefreshLogRepository refreshLogRepository;
    private final SystemMetaRepository systemMetaRepository;
    private final Clock clock;

    public void record(String type, String state, Map<String, Object> details) {
        Instant now = clock.instant();
        try {
            refreshLogRepository.insert(RefreshLog.of(type, state, details, now));

            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("type", type);
            marker.put("state", state);
            marker.put("timestamp", now.toString());
            SystemMeta meta = new SystemMeta();
            meta.setKey(SystemMeta.LAST_REFRESH);
            meta.setValue(marker);
            meta.setUpdatedAt(now);
            systemMetaRepository.save(meta);
        } catch (RuntimeException e) {
            log.error("Failed to record refresh log type={} state={}: {}", type, state, e.getMessage());
        }
    }
}
