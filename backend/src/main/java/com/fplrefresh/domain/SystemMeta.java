package com.fplrefresh.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Key/value markers (last_refresh, schedule_windows).
 */
@Document(collection = "system_meta")
@NoArgsConstructor
@Getter
@Setter
public class SystemMeta {

    public static final String LAST_REFRESH = "last_refresh";
    public static final String SCHEDULE_WINDOWS = "schedule_windows";

    @Id
    private String key;
    private Map<String, Object> value;
    private Instant updatedAt;
}
