package com.fplrefresh.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit row written after each refresh. Never updated.
 */
@Document(collection = "refresh_logs")
@CompoundIndex(name = "type_created", def = "{'type': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
public class RefreshLog {

    @Id
    private String id;
    private String type;
    private String state;
    private Map<String, Object> details;
    private Instant createdAt;

    public static RefreshLog of(String type, String state, Map<String, Object> details, Instant createdAt) {
        RefreshLog log = new RefreshLog();
        log.setType(type);
        log.setState(state);
        log.setDetails(details);
        log.setCreatedAt(createdAt);
        return log;
    }
}
