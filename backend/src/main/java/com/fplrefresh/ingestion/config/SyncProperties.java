package com.fplrefresh.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Diff-sync and regime-window tuning.
 */
@ConfigurationProperties(prefix = "fplrefresh.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Rows per upsert batch. Default 50. */
    private int batchSize = 50;

    /** Estimated match length, added to kickoff to estimate the final whistle. Default 2h. */
    private Duration matchDuration = Duration.ofHours(2);

    /** Trailing window after an estimated match end that counts as post-match. Default 4h. */
    private Duration postMatchWindow = Duration.ofHours(4);

    /** Lead time before the next deadline that counts as pre-deadline. Default 24h. */
    private Duration preDeadlineWindow = Duration.ofHours(24);

    /** Live window opens this long before kickoff when planning schedule windows. Default 15m. */
    private Duration liveWindowLead = Duration.ofMinutes(15);

    /** Post-match schedule window length after the estimated match end. Default 4h. */
    private Duration postMatchScheduleWindow = Duration.ofHours(4);

    /** How long the hash of the last persisted body is kept as the diff baseline. Default 48h. */
    private Duration baselineTtl = Duration.ofHours(48);
}
