package com.fplrefresh.api.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Shared secret for the trigger surface, sent as {@code Authorization: Bearer <secret>}.
 * When unset, every /api request is rejected.
 */
@ConfigurationProperties(prefix = "fplrefresh.security")
@NoArgsConstructor
@Getter
@Setter
public class SecurityProperties {

    private String cronSecret;

    /** Paths under this prefix require the secret. */
    private String protectedPathPrefix = "/api/";
}
