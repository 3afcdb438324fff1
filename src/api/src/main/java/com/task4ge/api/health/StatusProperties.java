package com.task4ge.api.health;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "task4ge.status")
public record StatusProperties(
    @DefaultValue("1073741824") long gcThresholdBytes,
    @DefaultValue("5") int dbTimeoutSeconds
) {
}
