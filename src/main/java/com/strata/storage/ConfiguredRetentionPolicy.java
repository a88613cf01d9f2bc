package com.strata.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Retention read from configuration: one default plus optional per-organization
 * overrides given as {@code orgId:days} pairs. A non-positive value means
 * unlimited retention.
 */
@Component
public class ConfiguredRetentionPolicy implements RetentionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredRetentionPolicy.class);

    private final int defaultDays;
    private final Map<Long, Integer> overrides;

    public ConfiguredRetentionPolicy(
            @Value("${strata.gateway.retention.default-days:90}") int defaultDays,
            @Value("${strata.gateway.retention.overrides:}") String overrides) {
        this.defaultDays = defaultDays;
        this.overrides = parseOverrides(overrides);
        log.info("Retention policy: default={} days, {} organization overrides", defaultDays, this.overrides.size());
    }

    @Override
    public Integer retentionDays(long organizationId) {
        int days = overrides.getOrDefault(organizationId, defaultDays);
        return days > 0 ? days : null;
    }

    static Map<Long, Integer> parseOverrides(String value) {
        Map<Long, Integer> result = new HashMap<>();
        if (value == null || value.trim().isEmpty()) {
            return result;
        }
        for (String entry : value.split(",")) {
            String[] parts = entry.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid retention override: " + entry);
            }
            result.put(Long.parseLong(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        }
        return result;
    }
}
