package com.strata.query.execution;

import com.strata.query.QueryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Flags malformed referrers. Queries are never rejected for their referrer.
 */
@Component
public class ReferrerValidator {

    private static final Logger log = LoggerFactory.getLogger(ReferrerValidator.class);

    private static final Pattern REFERRER = Pattern.compile("^[a-zA-Z0-9_][a-zA-Z0-9_.:\\-]*$");

    private final QueryMetrics metrics;

    public ReferrerValidator(QueryMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @return true when the referrer is present and well formed
     */
    public boolean validate(String referrer) {
        if (referrer == null || referrer.isEmpty()) {
            return false;
        }
        if (REFERRER.matcher(referrer).matches()) {
            return true;
        }
        log.warn("Referrer {} is not a valid referrer name", referrer);
        metrics.recordInvalidReferrer(referrer);
        return false;
    }
}
