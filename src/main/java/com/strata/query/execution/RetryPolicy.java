package com.strata.query.execution;

import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed backend round trip is sent again.
 *
 * Connection-level failures are retried. Read timeouts are not: the backend
 * is already slow and a retry only adds load. Anything unrecognised aborts.
 */
@Component
public class RetryPolicy {

    public enum Decision {
        RETRY,
        ABORT
    }

    public Decision decide(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof ReadTimeoutException || cause instanceof TimeoutException) {
                return Decision.ABORT;
            }
            if (cause instanceof IOException) {
                return Decision.RETRY;
            }
        }
        return Decision.ABORT;
    }

    public boolean shouldRetry(Throwable error) {
        return decide(error) == Decision.RETRY;
    }
}
