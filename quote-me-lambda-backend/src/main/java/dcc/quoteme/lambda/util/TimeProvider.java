package dcc.quoteme.lambda.util;

import java.time.Instant;

/**
 * Time provider interface for testability
 * Allows fixing the clock in unit tests
 */
public interface TimeProvider {
    /**
     * Returns the current time in milliseconds
     */
    long currentTimeMillis();

    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }
}
