package dcc.quoteme.lambda.util;

import java.time.Instant;

/**
 * Clock pinned to a fixed instant for unit tests.
 */
public class MockTimeProvider implements TimeProvider {
    private final long currentTime;

    public MockTimeProvider(long initialTime) {
        this.currentTime = initialTime;
    }

    public MockTimeProvider(Instant instant) {
        this(instant.toEpochMilli());
    }

    @Override
    public long currentTimeMillis() {
        return currentTime;
    }
}
