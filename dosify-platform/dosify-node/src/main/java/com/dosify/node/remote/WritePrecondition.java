package com.dosify.node.remote;

import java.time.Instant;

/**
 * Version check attached to a remote write.
 * The write is rejected with PRECONDITION_FAILED when the stored document does not match.
 *
 * @param expectedLastUpdate the {@code lastUpdate} the writer last saw, or null
 * @param mustNotExist       true when the writer never saw the document
 */
public record WritePrecondition(Instant expectedLastUpdate, boolean mustNotExist) {

    private static final WritePrecondition ABSENT = new WritePrecondition(null, true);

    public WritePrecondition {
        if (mustNotExist && expectedLastUpdate != null) {
            throw new IllegalArgumentException("A precondition cannot expect both absence and a version");
        }
    }

    public static WritePrecondition absent() {
        return ABSENT;
    }

    public static WritePrecondition lastUpdateEquals(Instant lastUpdate) {
        if (lastUpdate == null) {
            throw new IllegalArgumentException("Last update cannot be null");
        }
        return new WritePrecondition(lastUpdate, false);
    }

    public boolean isNone() {
        return expectedLastUpdate == null && !mustNotExist;
    }
}
