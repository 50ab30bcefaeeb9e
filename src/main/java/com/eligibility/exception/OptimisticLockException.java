package com.eligibility.exception;

/**
 * Exception thrown when a rule version write observes a stale version counter.
 * The caller must re-fetch and retry.
 */
public class OptimisticLockException extends EligibilityException {

    private final String versionId;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticLockException(String versionId, long expectedVersion, long actualVersion) {
        super("Rule version " + versionId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
        this.versionId = versionId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public OptimisticLockException(String message) {
        super(message);
        this.versionId = null;
        this.expectedVersion = -1;
        this.actualVersion = -1;
    }

    public String getVersionId() {
        return versionId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
