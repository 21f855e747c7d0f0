package warden.core.port.out;

import java.time.Duration;

/**
 * Port for recording credential lifecycle metrics.
 */
public interface CredentialMetrics {

    /**
     * Outcome of a coordinated refresh attempt.
     */
    enum RefreshOutcome {
        /** The leader called the token endpoint and stored the result. */
        REFRESHED,
        /** The re-read after locking showed another process already refreshed. */
        SKIPPED,
        FAILED
    }

    void recordRefresh(RefreshOutcome outcome, Duration duration);

    /**
     * A caller waited on another thread's in-flight refresh instead of starting its own.
     */
    void recordCoalescedWait();

    void recordLockTimeout();
}
