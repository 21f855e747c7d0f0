package warden.adapter.out.telemetry;

import java.time.Duration;

import warden.core.port.out.CredentialMetrics;

/**
 * {@link CredentialMetrics} that records nothing.
 */
public final class NoOpCredentialMetrics implements CredentialMetrics {

    public static final NoOpCredentialMetrics INSTANCE = new NoOpCredentialMetrics();

    private NoOpCredentialMetrics() {}

    @Override
    public void recordRefresh(RefreshOutcome outcome, Duration duration) {}

    @Override
    public void recordCoalescedWait() {}

    @Override
    public void recordLockTimeout() {}
}
