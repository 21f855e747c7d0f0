package warden.adapter.out.telemetry;

import java.time.Duration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.config.WardenConfig;
import warden.core.port.out.CredentialMetrics;

/**
 * Micrometer implementation of {@link CredentialMetrics}.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.refresh.total} - Refresh attempts by outcome</li>
 *   <li>{@code warden.refresh.duration} - Refresh latency by outcome</li>
 *   <li>{@code warden.refresh.coalesced} - Callers that joined an in-flight refresh</li>
 *   <li>{@code warden.lock.timeouts} - Waits that hit their deadline</li>
 * </ul>
 */
public class MicrometerCredentialMetrics implements CredentialMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    public MicrometerCredentialMetrics(MeterRegistry registry, WardenConfig config) {
        this.registry = registry;
        this.enabled = config == null || config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRefresh(RefreshOutcome outcome, Duration duration) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.refresh.total")
                .description("Coordinated token refresh attempts")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();

        Timer.builder("warden.refresh.duration")
                .description("Coordinated token refresh latency")
                .tag("outcome", outcome.name().toLowerCase())
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(duration);
    }

    @Override
    public void recordCoalescedWait() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.refresh.coalesced")
                .description("Callers that waited on an in-flight refresh")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockTimeout() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.lock.timeouts")
                .description("Refresh waits that exceeded their deadline")
                .register(registry)
                .increment();
    }
}
