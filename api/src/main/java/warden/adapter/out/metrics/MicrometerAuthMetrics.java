package warden.adapter.out.metrics;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.port.out.AuthMetrics;

/**
 * Records authentication metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.auth.logins} - Login attempts by outcome</li>
 *   <li>{@code warden.auth.lockouts} - Accounts reaching the lockout threshold</li>
 *   <li>{@code warden.tokens.revoked} - Tokens added to the blacklist</li>
 *   <li>{@code warden.sessions.terminated} - Sessions ended by logout-everywhere or termination</li>
 *   <li>{@code warden.events.dropped} - Outbound events that were never delivered</li>
 *   <li>{@code warden.store.timeouts} / {@code warden.store.failures} - Key-value store errors by operation</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordLogin(String outcome) {
        Counter.builder("warden.auth.logins")
                .description("Login attempts by outcome")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockout() {
        Counter.builder("warden.auth.lockouts")
                .description("Accounts locked after repeated login failures")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokensRevoked(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("warden.tokens.revoked")
                .description("Tokens added to the revocation blacklist")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordSessionsTerminated(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("warden.sessions.terminated")
                .description("Sessions terminated explicitly")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordEventDropped(String eventName) {
        Counter.builder("warden.events.dropped")
                .description("Outbound auth events that were not delivered")
                .tag("event", nullSafe(eventName))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String operation) {
        Counter.builder("warden.store.timeouts")
                .description("Key-value store operations that timed out")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String operation) {
        Counter.builder("warden.store.failures")
                .description("Key-value store operations that failed")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
