package appauth.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import appauth.adapter.out.storage.memory.InMemoryKeyValueBackend;
import appauth.core.service.session.KeyValueBackendRegistry;
import appauth.mock.FixedBackendProvider;
import appauth.mock.TestSessionConfig;

@DisplayName("KeyValueBackendHealthCheck")
class KeyValueBackendHealthCheckTest {

    @Test
    @DisplayName("should report up when the provider has no health check of its own")
    void shouldReportUpByDefault() {
        var store = new InMemoryKeyValueBackend(Clock.systemUTC());
        try {
            var registry = new KeyValueBackendRegistry(List.of(new FixedBackendProvider(store)), new TestSessionConfig());

            HealthCheckResponse response = new KeyValueBackendHealthCheck(registry).call();

            assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
            assertEquals(Optional.of("memory"), response.getData().map(data -> data.get("provider")));
        } finally {
            store.shutdown();
        }
    }

    @Test
    @DisplayName("should relay the provider's verdict")
    void shouldRelayProviderVerdict() {
        var down = HealthCheckResponse.named("session-backend-redis").down().build();
        var provider = new FixedBackendProvider("redis", 100, true, null) {
            @Override
            public Optional<HealthCheckResponse> healthCheck() {
                return Optional.of(down);
            }
        };
        var config = new TestSessionConfig();
        config.provider = "redis";

        var response = new KeyValueBackendHealthCheck(new KeyValueBackendRegistry(List.of(provider), config)).call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("session-backend-redis", response.getName());
    }
}
