package appauth.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import appauth.core.service.session.KeyValueBackendRegistry;

/**
 * Readiness check for the selected key-value backend.
 *
 * <p>Delegates to the selected provider's own health check. A backend that cannot
 * be reached makes the service not ready, since sessions can then be neither
 * verified nor issued.
 */
@Readiness
@ApplicationScoped
public class KeyValueBackendHealthCheck implements HealthCheck {

    private final KeyValueBackendRegistry backendRegistry;

    @Inject
    public KeyValueBackendHealthCheck(KeyValueBackendRegistry backendRegistry) {
        this.backendRegistry = backendRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        var provider = backendRegistry.getSelectedProvider();
        return provider.healthCheck().orElseGet(() -> HealthCheckResponse.named("session-backend")
                .up()
                .withData("provider", provider.name())
                .build());
    }
}
