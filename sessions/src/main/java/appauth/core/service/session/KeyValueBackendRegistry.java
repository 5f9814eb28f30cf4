package appauth.core.service.session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import appauth.core.config.SessionConfig;
import appauth.core.port.out.KeyValueBackend;
import appauth.spi.KeyValueBackendProvider;
import appauth.spi.StorageProviderException;

/**
 * Registry for key-value backend providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability. Session, state and sweep services
 * all share the backend selected here.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (appauth.session.storage.provider), even when it is not
 *       reachable at startup: its operations then fail with
 *       {@code BackendUnavailableException} instead of silently serving an empty store</li>
 *   <li>For an unknown provider name, the highest priority available provider. The
 *       in-memory provider is only chosen when memory itself is configured</li>
 * </ol>
 */
@ApplicationScoped
public class KeyValueBackendRegistry {

    private static final Logger LOG = Logger.getLogger(KeyValueBackendRegistry.class);
    private static final String MEMORY = "memory";

    private final Iterable<KeyValueBackendProvider> providers;
    private final SessionConfig config;

    private volatile KeyValueBackendProvider selectedProvider;
    private volatile KeyValueBackend backend;

    @Inject
    public KeyValueBackendRegistry(Instance<KeyValueBackendProvider> providers, SessionConfig config) {
        this((Iterable<KeyValueBackendProvider>) providers, config);
    }

    /**
     * Create a registry over an explicit provider list (tools and tests without CDI).
     */
    public KeyValueBackendRegistry(Iterable<KeyValueBackendProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup rather than on the first request,
     * which may run on the event loop where blocking is forbidden.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Key-value backend initialized: %s", selectedProvider.name());
    }

    /**
     * Get the backend from the selected provider.
     *
     * @return Backend instance
     */
    public KeyValueBackend getBackend() {
        if (backend == null) {
            synchronized (this) {
                if (backend == null) {
                    backend = getSelectedProvider().createBackend();
                }
            }
        }
        return backend;
    }

    /**
     * Get the selected provider.
     *
     * @return Selected provider
     */
    public KeyValueBackendProvider getSelectedProvider() {
        if (selectedProvider == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
            }
        }
        return selectedProvider;
    }

    private KeyValueBackendProvider selectProvider() {
        String configuredProvider = config.storage().provider();

        Optional<KeyValueBackendProvider> configured = allProviders().stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            KeyValueBackendProvider provider = configured.get();
            if (provider.isAvailable()) {
                LOG.infof("Using configured key-value backend: %s", configuredProvider);
            } else {
                // Operations fail as unavailable until the backend recovers
                LOG.warnf(
                        "Configured key-value backend '%s' is not reachable, keeping it selected", configuredProvider);
            }
            return provider;
        }

        List<KeyValueBackendProvider> candidates = getAvailableProviders().stream()
                .filter(p -> MEMORY.equals(configuredProvider) || !MEMORY.equals(p.name()))
                .sorted(Comparator.comparingInt(KeyValueBackendProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Candidate key-value backend providers: %s",
                candidates.stream().map(KeyValueBackendProvider::name).toList());

        if (!candidates.isEmpty()) {
            KeyValueBackendProvider provider = candidates.get(0);
            LOG.warnf(
                    "Configured key-value backend '%s' is unknown, using %s (priority: %d)",
                    configuredProvider, provider.name(), provider.priority());
            return provider;
        }

        throw new StorageProviderException("No key-value backend available for '" + configuredProvider + "'");
    }

    private List<KeyValueBackendProvider> allProviders() {
        List<KeyValueBackendProvider> all = new ArrayList<>();
        providers.forEach(all::add);
        return all;
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<KeyValueBackendProvider> getAvailableProviders() {
        List<KeyValueBackendProvider> available = new ArrayList<>();
        for (KeyValueBackendProvider provider : providers) {
            if (provider.isAvailable()) {
                available.add(provider);
            }
        }
        return available;
    }
}
