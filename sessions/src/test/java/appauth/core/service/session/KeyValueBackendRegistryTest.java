package appauth.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import appauth.core.port.out.KeyValueBackend;
import appauth.mock.FixedBackendProvider;
import appauth.mock.TestSessionConfig;
import appauth.spi.StorageProviderException;

@DisplayName("KeyValueBackendRegistry")
class KeyValueBackendRegistryTest {

    private TestSessionConfig config;
    private KeyValueBackend redisBackend;
    private KeyValueBackend memoryBackend;

    @BeforeEach
    void setUp() {
        config = new TestSessionConfig();
        redisBackend = mock(KeyValueBackend.class);
        memoryBackend = mock(KeyValueBackend.class);
    }

    private FixedBackendProvider redis(boolean available) {
        return new FixedBackendProvider("redis", 100, available, redisBackend);
    }

    private FixedBackendProvider memory() {
        return new FixedBackendProvider("memory", 0, true, memoryBackend);
    }

    @Test
    @DisplayName("should use the configured provider when it is available")
    void shouldUseConfiguredProvider() {
        config.provider = "memory";

        var registry = new KeyValueBackendRegistry(List.of(redis(true), memory()), config);

        assertEquals("memory", registry.getSelectedProvider().name());
        assertSame(memoryBackend, registry.getBackend());
    }

    @Test
    @DisplayName("should fall back to the highest priority available provider")
    void shouldFallBackByPriority() {
        config.provider = "cassandra";

        var registry = new KeyValueBackendRegistry(List.of(memory(), redis(true)), config);

        assertEquals("redis", registry.getSelectedProvider().name());
    }

    @Test
    @DisplayName("should keep an unreachable Redis selected instead of switching to memory")
    void shouldKeepUnreachableConfiguredProvider() {
        config.provider = "redis";

        var registry = new KeyValueBackendRegistry(List.of(redis(false), memory()), config);

        assertEquals("redis", registry.getSelectedProvider().name());
        assertSame(redisBackend, registry.getBackend());
        assertEquals(List.of("memory"), registry.getAvailableProviders().stream()
                .map(p -> p.name())
                .toList());
    }

    @Test
    @DisplayName("should not pick memory for an unknown provider name")
    void shouldNotPickMemoryForUnknownProvider() {
        config.provider = "cassandra";

        var registry = new KeyValueBackendRegistry(List.of(memory(), redis(false)), config);

        assertThrows(StorageProviderException.class, registry::getSelectedProvider);
    }

    @Test
    @DisplayName("should create the backend once")
    void shouldCacheBackend() {
        var registry = new KeyValueBackendRegistry(List.of(memory()), config);

        assertSame(registry.getBackend(), registry.getBackend());
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWithoutProviders() {
        var registry = new KeyValueBackendRegistry(List.of(redis(false)), config);

        assertThrows(StorageProviderException.class, registry::getSelectedProvider);
    }
}
