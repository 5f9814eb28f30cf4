package appauth.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionIdGenerator")
class SessionIdGeneratorTest {

    private final SessionIdGenerator generator = new SessionIdGenerator();

    @Test
    @DisplayName("should generate 43 URL-safe characters")
    void shouldGenerateUrlSafeIds() {
        String id = generator.generate();

        assertEquals(43, id.length());
        assertTrue(id.matches("^[A-Za-z0-9_-]+$"), "Session ID must be URL-safe Base64 without padding");
    }

    @Test
    @DisplayName("should use the URL-safe alphabet without padding")
    void shouldEncodeUrlSafe() {
        var allOnes = new SessionIdGenerator(new Random() {
            @Override
            public void nextBytes(byte[] bytes) {
                Arrays.fill(bytes, (byte) 0xFF);
            }
        });

        assertEquals("_".repeat(42) + "8", allOnes.generate());
    }

    @Test
    @DisplayName("should not repeat itself")
    void shouldGenerateUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.generate());
        }

        assertEquals(1000, ids.size());
    }
}
