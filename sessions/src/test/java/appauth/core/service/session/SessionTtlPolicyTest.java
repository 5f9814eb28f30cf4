package appauth.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appauth.core.model.session.SessionRecord;

@DisplayName("SessionTtlPolicy")
class SessionTtlPolicyTest {

    private static final Instant ISSUED = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private static SessionRecord session(Instant expiresAt) {
        return new SessionRecord("s1", "u1", Map.of(), ISSUED, expiresAt, ISSUED);
    }

    @Nested
    @DisplayName("initialExpiry()")
    class InitialExpiryTests {

        @Test
        @DisplayName("should use the sliding window when sliding is enabled")
        void shouldUseSlidingWindow() {
            var policy = new SessionTtlPolicy(true, Duration.ofMinutes(30), HOUR, null, Duration.ofSeconds(60));

            assertEquals(ISSUED.plus(Duration.ofMinutes(30)), policy.initialExpiry(ISSUED));
        }

        @Test
        @DisplayName("should use the default TTL when sliding is disabled")
        void shouldUseDefaultTtl() {
            var policy = new SessionTtlPolicy(false, Duration.ofMinutes(30), HOUR, null, Duration.ofSeconds(60));

            assertEquals(ISSUED.plus(HOUR), policy.initialExpiry(ISSUED));
        }

        @Test
        @DisplayName("should be capped by a short absolute lifetime")
        void shouldBeCappedByAbsoluteLifetime() {
            var policy = new SessionTtlPolicy(true, HOUR, HOUR, Duration.ofMinutes(20), Duration.ofSeconds(60));

            assertEquals(ISSUED.plus(Duration.ofMinutes(20)), policy.initialExpiry(ISSUED));
        }

        @Test
        @DisplayName("should reject a non-positive window")
        void shouldRejectNonPositiveWindow() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new SessionTtlPolicy(true, Duration.ZERO, HOUR, null, Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("storageTtl()")
    class StorageTtlTests {

        private final SessionTtlPolicy policy =
                new SessionTtlPolicy(true, HOUR, HOUR, null, Duration.ofSeconds(60));

        @Test
        @DisplayName("should be the time left until expiry")
        void shouldBeTimeLeft() {
            assertEquals(Duration.ofMinutes(45), policy.storageTtl(ISSUED.plus(Duration.ofMinutes(45)), ISSUED));
        }

        @Test
        @DisplayName("should not go below the configured floor")
        void shouldRespectFloor() {
            assertEquals(Duration.ofSeconds(60), policy.storageTtl(ISSUED.plusSeconds(5), ISSUED));
            assertEquals(Duration.ofSeconds(60), policy.storageTtl(ISSUED.minusSeconds(5), ISSUED));
        }

        @Test
        @DisplayName("should never be zero even without a floor")
        void shouldNeverBeZero() {
            var noFloor = new SessionTtlPolicy(true, HOUR, HOUR, null, Duration.ZERO);

            assertEquals(Duration.ofSeconds(1), noFloor.storageTtl(ISSUED, ISSUED));
        }
    }

    @Nested
    @DisplayName("renewal()")
    class RenewalTests {

        @Test
        @DisplayName("should skip renewal while more than half the window remains")
        void shouldSkipEarlyRenewal() {
            var policy = new SessionTtlPolicy(true, HOUR, HOUR, null, Duration.ZERO);

            assertTrue(policy.renewal(session(ISSUED.plus(HOUR)), ISSUED.plus(Duration.ofMinutes(29)))
                    .isEmpty());
        }

        @Test
        @DisplayName("should slide the expiry once half the window has elapsed")
        void shouldSlideExpiry() {
            var policy = new SessionTtlPolicy(true, HOUR, HOUR, null, Duration.ZERO);
            Instant now = ISSUED.plus(Duration.ofMinutes(30));

            assertEquals(now.plus(HOUR), policy.renewal(session(ISSUED.plus(HOUR)), now).orElseThrow());
        }

        @Test
        @DisplayName("should stop at the absolute deadline")
        void shouldStopAtDeadline() {
            var policy = new SessionTtlPolicy(true, HOUR, HOUR, Duration.ofMinutes(80), Duration.ZERO);
            Instant deadline = ISSUED.plus(Duration.ofMinutes(80));

            assertEquals(
                    deadline,
                    policy.renewal(session(ISSUED.plus(HOUR)), ISSUED.plus(Duration.ofMinutes(45)))
                            .orElseThrow());
            assertTrue(policy.renewal(session(deadline), ISSUED.plus(Duration.ofMinutes(70)))
                    .isEmpty());
            assertEquals(deadline, policy.absoluteDeadline(ISSUED).orElseThrow());
        }

        @Test
        @DisplayName("should not renew an expired session")
        void shouldNotRenewExpired() {
            var policy = new SessionTtlPolicy(true, HOUR, HOUR, null, Duration.ZERO);

            assertTrue(policy.renewal(session(ISSUED.plus(HOUR)), ISSUED.plus(HOUR)).isEmpty());
        }

        @Test
        @DisplayName("should not renew when sliding is disabled")
        void shouldNotRenewWhenDisabled() {
            var policy = new SessionTtlPolicy(false, HOUR, HOUR, null, Duration.ZERO);

            assertTrue(policy.renewal(session(ISSUED.plus(HOUR)), ISSUED.plus(Duration.ofMinutes(50)))
                    .isEmpty());
        }
    }
}
