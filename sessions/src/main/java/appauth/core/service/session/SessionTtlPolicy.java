package appauth.core.service.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import appauth.core.config.SessionConfig;
import appauth.core.model.session.SessionRecord;

/**
 * Expiration arithmetic for sessions.
 *
 * <ul>
 *   <li>Logical expiry: {@code min(issuedAt + absoluteLifetime, now + window)}</li>
 *   <li>Storage TTL: {@code max(minTtl, expiry - now)}</li>
 *   <li>Renewal: only once half of the sliding window has elapsed, and only if the
 *       expiry actually moves forward</li>
 * </ul>
 *
 * <p>Stateless; the caller supplies "now".
 */
public final class SessionTtlPolicy {

    private final boolean slidingEnabled;
    private final Duration slidingWindow;
    private final Duration defaultTtl;
    private final Duration absoluteLifetime;
    private final Duration minTtl;

    public SessionTtlPolicy(
            boolean slidingEnabled,
            Duration slidingWindow,
            Duration defaultTtl,
            Duration absoluteLifetime,
            Duration minTtl) {
        if (slidingWindow.isNegative() || slidingWindow.isZero()) {
            throw new IllegalArgumentException("Sliding window must be positive");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Default TTL must be positive");
        }
        this.slidingEnabled = slidingEnabled;
        this.slidingWindow = slidingWindow;
        this.defaultTtl = defaultTtl;
        this.absoluteLifetime = absoluteLifetime == null || absoluteLifetime.isZero() ? null : absoluteLifetime;
        this.minTtl = minTtl == null || minTtl.isNegative() ? Duration.ZERO : minTtl;
    }

    public static SessionTtlPolicy from(SessionConfig config) {
        return new SessionTtlPolicy(
                config.sliding().enabled(),
                config.sliding().window(),
                config.defaultTtl(),
                config.absoluteLifetime().orElse(null),
                config.minTtl());
    }

    /**
     * Expiry of a freshly issued session.
     */
    public Instant initialExpiry(Instant issuedAt) {
        Duration lifetime = slidingEnabled ? slidingWindow : defaultTtl;
        return cap(issuedAt, issuedAt.plus(lifetime));
    }

    /**
     * The hard deadline for a session issued at {@code issuedAt}, if one is configured.
     */
    public Optional<Instant> absoluteDeadline(Instant issuedAt) {
        return absoluteLifetime == null ? Optional.empty() : Optional.of(issuedAt.plus(absoluteLifetime));
    }

    /**
     * Cache-native TTL to store alongside a record expiring at {@code expiresAt}.
     */
    public Duration storageTtl(Instant expiresAt, Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        if (remaining.compareTo(minTtl) < 0) {
            remaining = minTtl;
        }
        // Backends expire at a granularity of one second or finer; zero would mean "no TTL".
        return remaining.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : remaining;
    }

    /**
     * Compute the renewed expiry for {@code record}, if a write is warranted.
     *
     * @return the new expiry, or empty when sliding is disabled, the session has expired,
     *     less than half the window has elapsed, or the expiry would not move forward
     */
    public Optional<Instant> renewal(SessionRecord record, Instant now) {
        if (!slidingEnabled || record.expiresAt() == null || record.isExpired(now)) {
            return Optional.empty();
        }
        Instant candidate = cap(record.issuedAt(), now.plus(slidingWindow));
        if (!candidate.isAfter(record.expiresAt())) {
            return Optional.empty();
        }
        if (record.remaining(now).compareTo(slidingWindow.dividedBy(2)) > 0) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    private Instant cap(Instant issuedAt, Instant candidate) {
        if (issuedAt == null) {
            return candidate;
        }
        return absoluteDeadline(issuedAt).filter(candidate::isAfter).orElse(candidate);
    }
}
