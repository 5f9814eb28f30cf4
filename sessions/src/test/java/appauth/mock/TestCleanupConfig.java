package appauth.mock;

import java.time.Duration;

import appauth.core.config.CleanupConfig;

/**
 * Mutable {@link CleanupConfig} with the production defaults, except a small page size.
 */
public class TestCleanupConfig implements CleanupConfig {

    public boolean enabled = true;
    public boolean includeExpired = false;
    public Duration maxAge = Duration.ofDays(30);
    public int pageSize = 2;

    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public String every() {
        return "1h";
    }

    @Override
    public String initialDelay() {
        return "5m";
    }

    @Override
    public boolean includeExpired() {
        return includeExpired;
    }

    @Override
    public Duration maxAge() {
        return maxAge;
    }

    @Override
    public int pageSize() {
        return pageSize;
    }
}
