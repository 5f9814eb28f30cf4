package appauth.adapter.in.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import appauth.adapter.in.cli.CleanupCommandOptions.UsageException;
import appauth.core.model.cleanup.SweepMode;

@DisplayName("CleanupCommandOptions")
class CleanupCommandOptionsTest {

    @Test
    @DisplayName("should repair orphans without flags")
    void shouldDefaultToOrphanRepair() {
        var options = CleanupCommandOptions.parse();

        assertEquals(SweepMode.REPAIR_ORPHANS, options.mode());
        assertEquals(Duration.ofDays(30), options.maxAge(Duration.ofDays(30)));
        assertFalse(options.help());
    }

    @Test
    @DisplayName("should let --dry-run win over --include-expired")
    void shouldPreferDryRun() {
        var options = CleanupCommandOptions.parse("--include-expired", "--dry-run");

        assertEquals(SweepMode.REPORT, options.mode());
    }

    @Test
    @DisplayName("should parse expired repair with a custom age")
    void shouldParseMaxAge() {
        var options = CleanupCommandOptions.parse("--include-expired", "--max-age-days", "7");

        assertEquals(SweepMode.REPAIR_ORPHANS_AND_EXPIRED, options.mode());
        assertEquals(Optional.of(7), options.maxAgeDays());
        assertEquals(Duration.ofDays(7), options.maxAge(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("should recognise help")
    void shouldParseHelp() {
        assertTrue(CleanupCommandOptions.parse("--help").help());
        assertTrue(CleanupCommandOptions.parse("-h").help());
    }

    @Test
    @DisplayName("should reject unknown options and bad ages")
    void shouldRejectBadInput() {
        assertThrows(UsageException.class, () -> CleanupCommandOptions.parse("--force"));
        assertThrows(UsageException.class, () -> CleanupCommandOptions.parse("--max-age-days"));
        assertThrows(UsageException.class, () -> CleanupCommandOptions.parse("--max-age-days", "soon"));
        assertThrows(UsageException.class, () -> CleanupCommandOptions.parse("--max-age-days", "0"));
    }
}
