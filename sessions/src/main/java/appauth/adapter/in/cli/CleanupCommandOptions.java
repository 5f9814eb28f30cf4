package appauth.adapter.in.cli;

import java.time.Duration;
import java.util.Optional;

import appauth.core.model.cleanup.SweepMode;

/**
 * Parsed flags of the {@code cleanup} command.
 *
 * @param dryRun report only, never write
 * @param includeExpired also delete live sessions older than the maximum age
 * @param maxAgeDays override for the configured maximum age
 * @param help print usage and exit
 */
public record CleanupCommandOptions(
        boolean dryRun, boolean includeExpired, Optional<Integer> maxAgeDays, boolean help) {

    static final String USAGE = String.join(
            "\n",
            "Usage: cleanup [options]",
            "",
            "Checks every user session index against the session records and repairs",
            "references to sessions that no longer exist.",
            "",
            "Options:",
            "  --dry-run            Report only; change nothing",
            "  --include-expired    Also delete sessions older than the maximum age",
            "  --max-age-days <n>   Maximum session age in days (default: appauth.cleanup.max-age)",
            "  --help               Show this message",
            "",
            "Exit status: 0 on success, 1 if the backend is unreachable, 2 on invalid usage.");

    public static CleanupCommandOptions parse(String... args) {
        boolean dryRun = false;
        boolean includeExpired = false;
        Integer maxAgeDays = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dry-run" -> dryRun = true;
                case "--include-expired" -> includeExpired = true;
                case "--help", "-h" -> help = true;
                case "--max-age-days" -> {
                    if (i + 1 >= args.length) {
                        throw new UsageException("--max-age-days requires a value");
                    }
                    maxAgeDays = parseDays(args[++i]);
                }
                default -> throw new UsageException("Unknown option: " + args[i]);
            }
        }

        return new CleanupCommandOptions(dryRun, includeExpired, Optional.ofNullable(maxAgeDays), help);
    }

    private static int parseDays(String value) {
        int days;
        try {
            days = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--max-age-days must be a whole number of days: " + value);
        }
        if (days <= 0) {
            throw new UsageException("--max-age-days must be positive: " + value);
        }
        return days;
    }

    public SweepMode mode() {
        return SweepMode.of(dryRun, includeExpired);
    }

    public Duration maxAge(Duration configured) {
        return maxAgeDays.map(Duration::ofDays).orElse(configured);
    }

    /**
     * Invalid command line.
     */
    public static class UsageException extends IllegalArgumentException {
        public UsageException(String message) {
            super(message);
        }
    }
}
