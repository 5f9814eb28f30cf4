package appauth.adapter.in.cli;

import java.io.PrintStream;
import java.util.Arrays;

import jakarta.inject.Inject;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.jboss.logging.Logger;

import appauth.core.config.CleanupConfig;
import appauth.core.model.cleanup.SweepReport;
import appauth.core.port.in.SessionCleanup;
import appauth.core.port.in.SessionCleanup.SweepAbortedException;
import appauth.core.port.out.BackendUnavailableException;
import appauth.core.service.session.KeyValueBackendRegistry;
import appauth.spi.KeyValueBackendProvider;
import appauth.spi.StorageProviderException;

/**
 * Application entry point.
 *
 * <p>Without arguments the service runs until shut down. {@code cleanup [options]}
 * runs one consistency sweep, prints the report and exits:
 * <pre>
 *   java -jar appauth-sessions.jar cleanup --dry-run
 *   java -jar appauth-sessions.jar cleanup --include-expired --max-age-days 14
 * </pre>
 */
@QuarkusMain
public class SessionCleanupCommand implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(SessionCleanupCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BACKEND_UNAVAILABLE = 1;
    static final int EXIT_USAGE = 2;

    private final SessionCleanup sessionCleanup;
    private final KeyValueBackendRegistry backendRegistry;
    private final CleanupConfig cleanupConfig;
    private final PrintStream out;
    private final PrintStream err;

    @Inject
    public SessionCleanupCommand(
            SessionCleanup sessionCleanup,
            KeyValueBackendRegistry backendRegistry,
            CleanupConfig cleanupConfig) {
        this(sessionCleanup, backendRegistry, cleanupConfig, System.out, System.err);
    }

    SessionCleanupCommand(
            SessionCleanup sessionCleanup,
            KeyValueBackendRegistry backendRegistry,
            CleanupConfig cleanupConfig,
            PrintStream out,
            PrintStream err) {
        this.sessionCleanup = sessionCleanup;
        this.backendRegistry = backendRegistry;
        this.cleanupConfig = cleanupConfig;
        this.out = out;
        this.err = err;
    }

    @Override
    public int run(String... args) {
        if (args.length == 0) {
            Quarkus.waitForExit();
            return EXIT_OK;
        }
        if (!"cleanup".equals(args[0])) {
            err.println("Unknown command: " + args[0]);
            err.println(CleanupCommandOptions.USAGE);
            return EXIT_USAGE;
        }
        return cleanup(Arrays.copyOfRange(args, 1, args.length));
    }

    int cleanup(String... args) {
        CleanupCommandOptions options;
        try {
            options = CleanupCommandOptions.parse(args);
        } catch (CleanupCommandOptions.UsageException e) {
            err.println(e.getMessage());
            err.println(CleanupCommandOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CleanupCommandOptions.USAGE);
            return EXIT_OK;
        }

        try {
            KeyValueBackendProvider selected = backendRegistry.getSelectedProvider();
            if (!selected.isAvailable()) {
                err.printf("Backend '%s' is not reachable%n", selected.name());
                return EXIT_BACKEND_UNAVAILABLE;
            }

            LOG.infof("Running session cleanup in %s mode", options.mode());
            SweepReport report = sessionCleanup
                    .sweep(options.mode(), options.maxAge(cleanupConfig.maxAge()))
                    .await()
                    .indefinitely();
            out.println(report.render());
            return EXIT_OK;
        } catch (SweepAbortedException e) {
            err.println("Session cleanup aborted: " + e.getCause().getMessage());
            err.println(e.getPartialReport().render());
            return EXIT_BACKEND_UNAVAILABLE;
        } catch (BackendUnavailableException | StorageProviderException e) {
            err.println("Session backend unavailable: " + e.getMessage());
            return EXIT_BACKEND_UNAVAILABLE;
        }
    }
}
