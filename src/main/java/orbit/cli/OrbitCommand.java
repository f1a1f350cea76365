package orbit.cli;

import ch.qos.logback.classic.Level;
import orbit.error.OrbitException;
import orbit.error.OrchestrationException;
import orbit.manager.config.ManagerEndpoint;
import orbit.onboarding.Orbit;
import orbit.onboarding.config.OrbitConfig;
import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.inventory.DeviceInventory;
import orbit.onboarding.inventory.InventoryLoader;
import orbit.onboarding.model.OnboardingResult;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command-line interface.
 *
 * <pre>
 * orbit onboard inventory.yaml --timeout 900
 * orbit -v backup -m vmanage.example.com -u admin -p secret ./backup
 * orbit restore -m vmanage.example.com -u admin -p secret --attach ./backup
 * </pre>
 */
@Command(name = "orbit",
        mixinStandardHelpOptions = true,
        version = "orbit 0.1.0",
        description = "Onboarding, Registration, Bootstrap & Integration Toolkit for SD-WAN fleets",
        subcommands = {
                OrbitCommand.OnboardCommand.class,
                OrbitCommand.BackupCommand.class,
                OrbitCommand.RestoreCommand.class
        })
public class OrbitCommand implements Runnable {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(OrbitCommand.class);

    /**
     * Creates the facade for a loaded inventory.
     */
    @FunctionalInterface
    public interface OrbitFactory {
        Orbit create(DeviceInventory inventory, OnboardingListener listener);
    }

    @Option(names = {"-v", "--verbose"}, description = "Increase verbosity (-v for INFO, -vv for DEBUG)")
    boolean[] verbose = new boolean[0];

    @Spec
    CommandSpec spec;

    private final OrbitFactory factory;

    public OrbitCommand() {
        this((inventory, listener) -> Orbit.fromInventory(inventory, OrbitConfig.fromEnv(), listener));
    }

    public OrbitCommand(OrbitFactory factory) {
        this.factory = factory;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    void configureLogging() {
        Level level = verbose.length >= 2 ? Level.DEBUG : verbose.length == 1 ? Level.INFO : Level.WARN;
        org.slf4j.Logger logger = LoggerFactory.getLogger("orbit");
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(level);
        }
    }

    /**
     * Run {@code action} with a shutdown hook that aborts the in-flight wait.
     */
    static <T> T withAbortHook(Orbit orbit, Callable<T> action) throws Exception {
        Thread hook = new Thread(() -> orbit.abortSignal().abort("process shutdown"), "orbit-abort");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return action.call();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown in progress, abort hook left registered");
            }
        }
    }

    static String describe(OrbitException e) {
        if (e instanceof OrchestrationException && e.getCause() != null) {
            return e.getCause().getMessage();
        }
        return e.getMessage();
    }

    static int fail(PrintWriter err, String operation, Exception e) {
        if (e instanceof OrbitException) {
            err.println(operation + " failed: " + describe((OrbitException) e));
        } else {
            err.println("Unexpected error: " + e.getMessage());
        }
        err.flush();
        return 1;
    }

    private static ManagerEndpoint endpoint(ManagerOptions options) {
        return new ManagerEndpoint(options.manager, options.username, options.password, options.port, false);
    }

    /** Manager connection options shared by backup and restore */
    static class ManagerOptions {
        @Option(names = {"-m", "--manager"}, required = true, description = "Manager URL")
        String manager;

        @Option(names = {"-u", "--username"}, required = true, description = "Manager username")
        String username;

        @Option(names = {"-p", "--password"}, required = true, description = "Manager password")
        String password;

        @Option(names = "--port", defaultValue = "443", description = "Manager port (default: ${DEFAULT-VALUE})")
        int port;
    }

    @Command(name = "onboard", description = "Onboard devices from a device inventory file")
    static class OnboardCommand implements Callable<Integer> {

        @ParentCommand
        OrbitCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "DEVICE_FILE", description = "Inventory file (YAML or JSON)")
        Path deviceFile;

        boolean skipExisting = true;
        boolean waitForReady = true;

        @Option(names = "--skip-existing", description = "Skip already onboarded devices (default)")
        void setSkipExisting(boolean flag) {
            if (flag) {
                skipExisting = true;
            }
        }

        @Option(names = "--no-skip-existing", description = "Register every device, even if already onboarded")
        void setNoSkipExisting(boolean flag) {
            if (flag) {
                skipExisting = false;
            }
        }

        @Option(names = "--wait", description = "Wait for devices to be ready (default)")
        void setWait(boolean flag) {
            if (flag) {
                waitForReady = true;
            }
        }

        @Option(names = "--no-wait", description = "Return without waiting for readiness")
        void setNoWait(boolean flag) {
            if (flag) {
                waitForReady = false;
            }
        }

        @Option(names = "--timeout",
                description = "Timeout in seconds for each readiness wait (default: ORBIT_READY_TIMEOUT or 600)")
        Long timeoutSeconds;

        @Override
        public Integer call() {
            parent.configureLogging();
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            try {
                out.println("Loading device inventory from " + deviceFile);
                DeviceInventory inventory = InventoryLoader.load(deviceFile);

                try (Orbit orbit = parent.factory.create(inventory, new ConsoleListener(out))) {
                    OnboardingResult result = withAbortHook(orbit,
                            () -> timeoutSeconds == null
                                    ? orbit.onboard(skipExisting, waitForReady)
                                    : orbit.onboard(skipExisting, waitForReady, Duration.ofSeconds(timeoutSeconds)));

                    out.println();
                    out.println("Onboarding complete!");
                    out.println("Controllers: " + result.controllers().size());
                    out.println("Validators: " + result.validators().size());
                    out.println("Edges: " + result.edges().size());
                    out.flush();
                }
                return 0;
            } catch (Exception e) {
                return fail(err, "Onboarding", e);
            }
        }
    }

    @Command(name = "backup", description = "Back up manager configuration to a directory")
    static class BackupCommand implements Callable<Integer> {

        @ParentCommand
        OrbitCommand parent;

        @Spec
        CommandSpec spec;

        @CommandLine.Mixin
        ManagerOptions managerOptions = new ManagerOptions();

        @Option(names = "--no-mrf", description = "Skip MRF region backup")
        boolean noMrf;

        @Parameters(index = "0", paramLabel = "OUTPUT_DIR")
        Path outputDir;

        @Override
        public Integer call() {
            parent.configureLogging();
            PrintWriter out = spec.commandLine().getOut();

            try {
                out.println("Starting backup to " + outputDir);
                DeviceInventory inventory = DeviceInventory.managerOnly(endpoint(managerOptions));
                try (Orbit orbit = parent.factory.create(inventory, OnboardingListener.NOOP)) {
                    withAbortHook(orbit, () -> orbit.backup(outputDir, !noMrf));
                }
                out.println("Backup complete! Saved to " + outputDir);
                out.flush();
                return 0;
            } catch (Exception e) {
                return fail(spec.commandLine().getErr(), "Backup", e);
            }
        }
    }

    @Command(name = "restore", description = "Restore manager configuration from a backup directory")
    static class RestoreCommand implements Callable<Integer> {

        @ParentCommand
        OrbitCommand parent;

        @Spec
        CommandSpec spec;

        @CommandLine.Mixin
        ManagerOptions managerOptions = new ManagerOptions();

        @Option(names = "--attach", description = "Attach templates after restore")
        boolean attach;

        @Option(names = "--no-mrf", description = "Skip MRF region restore")
        boolean noMrf;

        @Parameters(index = "0", paramLabel = "BACKUP_DIR")
        Path backupDir;

        @Override
        public Integer call() {
            parent.configureLogging();
            PrintWriter out = spec.commandLine().getOut();

            try {
                out.println("Starting restore from " + backupDir);
                DeviceInventory inventory = DeviceInventory.managerOnly(endpoint(managerOptions));
                try (Orbit orbit = parent.factory.create(inventory, OnboardingListener.NOOP)) {
                    withAbortHook(orbit, () -> orbit.restore(backupDir, attach, !noMrf));
                }
                out.println("Restore complete!");
                out.flush();
                return 0;
            } catch (Exception e) {
                return fail(spec.commandLine().getErr(), "Restore", e);
            }
        }
    }
}
