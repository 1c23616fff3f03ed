package speakermigrator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;
import speakermigrator.config.MigratorConfig;
import speakermigrator.config.MigratorConfigException;
import speakermigrator.config.MigratorConfigLoader;
import speakermigrator.engine.MigrationManager;
import speakermigrator.exceptions.MigrateException;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command line front end for {@link MigrationManager}.
 *
 * <p>Exit status is 0 on success, 1 when the operation fails and 2 on a usage or
 * configuration error. Operation logs go to stdout; the summary is printed as JSON.
 */
@Command(
        name = "migrator-cli",
        mixinStandardHelpOptions = true,
        description = "Redirects speakers from the vendor cloud to the local service",
        subcommands = {
                MigratorCli.SummaryCommand.class,
                MigratorCli.MigrateCommand.class,
                MigratorCli.RevertCommand.class,
                MigratorCli.BackupCommand.class,
                MigratorCli.TrustCaCommand.class,
                MigratorCli.TestConnectionCommand.class,
                MigratorCli.TestHostsCommand.class,
                MigratorCli.TestDnsCommand.class,
                MigratorCli.RebootCommand.class
        }
)
public class MigratorCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MigratorCli.class);

    static final int OK = CommandLine.ExitCode.OK;
    static final int FAILED = CommandLine.ExitCode.SOFTWARE;
    static final int USAGE = CommandLine.ExitCode.USAGE;

    @Option(names = "--config", paramLabel = "FILE", description = "Configuration file (.properties, .yml or .yaml)")
    Path configFile;

    @Spec
    CommandSpec spec;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<MigratorConfig, MigrationManager> managerFactory;
    private final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public MigratorCli(PrintStream out, PrintStream err, Function<MigratorConfig, MigrationManager> managerFactory) {
        this.out = out;
        this.err = err;
        this.managerFactory = managerFactory;
    }

    public static void main(String[] args) {
        System.exit(new MigratorCli(System.out, System.err, MigrationManager::create).execute(args));
    }

    /** Parses and runs one command line, returning the exit status. */
    public int execute(String... args) {
        return commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(this)
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true))
                .setExecutionExceptionHandler(this::handleFailure);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "missing command");
    }

    private int handleFailure(Exception e, CommandLine cmd, ParseResult parseResult) throws Exception {
        if (!(e instanceof MigrateException)) {
            throw e;
        }
        MigrateException failure = (MigrateException) e;
        log.debug("{} failed", cmd.getCommandName(), failure);
        if (failure.getLog() != null && !failure.getLog().isEmpty()) {
            cmd.getOut().println(failure.getLog());
        }
        cmd.getErr().println("error: " + failure.getMessage());
        return FAILED;
    }

    MigrationManager manager() {
        MigratorConfig config;
        try {
            config = configFile != null
                    ? MigratorConfigLoader.loadFromFile(configFile)
                    : MigratorConfigLoader.loadOrDefaults();
        } catch (IOException | MigratorConfigException e) {
            throw new ParameterException(spec.commandLine(), "cannot load configuration: " + e.getMessage(), e);
        }
        return managerFactory.apply(config);
    }

    int print(String text) {
        out.println(text);
        return OK;
    }

    /** Target and routing flags shared by the redirecting commands. */
    static final class RoutingOptions {

        @Option(names = "--target", paramLabel = "URL", description = "Target service URL (default: configured server URL)")
        String target;

        @Option(names = "--proxy", paramLabel = "URL", description = "Proxy URL for upstream routing")
        String proxy;

        @Option(names = "--option", paramLabel = "KEY=VALUE",
                description = "Subsystem routing, e.g. stats=upstream (marge, stats, sw_update, bmx)")
        Map<String, String> options;
    }

    @Command(name = "summary", description = "Dry-run report, nothing on the speaker changes")
    static final class SummaryCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Mixin
        RoutingOptions routing;

        @Override
        public Integer call() throws MigrateException {
            MigrationManager manager = parent.manager();
            try {
                return parent.print(parent.json.writeValueAsString(
                        manager.getMigrationSummary(address, routing.target, routing.proxy, routing.options)));
            } catch (JsonProcessingException e) {
                throw new MigrateException("cannot render summary: " + e.getOriginalMessage(), address, "summary", null, e);
            }
        }
    }

    @Command(name = "migrate", description = "Redirect the speaker to the target service")
    static final class MigrateCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Option(names = "--method", paramLabel = "METHOD", description = "xml, hosts or resolv (default: xml)")
        String method;

        @Mixin
        RoutingOptions routing;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager()
                    .migrateSpeaker(address, routing.target, routing.proxy, routing.options, method));
        }
    }

    @Command(name = "revert", description = "Restore the original configuration")
    static final class RevertCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().revertMigration(address));
        }
    }

    @Command(name = "backup", description = "Keep an on-device copy of the original configuration")
    static final class BackupCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().backupConfig(address));
        }
    }

    @Command(name = "trust-ca", description = "Add the local CA to the speaker's trust bundle")
    static final class TrustCaCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().trustCaCert(address));
        }
    }

    @Command(name = "test-connection", description = "Fetch a URL from the speaker")
    static final class TestConnectionCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Option(names = "--url", required = true, paramLabel = "URL", description = "URL to fetch")
        String url;

        @Option(names = "--explicit-ca", description = "Pass the local CA to curl explicitly")
        boolean explicitCa;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().testConnection(address, url, explicitCa));
        }
    }

    @Command(name = "test-hosts", description = "Check that vendor domains resolve to the target")
    static final class TestHostsCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Option(names = "--target", paramLabel = "URL", description = "Target service URL")
        String target;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().testHostsRedirection(address, target));
        }
    }

    @Command(name = "test-dns", description = "Query the local DNS service from the speaker")
    static final class TestDnsCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Option(names = "--target", paramLabel = "URL", description = "Target service URL")
        String target;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().testDnsRedirection(address, target));
        }
    }

    @Command(name = "reboot", description = "Reboot the speaker")
    static final class RebootCommand implements Callable<Integer> {
        @ParentCommand
        MigratorCli parent;

        @Parameters(index = "0", paramLabel = "ADDRESS", description = "Speaker address")
        String address;

        @Override
        public Integer call() throws MigrateException {
            return parent.print(parent.manager().reboot(address));
        }
    }
}
