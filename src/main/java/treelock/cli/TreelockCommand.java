package treelock.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import treelock.client.ClientOptions;
import treelock.client.CoordinatorClient;
import treelock.client.SchedulerUnavailableException;
import treelock.client.WorktreeLocation;
import treelock.client.WorktreeLocator;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.config.Dependencies;
import treelock.coordinator.model.OperationResult;
import treelock.coordinator.model.Scope;
import treelock.coordinator.scope.ScopeResolver;
import treelock.coordinator.server.CoordinatorNettyServer;

import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "treelock",
        mixinStandardHelpOptions = true,
        description = "Coordinates version-control operations across worktrees",
        subcommands = {
                TreelockCommand.ServeCommand.class,
                TreelockCommand.RunCommand.class,
                TreelockCommand.StatusCommand.class,
                TreelockCommand.MetricsCommand.class,
                TreelockCommand.PatternsCommand.class,
                TreelockCommand.ResolveCommand.class
        }
)
public final class TreelockCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TreelockCommand.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    @Option(names = {"--host"}, description = "Coordinator host (default: TREELOCK_HOST or 127.0.0.1)")
    String host;

    @Option(names = {"--port"}, description = "Coordinator port (default: TREELOCK_PORT or 7431)")
    Integer port;

    @Spec
    CommandSpec spec;

    Map<String, String> env = System.getenv();

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: serve | run | status | metrics | patterns | resolve");
    }

    CoordinatorConfig config() {
        CoordinatorConfig config = CoordinatorConfig.fromEnv(env);
        if (host != null && !host.isBlank()) {
            config.withServerHost(host.trim());
        }
        if (port != null) {
            config.withServerPort(port);
        }
        return config.validate();
    }

    WorktreeLocation location() {
        Path cwd = Path.of("").toAbsolutePath();
        return WorktreeLocator.locate(cwd).orElseGet(() -> {
            Path fallback = cwd.resolve(".treelock");
            return new WorktreeLocation(cwd, WorktreeLocation.MAIN_WORKTREE, fallback, fallback);
        });
    }

    CoordinatorClient client() {
        CoordinatorConfig config = config();
        ClientOptions options = ClientOptions.forLocation(location(), env)
                .withCoordinator(URI.create("http://" + config.serverHost() + ":" + config.serverPort()));
        return new CoordinatorClient(options);
    }

    int printJson(PrintWriter out, JsonNode node) {
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node));
            return ExitCodes.SUCCESS;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render response", e);
        }
    }

    int query(String path) throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        try {
            return printJson(out, client().get(path));
        } catch (SchedulerUnavailableException e) {
            spec.commandLine().getErr().println("coordinator unavailable: " + e.getMessage());
            return ExitCodes.UNAVAILABLE;
        }
    }

    @Command(name = "serve", description = "Run the coordinator in the foreground until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Option(names = {"--data-dir"}, description = "Metrics and pattern logs (default: <git-common-dir>/treelock)")
        Path dataDir;

        @Override
        public Integer call() throws InterruptedException {
            CoordinatorConfig config = parent.config();
            if (dataDir != null) {
                config.withDataDir(dataDir);
            } else if (!parent.env.containsKey("TREELOCK_DATA_DIR")) {
                config.withDataDir(parent.location().dataDir());
            }

            if (!CoordinatorNettyServer.start(Dependencies.create(config))) {
                return ExitCodes.UNAVAILABLE;
            }

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                CoordinatorNettyServer.stop();
                stopped.countDown();
            }, "treelock-shutdown"));
            log.info("Coordinator serving {} from {}", config.serverHost() + ":" + CoordinatorNettyServer.boundPort(),
                    config.dataDir());
            stopped.await();
            return ExitCodes.SUCCESS;
        }
    }

    @Command(name = "run", description = "Run a command once the coordinator grants its scope")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Option(names = {"--verb"}, required = true, description = "Operation verb, e.g. commit or merge")
        String verb;

        @Option(names = {"--target"}, description = "Worktree id (default: the current worktree)")
        String target;

        @Option(names = {"--priority"}, defaultValue = "5",
                description = "Priority 1..10, higher first")
        int priority;

        @Option(names = {"--caller"}, description = "Caller id (default: the current worktree)")
        String caller;

        @Option(names = {"--lock-dir"}, description = "Degraded-mode lock directory (default: <git-common-dir>/.git-locks)")
        Path lockDir;

        @Option(names = {"--timeout"}, description = "Acquisition timeout, e.g. 30s")
        String timeout;

        @Parameters(arity = "1..*", description = "Command to run, after --")
        List<String> command;

        @Override
        public Integer call() throws InterruptedException {
            CoordinatorConfig config = parent.config();
            WorktreeLocation location = parent.location();
            ClientOptions options = ClientOptions.forLocation(location, parent.env)
                    .withCoordinator(URI.create("http://" + config.serverHost() + ":" + config.serverPort()));
            if (caller != null && !caller.isBlank()) {
                options = options.withCallerId(caller.trim());
            }
            if (lockDir != null) {
                options = options.withLockDir(lockDir);
            }
            if (timeout != null) {
                options = options.withAcquireTimeout(CoordinatorConfig.parseDuration(timeout));
            }
            String worktree = target != null ? target : location.worktreeId();

            OperationResult result = new CoordinatorClient(options).submit(verb, worktree, priority, () -> {
                Process process = new ProcessBuilder(command).inheritIO().start();
                return process.waitFor() == 0;
            });

            if (!result.isSuccess()) {
                parent.spec.commandLine().getErr().println("treelock: " + result.status().wireName()
                        + " on " + result.scopeUsed()
                        + (result.message() != null ? ": " + result.message() : ""));
            }
            log.debug("{} finished {} after {}ms (waited {}ms, degraded={})", verb, result.status(),
                    result.durationMs(), result.waitedMs(), result.degraded());
            return ExitCodes.of(result);
        }
    }

    @Command(name = "status", description = "Print held locks and the queue")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Override
        public Integer call() throws InterruptedException {
            try {
                CoordinatorClient client = parent.client();
                ObjectNode status = MAPPER.createObjectNode();
                status.set("locks", client.get("/api/v1/locks"));
                status.set("queue", client.get("/api/v1/queue"));
                return parent.printJson(parent.spec.commandLine().getOut(), status);
            } catch (SchedulerUnavailableException e) {
                parent.spec.commandLine().getErr().println("coordinator unavailable: " + e.getMessage());
                return ExitCodes.UNAVAILABLE;
            }
        }
    }

    @Command(name = "metrics", description = "Print the lock latency and contention summary")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Override
        public Integer call() throws InterruptedException {
            return parent.query("/api/v1/metrics/summary");
        }
    }

    @Command(name = "patterns", description = "Print learned operation patterns")
    static final class PatternsCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Override
        public Integer call() throws InterruptedException {
            return parent.query("/api/v1/patterns");
        }
    }

    @Command(name = "resolve", description = "Print the scope a verb resolves to")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        TreelockCommand parent;

        @Parameters(index = "0", description = "Operation verb")
        String verb;

        @Parameters(index = "1", arity = "0..1", description = "Worktree id")
        String target;

        @Override
        public Integer call() {
            ScopeResolver resolver = new ScopeResolver();
            Scope scope = resolver.resolve(verb, target);
            PrintWriter out = parent.spec.commandLine().getOut();
            out.println(scope.id());
            if (!resolver.isKnownVerb(verb)) {
                parent.spec.commandLine().getErr().println("unknown verb '" + verb + "', treated as global");
            }
            out.flush();
            return ExitCodes.SUCCESS;
        }
    }
}
