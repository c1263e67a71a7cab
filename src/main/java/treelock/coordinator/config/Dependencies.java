package treelock.coordinator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.api.v1.HealthController;
import treelock.coordinator.api.v1.LockController;
import treelock.coordinator.api.v1.MetricsController;
import treelock.coordinator.api.v1.OperationController;
import treelock.coordinator.api.v1.PatternController;
import treelock.coordinator.core.LockEventBus;
import treelock.coordinator.lock.HolderLiveness;
import treelock.coordinator.lock.LockRegistry;
import treelock.coordinator.lock.ProcessLiveness;
import treelock.coordinator.metrics.MetricsRecorder;
import treelock.coordinator.prediction.PatternPredictor;
import treelock.coordinator.repository.MetricsRepository;
import treelock.coordinator.repository.PatternRepository;
import treelock.coordinator.scheduler.AdvisoryLocks;
import treelock.coordinator.scheduler.MaintenanceScheduler;
import treelock.coordinator.scheduler.PriorityScheduler;
import treelock.coordinator.scheduler.StaleLockReaper;
import treelock.coordinator.scope.ScopeResolver;
import treelock.coordinator.server.RouterHandler;
import treelock.coordinator.service.OperationService;
import treelock.coordinator.store.FileMetricsRepository;
import treelock.coordinator.store.FilePatternRepository;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all coordinator components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.start(); // replay logs, start dispatcher and background jobs
 * OperationService service = deps.operationService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final LockEventBus eventBus;
    private final ScopeResolver scopeResolver;
    private final LockRegistry lockRegistry;
    private final MetricsRepository metricsRepository;
    private final PatternRepository patternRepository;
    private final MetricsRecorder metricsRecorder;
    private final PatternPredictor patternPredictor;
    private final AdvisoryLocks advisoryLocks;
    private final PriorityScheduler priorityScheduler;
    private final MaintenanceScheduler maintenanceScheduler;
    private final OperationService operationService;

    // Controllers
    private final OperationController operationController;
    private final LockController lockController;
    private final MetricsController metricsController;
    private final PatternController patternController;
    private final HealthController healthController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;
    private ExecutorService handlerExecutor;

    private boolean started = false;

    private Dependencies(CoordinatorConfig config, HolderLiveness liveness) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.eventBus = new LockEventBus();
        this.scopeResolver = new ScopeResolver();
        this.lockRegistry = new LockRegistry(config, liveness, eventBus);

        // Repositories
        this.metricsRepository = new FileMetricsRepository(config.dataDir());
        this.patternRepository = new FilePatternRepository(config.dataDir());

        // Observers
        this.metricsRecorder = new MetricsRecorder(metricsRepository, config);
        this.patternPredictor = new PatternPredictor(patternRepository, scopeResolver, config);
        eventBus.subscribe(metricsRecorder);
        eventBus.subscribe(patternPredictor);

        // Scheduling
        this.advisoryLocks = new AdvisoryLocks(lockRegistry, metricsRecorder, config);
        this.priorityScheduler = new PriorityScheduler(scopeResolver, lockRegistry, patternPredictor,
                advisoryLocks, eventBus, config);
        this.maintenanceScheduler = new MaintenanceScheduler(new StaleLockReaper(lockRegistry), metricsRecorder,
                advisoryLocks, priorityScheduler, config);

        // Services
        this.operationService = new OperationService(priorityScheduler);

        // Controllers (public API)
        this.operationController = new OperationController(operationService);
        this.lockController = new LockController(lockRegistry, priorityScheduler);
        this.metricsController = new MetricsController(metricsRecorder);
        this.patternController = new PatternController(patternPredictor, config);
        this.healthController = new HealthController(lockRegistry, priorityScheduler);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new ProcessLiveness());
    }

    /**
     * Create dependencies with a custom holder liveness probe.
     */
    public static Dependencies create(CoordinatorConfig config, HolderLiveness liveness) {
        return new Dependencies(config, liveness);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    /**
     * Replay persisted history, then start the dispatcher and background jobs.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        metricsRecorder.loadHistory();
        patternPredictor.replay();
        priorityScheduler.start();
        maintenanceScheduler.start();
        started = true;
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public LockEventBus eventBus() {
        return eventBus;
    }

    public ScopeResolver scopeResolver() {
        return scopeResolver;
    }

    public LockRegistry lockRegistry() {
        return lockRegistry;
    }

    public MetricsRepository metricsRepository() {
        return metricsRepository;
    }

    public PatternRepository patternRepository() {
        return patternRepository;
    }

    public MetricsRecorder metricsRecorder() {
        return metricsRecorder;
    }

    public PatternPredictor patternPredictor() {
        return patternPredictor;
    }

    public AdvisoryLocks advisoryLocks() {
        return advisoryLocks;
    }

    public PriorityScheduler priorityScheduler() {
        return priorityScheduler;
    }

    public MaintenanceScheduler maintenanceScheduler() {
        return maintenanceScheduler;
    }

    public OperationService operationService() {
        return operationService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            AtomicInteger ids = new AtomicInteger();
            handlerExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "treelock-http-" + ids.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            routerHandler = new RouterHandler(handlerExecutor)
                    .registerController(operationController)
                    .registerController(lockController)
                    .registerController(metricsController)
                    .registerController(patternController)
                    .registerController(healthController);
            log.info("RouterHandler created with {} controllers", 5);
        }
        return routerHandler;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        // Stop dispatching first: queued requests get a cancelled admission
        try {
            priorityScheduler.close();
        } catch (Exception e) {
            log.warn("Error stopping priority scheduler: {}", e.getMessage());
        }

        try {
            maintenanceScheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping maintenance scheduler: {}", e.getMessage());
        }

        if (handlerExecutor != null) {
            handlerExecutor.shutdown();
            try {
                if (!handlerExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    handlerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                handlerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        eventBus.close();
        metricsRecorder.flush();
        started = false;

        log.info("Dependencies closed");
    }
}
