package org.omniroute.gig.engine;

import org.omniroute.gig.engine.api.GigPlatformApiClient;
import org.omniroute.gig.engine.api.NotificationApiClient;
import org.omniroute.gig.engine.api.PricingApiClient;
import org.omniroute.gig.engine.api.RoutingGeoService;
import org.omniroute.gig.engine.config.EngineConfig;
import org.omniroute.gig.engine.domain.model.AllocationConfig;
import org.omniroute.gig.engine.domain.service.AllocationService;
import org.omniroute.gig.engine.domain.service.AllocationServiceImpl;
import org.omniroute.gig.engine.domain.service.CandidateDiscoveryService;
import org.omniroute.gig.engine.domain.service.CandidateDiscoveryServiceImpl;
import org.omniroute.gig.engine.domain.service.OfferLifecycleServiceImpl;
import org.omniroute.gig.engine.domain.service.ScoringService;
import org.omniroute.gig.engine.domain.service.ScoringServiceImpl;
import org.omniroute.gig.engine.domain.service.StrategyExecutor;
import org.omniroute.gig.engine.http.CallbackServer;
import org.omniroute.gig.engine.registry.InMemoryWorkerStateRegistry;
import org.omniroute.gig.engine.registry.WorkerStateRegistry;
import org.omniroute.gig.engine.scheduler.MaintenanceScheduler;
import org.omniroute.gig.engine.spi.GeoService;
import org.omniroute.gig.engine.spi.WorkerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the allocation engine.
 *
 * The engine matches gig tasks to nearby workers, offers them with a deadline,
 * and resolves the first acceptance.
 *
 * Trigger modes:
 * - On task creation: the platform calls POST /tasks/{taskId}/allocate
 * - Worker responses: POST /offers/{offerId}/accept or /decline
 * - Periodic: the maintenance scheduler expires offers and drops silent workers
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.error("Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== OmniRoute Gig Allocation Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        AllocationConfig allocationConfig = AllocationConfig.fromLookup(System::getenv);
        configureLogging(config);
        LOG.info("Configuration: {}", config);
        LOG.info("Allocation configuration: {}", allocationConfig);

        // Create collaborators
        GigPlatformApiClient platform = new GigPlatformApiClient(config.getApiBaseUrl());
        GeoService geoService = new RoutingGeoService(config.getRoutingApiUrl());
        PricingApiClient pricing = new PricingApiClient(config.getPricingApiUrl());
        WorkerNotifier notifier = new NotificationApiClient(config.getNotificationApiUrl());

        // Create engine
        Clock clock = Clock.systemUTC();
        ExecutorService broadcastExecutor = Executors.newFixedThreadPool(config.getBroadcastPoolSize(),
                namedThreads("broadcast"));
        ExecutorService reallocationExecutor = Executors.newFixedThreadPool(config.getReallocationPoolSize(),
                namedThreads("reallocation"));

        WorkerStateRegistry registry = new InMemoryWorkerStateRegistry(clock);
        CandidateDiscoveryService discovery = new CandidateDiscoveryServiceImpl(platform.workers(), registry,
                geoService, pricing, allocationConfig);
        ScoringService scoring = new ScoringServiceImpl(allocationConfig);
        StrategyExecutor strategyExecutor = new StrategyExecutor(platform.offers(), platform.tasks(), notifier,
                null, broadcastExecutor, allocationConfig, clock);

        AllocationService allocationService = new AllocationServiceImpl(platform.tasks(), platform.offers(),
                registry, discovery, scoring, strategyExecutor,
                allocator -> new OfferLifecycleServiceImpl(platform.offers(), platform.tasks(), registry,
                        notifier, allocator, reallocationExecutor, clock),
                clock);

        // Start callback server
        CallbackServer callbackServer = new CallbackServer(config.getCallbackPort(), allocationService);
        callbackServer.start();

        // Start scheduler if enabled
        MaintenanceScheduler scheduler = null;
        if (config.isSchedulerEnabled()) {
            scheduler = new MaintenanceScheduler(allocationService, config.getSweepIntervalSeconds(),
                    Duration.ofSeconds(config.getHeartbeatTimeoutSeconds()));
            scheduler.start();
        } else {
            LOG.info("Maintenance scheduler disabled");
        }

        // Register shutdown hook
        final MaintenanceScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            callbackServer.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            shutdown(broadcastExecutor);
            shutdown(reallocationExecutor);
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Allocation Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info("  - Health: http://localhost:{}/health", config.getCallbackPort());
        LOG.info("  - Allocate: POST http://localhost:{}/tasks/{taskId}/allocate?strategy=", config.getCallbackPort());
        LOG.info("  - Offers: POST http://localhost:{}/offers/{offerId}/accept|decline", config.getCallbackPort());

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Configure the JUL root logger, which slf4j-jdk14 writes through.
     */
    private void configureLogging(EngineConfig config) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                }
            } catch (IOException e) {
                LOG.warn("Failed to load bundled logging configuration", e);
            }
        }

        java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info("File logging enabled: {}", target);
        } catch (IOException e) {
            LOG.warn("Failed to setup file logging", e);
        }
    }
}
