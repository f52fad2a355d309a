package com.webmon.service;

import com.webmon.core.bus.EventBus;
import com.webmon.core.model.Site;
import com.webmon.core.retry.RetriesExhaustedException;
import com.webmon.core.retry.Retry;
import com.webmon.core.retry.RetryPolicy;
import com.webmon.monitor.api.ProbeContext;
import com.webmon.monitor.probe.HttpProber;
import com.webmon.monitor.probe.ProbeLimiter;
import com.webmon.monitor.sites.SiteCsvLoader;
import com.webmon.monitor.sites.SiteListException;
import com.webmon.service.cli.Action;
import com.webmon.service.cli.CliArguments;
import com.webmon.service.cli.ConfigException;
import com.webmon.service.config.ConfigLoader;
import com.webmon.service.config.DatabaseConfig;
import com.webmon.service.http.HttpClientFactory;
import com.webmon.service.logging.LoggingSetup;
import com.webmon.service.logging.ProbeLogSubscriber;
import com.webmon.service.runtime.FileDescriptorBudget;
import com.webmon.service.runtime.SchedulerService;
import com.webmon.service.store.DatabaseHealthcheckStore;
import com.webmon.service.store.EmptySiteStoreException;
import com.webmon.service.store.ResultSink;
import com.webmon.service.store.SiteRegistry;
import com.webmon.service.store.StorageDriver;
import com.webmon.service.store.StorageDrivers;
import com.webmon.service.store.StorageException;
import com.webmon.service.store.Tables;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws InterruptedException {
        return run(args, out, err, RetryPolicy.STORAGE_DEFAULT);
    }

    static int run(String[] args, PrintStream out, PrintStream err, RetryPolicy retryPolicy) throws InterruptedException {
        CliArguments arguments;
        Level level;
        try {
            arguments = CliArguments.parse(args);
            level = LoggingSetup.parseLevel(arguments.logLevel());
        } catch (ConfigException e) {
            err.println("Error: " + e.getMessage());
            out.println(CliArguments.USAGE);
            return 1;
        }
        if (arguments.action() == Action.HELP) {
            out.println(CliArguments.USAGE);
            return 0;
        }
        LoggingSetup.apply(level);
        arguments.warnings().forEach(LOGGER::warning);

        try {
            DatabaseConfig dbConfig = ConfigLoader.loadDatabase(arguments.dbConfig());
            LOGGER.fine(() -> "Database settings: " + dbConfig);
            List<Site> supplied = arguments.sitesCsv().map(SiteCsvLoader::load).orElse(List.of());

            Retry retry = new Retry(retryPolicy);
            try (StorageDriver driver = StorageDrivers.create(dbConfig)) {
                retry.run("connect to " + dbConfig.name(), driver::open);
                LOGGER.info("Connected to " + driver.version());
                ResultSink sink = new ResultSink(driver, retry);

                if (arguments.action() == Action.DROP_TABLES) {
                    Tables.dropAll(sink);
                    return 0;
                }
                monitor(arguments, driver, sink, supplied);
                return 0;
            }
        } catch (ConfigException | IllegalStateException | SiteListException | EmptySiteStoreException
                 | RetriesExhaustedException | StorageException e) {
            LOGGER.severe(e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void monitor(CliArguments arguments, StorageDriver driver, ResultSink sink, List<Site> supplied)
            throws InterruptedException {
        Tables.createAll(sink);
        List<Site> sites = new SiteRegistry(sink).reconcile(supplied);
        FileDescriptorBudget.check(sites.size());

        EventBus eventBus = new EventBus();
        ProbeLogSubscriber.register(eventBus);
        Clock clock = Clock.systemUTC();
        HttpClient httpClient = HttpClientFactory.create(ProbeContext.DEFAULT_PROBE_TIMEOUT);
        ProbeContext context = new ProbeContext(httpClient, eventBus, clock, ProbeContext.DEFAULT_PROBE_TIMEOUT);

        SchedulerService scheduler = new SchedulerService(
                sites,
                new HttpProber(context),
                new DatabaseHealthcheckStore(sink),
                new ProbeLimiter(ProbeLimiter.DEFAULT_CAPACITY),
                eventBus,
                clock,
                arguments.numberHealthchecks()
        );
        Thread hook = new Thread(() -> {
            LOGGER.info("Shutting down site tasks");
            scheduler.shutdown();
            driver.close();
        }, "webmon-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            scheduler.start();
            scheduler.awaitCompletion();
            LOGGER.info("Completed " + arguments.numberHealthchecks() + " checks for each of " + sites.size() + " sites");
        } catch (CancellationException e) {
            LOGGER.info("Monitoring stopped before all checks completed");
        } finally {
            scheduler.shutdown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.fine("JVM already shutting down; hook stays registered");
        }
    }
}
