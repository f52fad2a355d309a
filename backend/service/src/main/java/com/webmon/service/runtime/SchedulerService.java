package com.webmon.service.runtime;

import com.webmon.core.bus.EventBus;
import com.webmon.core.events.AlertRaised;
import com.webmon.core.events.SiteTaskFinished;
import com.webmon.core.model.HealthcheckResult;
import com.webmon.core.model.Site;
import com.webmon.core.retry.RetriesExhaustedException;
import com.webmon.monitor.api.HealthcheckStore;
import com.webmon.monitor.api.Prober;
import com.webmon.monitor.probe.ProbeLimiter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());
    public static final int UNBOUNDED_CHECKS = -1;

    private final List<SiteTask> tasks;
    private final Prober prober;
    private final HealthcheckStore store;
    private final ProbeLimiter limiter;
    private final EventBus eventBus;
    private final Clock clock;
    private final long millisPerIntervalUnit;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("webmon-timer"));
    private final ExecutorService probeExecutor = Executors.newCachedThreadPool(daemonThreads("webmon-probe"));
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final AtomicInteger unfinished = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopping;

    public SchedulerService(
            List<Site> sites,
            Prober prober,
            HealthcheckStore store,
            ProbeLimiter limiter,
            EventBus eventBus,
            Clock clock,
            int checksPerSite
    ) {
        this(sites, prober, store, limiter, eventBus, clock, checksPerSite, 1000);
    }

    SchedulerService(
            List<Site> sites,
            Prober prober,
            HealthcheckStore store,
            ProbeLimiter limiter,
            EventBus eventBus,
            Clock clock,
            int checksPerSite,
            long millisPerIntervalUnit
    ) {
        if (checksPerSite < 1 && checksPerSite != UNBOUNDED_CHECKS) {
            throw new IllegalArgumentException("checksPerSite must be >= 1 or -1 but was " + checksPerSite);
        }
        List<SiteTask> created = new ArrayList<>();
        for (Site site : sites) {
            if (!site.persisted()) {
                throw new IllegalArgumentException("Site has no stored id: " + site.url());
            }
            created.add(new SiteTask(site, checksPerSite));
        }
        this.tasks = List.copyOf(created);
        this.prober = prober;
        this.store = store;
        this.limiter = limiter;
        this.eventBus = eventBus;
        this.clock = clock;
        this.millisPerIntervalUnit = millisPerIntervalUnit;
    }

    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already started");
        }
        unfinished.set(tasks.size());
        LOGGER.info("Starting " + tasks.size() + " site tasks with at most " + limiter.capacity() + " probes in flight");
        if (tasks.isEmpty()) {
            completion.complete(null);
            return completion;
        }
        for (SiteTask task : tasks) {
            task.state.set(TaskState.RUNNING);
            task.scheduleNext();
        }
        return completion;
    }

    public void awaitCompletion() throws InterruptedException {
        try {
            completion.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Scheduler failed", e.getCause());
        }
    }

    public void shutdown() {
        stopping = true;
        timerExecutor.shutdownNow();
        probeExecutor.shutdownNow();
        try {
            if (!probeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Probe workers still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (SiteTask task : tasks) {
            task.finish(TaskState.CANCELLED);
        }
        completion.completeExceptionally(new CancellationException("Scheduler shut down"));
    }

    public Map<Integer, TaskState> taskStates() {
        Map<Integer, TaskState> states = new LinkedHashMap<>();
        for (SiteTask task : tasks) {
            states.put(task.site.websiteId(), task.state.get());
        }
        return states;
    }

    public long checksCompleted(int websiteId) {
        return tasks.stream()
                .filter(task -> task.site.websiteId() == websiteId)
                .mapToLong(task -> task.completed.get())
                .sum();
    }

    private void fail(RetriesExhaustedException error) {
        LOGGER.log(Level.SEVERE, "Storage unavailable (" + error.operation() + " failed " + error.attempts() + " times), stopping all site tasks", error);
        stopAll(error);
    }

    private void abort(Error error) {
        LOGGER.log(Level.SEVERE, "Site task died, stopping all site tasks", error);
        stopAll(error);
    }

    private void stopAll(Throwable error) {
        stopping = true;
        timerExecutor.shutdownNow();
        probeExecutor.shutdownNow();
        for (SiteTask task : tasks) {
            task.finish(TaskState.CANCELLED);
        }
        completion.completeExceptionally(error);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class SiteTask {
        private final Site site;
        private final long budget;
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.NOT_STARTED);
        private final AtomicLong completed = new AtomicLong();
        private volatile Future<?> pending;

        private SiteTask(Site site, long budget) {
            this.site = site;
            this.budget = budget;
        }

        private void scheduleNext() {
            if (stopping) {
                finish(TaskState.CANCELLED);
                return;
            }
            try {
                pending = timerExecutor.schedule(this::submitIteration,
                        site.intervalSeconds() * millisPerIntervalUnit, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                finish(TaskState.CANCELLED);
            }
        }

        private void submitIteration() {
            try {
                pending = probeExecutor.submit(this::runIteration);
            } catch (RejectedExecutionException e) {
                finish(TaskState.CANCELLED);
            }
        }

        private void runIteration() {
            try {
                HealthcheckResult result = prober.probe(site, limiter);
                store.save(result);
                LOGGER.fine(() -> "Stored check " + (completed.get() + 1) + " for " + site.url());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finish(TaskState.CANCELLED);
                return;
            } catch (RetriesExhaustedException e) {
                finish(TaskState.FAILED);
                fail(e);
                return;
            } catch (RuntimeException | StackOverflowError e) {
                LOGGER.log(Level.WARNING, "Check for " + site.url() + " failed unexpectedly", e);
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        "site-task",
                        site.websiteId(),
                        site.url(),
                        "Check failed for " + site.url() + ": " + e
                ));
            } catch (Error e) {
                finish(TaskState.FAILED);
                abort(e);
                return;
            }
            long done = completed.incrementAndGet();
            if (budget != UNBOUNDED_CHECKS && done >= budget) {
                finish(TaskState.FINISHED);
                return;
            }
            scheduleNext();
        }

        private void finish(TaskState terminal) {
            TaskState previous = state.get();
            while (!previous.terminal()) {
                if (state.compareAndSet(previous, terminal)) {
                    Future<?> current = pending;
                    if (terminal == TaskState.CANCELLED && current != null) {
                        current.cancel(false);
                    }
                    eventBus.publish(new SiteTaskFinished(clock.instant(), site.websiteId(), site.url(),
                            terminal.name(), completed.get()));
                    if (terminal == TaskState.FINISHED && unfinished.decrementAndGet() == 0) {
                        LOGGER.info("All site tasks finished");
                        completion.complete(null);
                    }
                    return;
                }
                previous = state.get();
            }
        }
    }
}
