package com.govsentinel.service;

import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.orchestrator.SourceOrchestrator;
import com.govsentinel.core.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs every source on its own thread and keeps them isolated.
 *
 * <h3>Restart policy</h3>
 * <ul>
 * <li>{@link ConfigurationException}: the source is marked failed and stays
 * down.</li>
 * <li>Any other runtime exception: logged, then the source restarts after
 * its poll interval.</li>
 * <li>Normal return (single-pass mode, stop request): the thread ends.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitorSupervisor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorSupervisor.class);

    private final Sleeper restartSleeper;
    private final Map<String, SourceRuntime> runtimes = new LinkedHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, String> crashes = new ConcurrentHashMap<>();
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean stopping;

    public MonitorSupervisor() {
        this(Sleeper.SYSTEM);
    }

    public MonitorSupervisor(Sleeper restartSleeper) {
        this.restartSleeper = restartSleeper;
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    public synchronized void register(SourceRuntime runtime) {
        if (runtimes.putIfAbsent(runtime.getName(), runtime) != null) {
            throw new IllegalArgumentException("Source already registered: '" + runtime.getName() + "'");
        }
    }

    /**
     * Record a source that could not be assembled, so health reports it.
     */
    public void registerFailure(String name, String error) {
        failures.put(name, error);
        LOG.error("Source '{}' will not run: {}", name, error);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        for (SourceRuntime runtime : runtimes.values()) {
            Thread thread = new Thread(() -> supervise(runtime), "monitor-" + runtime.getName());
            thread.setDaemon(false);
            threads.add(thread);
            thread.start();
        }
        LOG.info("Started {} source(s); {} failed at startup", threads.size(), failures.size());
    }

    private void supervise(SourceRuntime runtime) {
        String name = runtime.getName();
        SourceOrchestrator orchestrator = runtime.getOrchestrator();
        while (!stopping) {
            try {
                orchestrator.run();
                return;
            } catch (ConfigurationException e) {
                failures.put(name, e.getMessage());
                LOG.error("Source '{}' stopped on configuration error: {}", name, e.getMessage());
                return;
            } catch (RuntimeException e) {
                crashes.put(name, e.toString());
                LOG.error("Source '{}' crashed; restarting in {}", name, runtime.getRestartDelay(), e);
            }
            try {
                restartSleeper.sleep(runtime.getRestartDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Ask every source to stop and interrupt any in-progress sleep.
     */
    public synchronized void stop() {
        stopping = true;
        runtimes.values().forEach(r -> r.getOrchestrator().requestStop());
        threads.forEach(Thread::interrupt);
    }

    /**
     * @return {@code true} if every source thread finished within the
     *         timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<Thread> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(threads);
        }
        for (Thread thread : snapshot) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedJoin(thread, remaining);
            if (thread.isAlive()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public synchronized void close() {
        stop();
        runtimes.values().forEach(SourceRuntime::close);
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    public synchronized List<SourceStatus> statuses() {
        List<SourceStatus> statuses = new ArrayList<>();
        for (SourceRuntime runtime : runtimes.values()) {
            SourceOrchestrator o = runtime.getOrchestrator();
            String failure = failures.get(runtime.getName());
            String error = failure != null ? failure : crashes.get(runtime.getName());
            statuses.add(new SourceStatus(runtime.getName(),
                    failure != null ? "FAILED" : o.state().name(),
                    o.passCount(),
                    o.lastPassAt().orElse(null),
                    o.lastReport().orElse(null),
                    failure != null,
                    error));
        }
        failures.forEach((name, error) -> {
            if (!runtimes.containsKey(name)) {
                statuses.add(SourceStatus.failedAtStartup(name, error));
            }
        });
        return statuses;
    }

    /**
     * @return {@code true} unless every configured source has failed
     */
    public boolean isHealthy() {
        List<SourceStatus> statuses = statuses();
        return statuses.isEmpty() || statuses.stream().anyMatch(s -> !s.isFailed());
    }
}
