package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.exception.ConfigurationException;
import com.adlanda.knowledgesync.exception.SyncCycleException;
import com.adlanda.knowledgesync.model.CycleStats;
import com.adlanda.knowledgesync.model.RunMode;
import com.adlanda.knowledgesync.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Process entry point for the sync side.
 *
 * Validates configuration, then either runs a single cycle and records the exit code,
 * or starts the continuous loop on its own thread. Exit codes: 0 cycle completed
 * (item failures included), 1 cycle-level failure, 2 configuration error.
 */
@Component
@Order(1) // Run after StartupInfoLogger
public class ModeDispatcher implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ModeDispatcher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CYCLE_FAILURE = 1;
    public static final int EXIT_CONFIGURATION_ERROR = 2;

    private final SyncProperties properties;
    private final SyncOrchestrator orchestrator;
    private final CancellationToken shutdownSignal;

    private volatile int exitCode = EXIT_OK;
    private volatile boolean finished;
    private Thread loopThread;

    public ModeDispatcher(SyncProperties properties,
                          SyncOrchestrator orchestrator,
                          CancellationToken shutdownSignal) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.shutdownSignal = shutdownSignal;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Sync disabled (sync.enabled=false)");
            return;
        }
        dispatch();
    }

    /**
     * Selects and starts the configured mode.
     *
     * @return the exit code for single runs and configuration errors, 0 once the continuous loop is started
     */
    public int dispatch() {
        try {
            validate();
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return finish(EXIT_CONFIGURATION_ERROR);
        }

        if (properties.getMode() == RunMode.SINGLE) {
            return finish(runSingle());
        }

        startContinuous();
        return EXIT_OK;
    }

    int runSingle() {
        log.info("Single sync run of {} root {}", properties.getSource(), properties.getWatchRoot());
        try {
            CycleStats stats = orchestrator.runOnce();
            if (stats.isTotalFailure()) {
                log.error("Sync run failed: all {} attempted items failed", stats.attempted());
                return EXIT_CYCLE_FAILURE;
            }
            if (stats.errors() > 0) {
                log.warn("Sync run completed with {} item errors", stats.errors());
            }
            return EXIT_OK;
        } catch (SyncCycleException e) {
            log.error("Sync run failed: {}", e.getMessage(), e);
            return EXIT_CYCLE_FAILURE;
        }
    }

    private synchronized void startContinuous() {
        loopThread = new Thread(
                () -> orchestrator.runForever(properties.getPollInterval(), shutdownSignal),
                "sync-loop");
        loopThread.start();
    }

    /**
     * Stops the loop from starting new cycles and waits for the current one, bounded by the shutdown timeout.
     */
    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        shutdownSignal.cancel();
        Thread thread;
        synchronized (this) {
            thread = loopThread;
        }
        if (thread == null || !thread.isAlive()) {
            return;
        }

        log.info("Waiting up to {} s for the in-flight sync cycle", properties.getShutdownTimeout().toSeconds());
        try {
            thread.join(properties.getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Sync cycle still running after shutdown timeout, abandoning it");
        }
    }

    void validate() {
        String root = properties.getWatchRoot();
        if (root == null || root.isBlank()) {
            throw new ConfigurationException("sync.watch-root is required");
        }
        if (properties.getMode() == RunMode.CONTINUOUS
                && (properties.getPollInterval() == null || properties.getPollInterval().isNegative()
                || properties.getPollInterval().isZero())) {
            throw new ConfigurationException("sync.poll-interval must be positive in continuous mode");
        }
        if (properties.getSource() == SourceType.LOCAL && !Files.isDirectory(Path.of(root))) {
            throw new ConfigurationException("sync.watch-root is not a directory: " + root);
        }
        if (properties.getSource() == SourceType.REMOTE) {
            SyncProperties.Remote remote = properties.getRemote();
            if (!remote.hasServiceCredentials() && !remote.hasTokenFile()) {
                throw new ConfigurationException(
                        "remote source needs sync.remote.service-credentials or sync.remote.token-file");
            }
        }
    }

    private int finish(int code) {
        exitCode = code;
        finished = true;
        return code;
    }

    /**
     * True once a single run (or a configuration error) has produced a final exit code.
     */
    public boolean isFinished() {
        return finished;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
