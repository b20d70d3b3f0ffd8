package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.entity.QueueTask;
import com.adlanda.knowledgesync.entity.SourceDocument;
import com.adlanda.knowledgesync.model.QueueStats;
import com.adlanda.knowledgesync.repository.SourceDocumentRepository;
import com.adlanda.knowledgesync.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background consumer of the insights queue.
 *
 * A single poller thread claims due tasks, never more than the free handler slots, and
 * hands them to the insights executor. Each handler either completes its task or records
 * a failed attempt; a failing document never affects the others.
 */
@Component
public class InsightsWorker {

    private static final Logger log = LoggerFactory.getLogger(InsightsWorker.class);

    private final InsightsQueue queue;
    private final SourceDocumentRepository documentRepository;
    private final InsightGenerator generator;
    private final InsightRecorder recorder;
    private final ThreadPoolTaskExecutor executor;
    private final InsightsProperties properties;
    private final CancellationToken shutdownSignal;

    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile Thread pollerThread;

    public InsightsWorker(InsightsQueue queue,
                          SourceDocumentRepository documentRepository,
                          InsightGenerator generator,
                          InsightRecorder recorder,
                          @Qualifier("insightsExecutor") ThreadPoolTaskExecutor executor,
                          InsightsProperties properties,
                          CancellationToken shutdownSignal) {
        this.queue = queue;
        this.documentRepository = documentRepository;
        this.generator = generator;
        this.recorder = recorder;
        this.executor = executor;
        this.properties = properties;
        this.shutdownSignal = shutdownSignal;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        InsightsProperties.Worker worker = properties.getWorker();
        if (!worker.isEnabled()) {
            log.info("Insights worker disabled (insights.worker.enabled=false)");
            return;
        }
        if (pollerThread != null) {
            return;
        }

        log.info("Starting insights worker: maxConcurrent={}, pollInterval={}, maxAttempts={}",
                worker.getMaxConcurrent(), worker.getPollInterval(), worker.getMaxAttempts());

        pollerThread = new Thread(this::pollLoop, "insights-poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    private void pollLoop() {
        try {
            queue.resetStaleProcessing(properties.getWorker().getStaleAfter());
        } catch (RuntimeException e) {
            log.error("Could not reclaim stale tasks: {}", e.getMessage(), e);
        }

        while (!shutdownSignal.isCancelled()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Insights poll failed: {}", e.getMessage(), e);
            }
            if (!shutdownSignal.sleep(properties.getWorker().getPollInterval())) {
                break;
            }
        }
        log.info("Insights poller stopped");
    }

    /**
     * Claims as many due tasks as there are free handler slots and submits them.
     *
     * @return the number of tasks claimed
     */
    public int pollOnce() {
        int claimed = 0;
        int freeSlots = properties.getWorker().getMaxConcurrent() - inFlight.get();

        while (claimed < freeSlots && !shutdownSignal.isCancelled()) {
            Optional<QueueTask> next = queue.claimNext();
            if (next.isEmpty()) {
                break;
            }
            submit(next.get());
            claimed++;
        }

        logStatus();
        return claimed;
    }

    private void submit(QueueTask task) {
        inFlight.incrementAndGet();
        try {
            executor.execute(() -> handle(task));
        } catch (TaskRejectedException e) {
            inFlight.decrementAndGet();
            // Left in PROCESSING; reclaimed as stale on the next start
            log.warn("Executor rejected task {} for document {}", task.getId(), task.getDocumentId());
        }
    }

    void handle(QueueTask task) {
        String documentId = task.getDocumentId();
        try {
            Optional<SourceDocument> document = documentRepository.findById(documentId);
            if (document.isEmpty()) {
                log.warn("Document {} no longer exists, completing task {} without insights", documentId, task.getId());
                queue.complete(task.getId());
                return;
            }

            SourceDocument doc = document.get();
            int stored = recorder.replace(documentId, generator.generateInsights(doc.getTitle(), doc.getContent()));
            queue.complete(task.getId());
            log.info("Generated {} insights for document {} ({})", stored, doc.getTitle(), documentId);
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            try {
                queue.fail(task.getId(), error);
            } catch (RuntimeException failError) {
                log.error("Could not record failure of task {}: {}", task.getId(), failError.getMessage(), failError);
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void logStatus() {
        QueueStats stats = queue.stats();
        log.info("Queue status: {} pending, {} processing, {} completed, {} failed | Active tasks: {}",
                stats.pending(), stats.processing(), stats.completed(), stats.failed(), inFlight.get());
    }

    /**
     * Stops claiming and drains in-flight handlers. Joining the poller and draining the
     * pool share one deadline of {@code insights.worker.shutdown-timeout}; handlers still
     * running after that are abandoned in PROCESSING.
     */
    @EventListener(ContextClosedEvent.class)
    public void stop() {
        shutdownSignal.cancel();
        long deadline = System.nanoTime() + properties.getWorker().getShutdownTimeout().toNanos();

        Thread poller = pollerThread;
        if (poller == null) {
            return;
        }

        try {
            // join(0) would wait forever
            poller.join(Math.max(1, millisUntil(deadline)));

            log.info("Draining {} in-flight insight tasks", inFlight.get());
            ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
            pool.shutdown();
            pool.awaitTermination(millisUntil(deadline), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (inFlight.get() > 0) {
            log.warn("{} insight tasks still running after {}, left in processing",
                    inFlight.get(), properties.getWorker().getShutdownTimeout());
        }
    }

    private static long millisUntil(long deadlineNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    public int getInFlight() {
        return inFlight.get();
    }

    boolean isRunning() {
        Thread poller = pollerThread;
        return poller != null && poller.isAlive();
    }
}
