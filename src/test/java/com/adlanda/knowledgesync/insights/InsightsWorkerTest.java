package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.entity.QueueTask;
import com.adlanda.knowledgesync.entity.SourceDocument;
import com.adlanda.knowledgesync.exception.InsightGenerationException;
import com.adlanda.knowledgesync.model.InsightDraft;
import com.adlanda.knowledgesync.model.InsightPriority;
import com.adlanda.knowledgesync.model.InsightType;
import com.adlanda.knowledgesync.model.QueueStats;
import com.adlanda.knowledgesync.model.TaskStatus;
import com.adlanda.knowledgesync.repository.SourceDocumentRepository;
import com.adlanda.knowledgesync.service.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InsightsWorkerTest {

    @Mock
    private InsightsQueue queue;

    @Mock
    private SourceDocumentRepository documentRepository;

    @Mock
    private InsightGenerator generator;

    @Mock
    private InsightRecorder recorder;

    @Mock
    private ThreadPoolTaskExecutor executor;

    private InsightsProperties properties;
    private InsightsWorker worker;

    @BeforeEach
    void setUp() {
        properties = new InsightsProperties();
        properties.getWorker().setMaxConcurrent(2);
        worker = new InsightsWorker(queue, documentRepository, generator, recorder, executor,
                properties, new CancellationToken());
    }

    @Test
    void handle_documentFound_storesInsightsAndCompletes() {
        // Setup
        QueueTask task = task(7L, "doc-1");
        List<InsightDraft> drafts = List.of(draft("Book venue"), draft("Confirm budget"));
        when(documentRepository.findById("doc-1")).thenReturn(Optional.of(document("doc-1")));
        when(generator.generateInsights("doc-1.md", "notes for doc-1")).thenReturn(drafts);
        when(recorder.replace("doc-1", drafts)).thenReturn(2);

        // Execute
        worker.handle(task);

        // Verify
        verify(queue).complete(7L);
        verify(queue, never()).fail(any(), anyString());
    }

    @Test
    void handle_generatorFails_recordsFailedAttempt() {
        // Setup
        QueueTask task = task(7L, "doc-1");
        when(documentRepository.findById("doc-1")).thenReturn(Optional.of(document("doc-1")));
        when(generator.generateInsights(anyString(), anyString()))
                .thenThrow(new InsightGenerationException("Model response contains no JSON array"));

        // Execute
        worker.handle(task);

        // Verify
        verify(queue).fail(7L, "Model response contains no JSON array");
        verify(queue, never()).complete(any());
        verify(recorder, never()).replace(anyString(), any());
    }

    @Test
    void handle_documentGone_completesWithoutGenerating() {
        // Setup
        QueueTask task = task(7L, "doc-1");
        when(documentRepository.findById("doc-1")).thenReturn(Optional.empty());

        // Execute
        worker.handle(task);

        // Verify
        verify(queue).complete(7L);
        verify(generator, never()).generateInsights(any(), any());
    }

    @Test
    void handle_failureCannotBeRecorded_doesNotPropagate() {
        // Setup
        QueueTask task = task(7L, "doc-1");
        when(documentRepository.findById("doc-1")).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("db still down")).when(queue).fail(7L, "db down");

        // Execute
        worker.handle(task);

        // Verify
        verify(queue).fail(7L, "db down");
    }

    @Test
    void pollOnce_claimsNoMoreThanFreeSlots() {
        // Setup
        when(queue.claimNext()).thenReturn(
                Optional.of(task(1L, "doc-1")),
                Optional.of(task(2L, "doc-2")),
                Optional.of(task(3L, "doc-3")));
        when(queue.stats()).thenReturn(new QueueStats(1, 2, 0, 0, Duration.ZERO));

        // Execute
        int first = worker.pollOnce();
        int second = worker.pollOnce();

        // Verify
        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(worker.getInFlight()).isEqualTo(2);
        verify(queue, times(2)).claimNext();
        verify(executor, times(2)).execute(any(Runnable.class));
    }

    @Test
    void pollOnce_emptyQueue_claimsNothing() {
        // Setup
        when(queue.claimNext()).thenReturn(Optional.empty());
        when(queue.stats()).thenReturn(new QueueStats(0, 0, 4, 0, null));

        // Execute
        int claimed = worker.pollOnce();

        // Verify
        assertThat(claimed).isZero();
        verify(executor, never()).execute(any(Runnable.class));
    }

    @Test
    void pollOnce_executorRejects_releasesSlot() {
        // Setup
        when(queue.claimNext()).thenReturn(Optional.of(task(1L, "doc-1")), Optional.empty());
        when(queue.stats()).thenReturn(new QueueStats(0, 1, 0, 0, null));
        doThrow(new TaskRejectedException("pool shut down")).when(executor).execute(any(Runnable.class));

        // Execute
        worker.pollOnce();

        // Verify
        assertThat(worker.getInFlight()).isZero();
    }

    @Test
    void start_disabled_doesNotPoll() {
        // Setup
        properties.getWorker().setEnabled(false);

        // Execute
        worker.start();

        // Verify
        assertThat(worker.isRunning()).isFalse();
        verify(queue, never()).claimNext();
    }

    @Test
    void startAndStop_reclaimsStaleTasksThenStopsPoller() {
        // Setup
        ThreadPoolTaskExecutor pool = pool();
        InsightsWorker running = workerWith(pool);
        lenient().when(queue.stats()).thenReturn(new QueueStats(0, 0, 0, 0, null));

        // Execute
        running.start();
        verify(queue, timeout(2000)).resetStaleProcessing(properties.getWorker().getStaleAfter());
        running.stop();

        // Verify
        assertThat(running.isRunning()).isFalse();
        assertThat(pool.getThreadPoolExecutor().isShutdown()).isTrue();
    }

    @Test
    void stop_stuckHandler_returnsWithinOneShutdownTimeout() throws Exception {
        // Setup
        properties.getWorker().setShutdownTimeout(Duration.ofMillis(500));
        ThreadPoolTaskExecutor pool = pool();
        InsightsWorker running = workerWith(pool);
        CountDownLatch release = new CountDownLatch(1);

        when(queue.claimNext()).thenReturn(Optional.of(task(1L, "doc-1")), Optional.empty());
        lenient().when(queue.stats()).thenReturn(new QueueStats(0, 1, 0, 0, null));
        when(documentRepository.findById("doc-1")).thenReturn(Optional.of(document("doc-1")));
        when(generator.generateInsights(anyString(), anyString())).thenAnswer(invocation -> {
            release.await();
            return List.of();
        });

        try {
            running.start();
            verify(generator, timeout(2000)).generateInsights(anyString(), anyString());

            // Execute
            long startedAt = System.nanoTime();
            running.stop();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

            // Verify
            assertThat(elapsed).isLessThan(Duration.ofMillis(900));
            assertThat(running.getInFlight()).isEqualTo(1);
            verify(queue, never()).complete(any());
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    private InsightsWorker workerWith(ThreadPoolTaskExecutor pool) {
        properties.getWorker().setEnabled(true);
        properties.getWorker().setPollInterval(Duration.ofMillis(20));
        return new InsightsWorker(queue, documentRepository, generator, recorder, pool,
                properties, new CancellationToken());
    }

    private static ThreadPoolTaskExecutor pool() {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(2);
        pool.setMaxPoolSize(2);
        pool.setThreadNamePrefix("test-insights-");
        pool.initialize();
        return pool;
    }

    private static QueueTask task(Long id, String documentId) {
        QueueTask task = new QueueTask(documentId, Instant.parse("2026-06-01T08:00:00Z"));
        ReflectionTestUtils.setField(task, "id", id);
        ReflectionTestUtils.setField(task, "status", TaskStatus.PROCESSING);
        return task;
    }

    private static SourceDocument document(String id) {
        SourceDocument document = new SourceDocument(id);
        document.setTitle(id + ".md");
        document.setContent("notes for " + id);
        return document;
    }

    private static InsightDraft draft(String title) {
        return new InsightDraft(InsightType.ACTION_ITEM, title, "", InsightPriority.MEDIUM, 0.7,
                null, null, null, List.of());
    }
}
