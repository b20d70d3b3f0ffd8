package com.adlanda.knowledgesync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the insights queue and worker.
 *
 * Maps to properties prefixed with 'insights' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "insights")
public class InsightsProperties {

    /**
     * Enqueue a task for every document the sync side processes.
     */
    private boolean enqueueOnIngest = true;

    /**
     * Characters of document content passed to the model.
     */
    @Min(1)
    private int maxContentChars = 8000;

    @Valid
    private final Worker worker = new Worker();

    public boolean isEnqueueOnIngest() {
        return enqueueOnIngest;
    }

    public void setEnqueueOnIngest(boolean enqueueOnIngest) {
        this.enqueueOnIngest = enqueueOnIngest;
    }

    public int getMaxContentChars() {
        return maxContentChars;
    }

    public void setMaxContentChars(int maxContentChars) {
        this.maxContentChars = maxContentChars;
    }

    public Worker getWorker() {
        return worker;
    }

    public static class Worker {

        private boolean enabled = false;

        /**
         * Handlers running at the same time.
         */
        @Min(1)
        private int maxConcurrent = 3;

        /**
         * Attempts before a task is parked as failed.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Delay before the first retry; doubles on each further failure.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration backoffBase = Duration.ofSeconds(30);

        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(30);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration pollInterval = Duration.ofSeconds(30);

        /**
         * How long shutdown waits for in-flight handlers.
         */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        /**
         * Processing tasks untouched for longer than this are returned to pending on worker start.
         */
        @NotNull
        private Duration staleAfter = Duration.ofMinutes(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }
    }
}
