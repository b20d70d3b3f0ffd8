package com.adlanda.knowledgesync.config;

import com.adlanda.knowledgesync.model.RunMode;
import com.adlanda.knowledgesync.model.SourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for document synchronization.
 *
 * Maps to properties prefixed with 'sync' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /**
     * Whether this process runs the sync side at all.
     * When false, only the web surface and (if enabled) the insights worker run.
     */
    private boolean enabled = true;

    /**
     * Where documents come from: local directory or remote drive folder.
     */
    @NotNull
    private SourceType source = SourceType.LOCAL;

    /**
     * Run one cycle and exit, or loop until shut down.
     */
    @NotNull
    private RunMode mode = RunMode.CONTINUOUS;

    /**
     * Time between cycles in continuous mode. Plain numbers are seconds.
     */
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pollInterval = Duration.ofSeconds(60);

    /**
     * Directory path (local) or folder id (remote) to synchronize.
     */
    private String watchRoot;

    /**
     * Checkpoint file used when the database is unreachable.
     */
    @NotBlank
    private String stateFile = "./data/sync-state.json";

    /**
     * How long shutdown waits for an in-flight cycle.
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Rough chunk size limit, estimated at ~4 characters per token.
     */
    @Min(1)
    private int maxTokens = 512;

    /**
     * File extensions picked up by the local watcher.
     */
    @NotEmpty
    private List<String> extensions = new ArrayList<>(List.of("txt", "md", "markdown", "csv", "json", "html", "htm"));

    @Valid
    private final Store store = new Store();

    @Valid
    private final Remote remote = new Remote();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public SourceType getSource() {
        return source;
    }

    public void setSource(SourceType source) {
        this.source = source;
    }

    public RunMode getMode() {
        return mode;
    }

    public void setMode(RunMode mode) {
        this.mode = mode;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getWatchRoot() {
        return watchRoot;
    }

    public void setWatchRoot(String watchRoot) {
        this.watchRoot = watchRoot;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }

    public Store getStore() {
        return store;
    }

    public Remote getRemote() {
        return remote;
    }

    /**
     * Key under which the durable checkpoint row is stored.
     * One row per source and root, so switching roots never reuses a stale index.
     */
    public String checkpointKey() {
        return source.name().toLowerCase() + ":" + watchRoot;
    }

    /**
     * Chunk store settings.
     */
    public static class Store {

        /**
         * "pgvector" for the PostgreSQL table, "memory" for a process-local store.
         */
        @NotBlank
        private String type = "pgvector";

        /**
         * Create the pgvector extension and chunk table on startup.
         */
        private boolean initializeSchema = true;

        @Min(1)
        private int dimensions = 1536;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    /**
     * Remote drive settings.
     */
    public static class Remote {

        /**
         * Service-credential JSON, inline. Tried first.
         */
        private String serviceCredentials;

        /**
         * Path to a token file from an interactive authorization. Tried second.
         */
        private String tokenFile;

        @NotBlank
        private String apiBaseUrl = "https://www.googleapis.com/drive/v3";

        /**
         * Retries of a single listing call on rate limits and server errors.
         */
        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(1);

        public String getServiceCredentials() {
            return serviceCredentials;
        }

        public void setServiceCredentials(String serviceCredentials) {
            this.serviceCredentials = serviceCredentials;
        }

        public String getTokenFile() {
            return tokenFile;
        }

        public void setTokenFile(String tokenFile) {
            this.tokenFile = tokenFile;
        }

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public boolean hasServiceCredentials() {
            return serviceCredentials != null && !serviceCredentials.isBlank();
        }

        public boolean hasTokenFile() {
            return tokenFile != null && !tokenFile.isBlank();
        }
    }
}
