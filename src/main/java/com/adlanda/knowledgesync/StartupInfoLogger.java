package com.adlanda.knowledgesync;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.repository.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0) // Run before ModeDispatcher
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final SyncProperties syncProperties;
    private final InsightsProperties insightsProperties;
    private final ChunkStore chunkStore;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(SyncProperties syncProperties,
                             InsightsProperties insightsProperties,
                             ChunkStore chunkStore) {
        this.syncProperties = syncProperties;
        this.insightsProperties = insightsProperties;
        this.chunkStore = chunkStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Knowledge Sync v{}
            Source: {} {} ({} mode, every {})
            Store: {} ({} chunks)
            Insights worker: {} (maxConcurrent={})

            API Endpoints:
              GET  http://localhost:{}/api/v1
              GET  http://localhost:{}/api/v1/insights/queue/stats
              POST http://localhost:{}/api/v1/insights/queue/retroactive
              POST http://localhost:{}/api/v1/insights/queue/reset-failed

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version,
            syncProperties.getSource(), syncProperties.getWatchRoot(),
            syncProperties.getMode(), syncProperties.getPollInterval(),
            syncProperties.getStore().getType(), chunkStore.count(),
            insightsProperties.getWorker().isEnabled() ? "enabled" : "disabled",
            insightsProperties.getWorker().getMaxConcurrent(),
            port, port, port, port, port
        );
    }
}
