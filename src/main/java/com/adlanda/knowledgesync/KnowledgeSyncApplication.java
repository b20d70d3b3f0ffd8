package com.adlanda.knowledgesync;

import com.adlanda.knowledgesync.service.ModeDispatcher;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Knowledge Sync - Main Application
 *
 * Keeps a knowledge store in step with a document tree (a local directory or a Google Drive
 * folder) and derives project insights from what it ingests.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embeddings and insight extraction via OpenAI
 * - PostgreSQL with pgvector for chunks, checkpoints and the insights queue
 *
 * In single mode the JVM exits with the cycle's exit code once the run completes.
 */
@SpringBootApplication
public class KnowledgeSyncApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(KnowledgeSyncApplication.class, args);

        if (context.getBean(ModeDispatcher.class).isFinished()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
