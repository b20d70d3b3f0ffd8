package com.adlanda.knowledgesync.config;

import com.adlanda.knowledgesync.watcher.ChangeDetector;
import com.adlanda.knowledgesync.watcher.DriveClient;
import com.adlanda.knowledgesync.watcher.DriveCredentials;
import com.adlanda.knowledgesync.watcher.DriveSourceWatcher;
import com.adlanda.knowledgesync.watcher.GoogleDriveRestClient;
import com.adlanda.knowledgesync.watcher.LocalSourceWatcher;
import com.adlanda.knowledgesync.watcher.SourceWatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Wires the source watcher variant selected by {@code sync.source}.
 */
@Configuration
public class SourceWatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(SourceWatcherConfig.class);

    @Bean
    public ChangeDetector changeDetector() {
        return new ChangeDetector();
    }

    @Bean
    public SourceWatcher sourceWatcher(SyncProperties properties,
                                       ChangeDetector changeDetector,
                                       ObjectProvider<DriveClient> driveClient) {
        log.info("Configuring source watcher: source={}, watchRoot={}",
                properties.getSource(), properties.getWatchRoot());

        return switch (properties.getSource()) {
            case LOCAL -> new LocalSourceWatcher(properties.getWatchRoot(), properties.getExtensions(), changeDetector);
            case REMOTE -> new DriveSourceWatcher(driveClient.getObject(), properties.getWatchRoot(), changeDetector);
        };
    }

    @Bean
    @ConditionalOnProperty(name = "sync.source", havingValue = "remote")
    public DriveCredentials driveCredentials(SyncProperties properties, ObjectMapper objectMapper) {
        return new DriveCredentials(properties.getRemote(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "sync.source", havingValue = "remote")
    public DriveClient driveClient(RestClient.Builder restClientBuilder,
                                   DriveCredentials driveCredentials,
                                   SyncProperties properties) {
        return new GoogleDriveRestClient(restClientBuilder, driveCredentials, properties.getRemote());
    }
}
