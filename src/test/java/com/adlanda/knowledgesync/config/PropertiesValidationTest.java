package com.adlanda.knowledgesync.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesValidationTest {

    @EnableConfigurationProperties({SyncProperties.class, InsightsProperties.class})
    static class PropertiesConfig {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaults_bindCleanly() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(InsightsProperties.class).getWorker().getMaxConcurrent()).isEqualTo(3);
        });
    }

    @Test
    void workerSettings_bindFromProperties() {
        contextRunner
                .withPropertyValues("insights.worker.max-concurrent=5", "insights.worker.backoff-base=10")
                .run(context -> {
                    InsightsProperties.Worker worker = context.getBean(InsightsProperties.class).getWorker();
                    assertThat(worker.getMaxConcurrent()).isEqualTo(5);
                    assertThat(worker.getBackoffBase()).isEqualTo(Duration.ofSeconds(10));
                });
    }

    @Test
    void zeroMaxConcurrent_failsStartup() {
        contextRunner
                .withPropertyValues("insights.worker.max-concurrent=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }

    @Test
    void zeroMaxAttempts_failsStartup() {
        contextRunner
                .withPropertyValues("insights.worker.max-attempts=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void zeroMaxTokens_failsStartup() {
        contextRunner
                .withPropertyValues("sync.max-tokens=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }

    @Test
    void blankStoreType_failsStartup() {
        contextRunner
                .withPropertyValues("sync.store.type= ")
                .run(context -> assertThat(context).hasFailed());
    }
}
