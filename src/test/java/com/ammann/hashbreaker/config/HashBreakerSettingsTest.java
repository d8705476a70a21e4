/* (C)2026 */
package com.ammann.hashbreaker.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.hashbreaker.enumeration.JobPriority;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class HashBreakerSettingsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        HashBreakerSettings settings = HashBreakerSettings.defaults();

        assertThat(settings.toolPath()).isEqualTo(Path.of("/usr/bin/hashcat"));
        assertThat(settings.defaultTimeoutSeconds()).isEqualTo(60);
        assertThat(settings.minTimeoutSeconds()).isEqualTo(10);
        assertThat(settings.maxTimeoutSeconds()).isEqualTo(3600);
        assertThat(settings.jobTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(settings.generatorBatchSize()).isEqualTo(10_000);
        assertThat(settings.streamFlushInterval()).isEqualTo(1000);
        assertThat(settings.maxRetries()).isEqualTo(3);
        assertThat(settings.laneWeight(JobPriority.HIGH)).isGreaterThan(settings.laneWeight(JobPriority.LOW));
        assertThat(settings.hardTimeLimit(JobPriority.NORMAL)).isEqualTo(Duration.ofMinutes(65));
    }

    @Test
    void toBuilderOverridesOnlyWhatIsSet() {
        HashBreakerSettings settings = HashBreakerSettings.defaults().toBuilder()
                .dispatcherWorkers(1)
                .hardTimeLimit(JobPriority.LOW, Duration.ofHours(2))
                .build();

        assertThat(settings.dispatcherWorkers()).isEqualTo(1);
        assertThat(settings.hardTimeLimit(JobPriority.LOW)).isEqualTo(Duration.ofHours(2));
        assertThat(settings.hardTimeLimit(JobPriority.HIGH)).isEqualTo(Duration.ofMinutes(65));
        assertThat(settings.maxRetries()).isEqualTo(3);
    }

    @Test
    void rejectsDefaultTimeoutOutsideBounds() {
        assertThatThrownBy(() -> HashBreakerSettings.builder().defaultTimeoutSeconds(5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Default timeout");
    }

    @Test
    void rejectsHardTimeLimitNotAboveMaxTimeout() {
        assertThatThrownBy(() -> HashBreakerSettings.builder()
                        .maxTimeoutSeconds(3600)
                        .hardTimeLimit(JobPriority.HIGH, Duration.ofMinutes(60))
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HIGH")
                .hasMessageContaining("3600s");
    }

    @Test
    void shippedConfigurationKeepsEveryLaneLimitAboveMaxTimeout() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/application.properties")) {
            assertThat(in).isNotNull();
            properties.load(in);
        }
        Duration maxTimeout = Duration.ofSeconds(Long.parseLong(properties.getProperty("hash-breaker.job.max-timeout")));

        for (String lane : new String[] {"high", "normal", "low"}) {
            Duration limit = Duration.parse(properties.getProperty("hash-breaker.dispatcher.hard-time-limit." + lane));
            assertThat(limit).as("%s lane", lane).isGreaterThan(maxTimeout);
        }
    }

    @Test
    void rejectsNonPositiveLaneWeight() {
        assertThatThrownBy(() -> HashBreakerSettings.builder().laneWeight(JobPriority.LOW, 0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("LOW");
    }
}
