package com.rebalancer.metrics.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsConfigTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @Test
    void defaults_matchServiceDefaults() {
        MetricsConfig config = MetricsConfig.defaults();

        assertThat(config.host()).isEqualTo("0.0.0.0");
        assertThat(config.port()).isEqualTo(8878);
        assertThat(config.datacenter()).isEqualTo("development");
        assertThat(config.service()).isEqualTo("1.rebalancer.localhost");
        assertThat(config.server()).isEqualTo("127.0.0.1");
    }

    @Test
    void loadFromProperties_readsClasspathFile() {
        MetricsConfig config = MetricsConfig.loadFromProperties("metrics-test.properties", NO_ENV::get);

        assertThat(config.host()).isEqualTo("127.0.0.1");
        assertThat(config.port()).isEqualTo(9191);
        assertThat(config.datacenter()).isEqualTo("us-east-1");
        assertThat(config.service()).isEqualTo("2.rebalancer.example.com");
        assertThat(config.server()).isEqualTo("10.0.0.12");
    }

    @Test
    void loadFromProperties_environmentOverridesFile() {
        Map<String, String> env = Map.of(
                MetricsConfig.ENV_PORT, "9300",
                MetricsConfig.ENV_DATACENTER, " ap-south-1 ");

        MetricsConfig config = MetricsConfig.loadFromProperties("metrics-test.properties", env::get);

        assertThat(config.port()).isEqualTo(9300);
        assertThat(config.datacenter()).isEqualTo("ap-south-1");
        assertThat(config.service()).isEqualTo("2.rebalancer.example.com");
    }

    @Test
    void loadFromProperties_invalidPortInEnvironment_isIgnored() {
        Map<String, String> env = Map.of(MetricsConfig.ENV_PORT, "not-a-port");

        MetricsConfig config = MetricsConfig.loadFromProperties("metrics-test.properties", env::get);

        assertThat(config.port()).isEqualTo(9191);
    }

    @Test
    void loadFromProperties_missingFile_usesDefaults() {
        MetricsConfig config = MetricsConfig.loadFromProperties("does-not-exist.properties", NO_ENV::get);

        assertThat(config.port()).isEqualTo(MetricsConfig.DEFAULT_PORT);
        assertThat(config.datacenter()).isEqualTo(MetricsConfig.DEFAULT_DATACENTER);
    }

    @Test
    void toBuilder_copiesAndOverrides() {
        MetricsConfig config = MetricsConfig.defaults().toBuilder()
                .server("10.1.1.1")
                .port(0)
                .build();

        assertThat(config.server()).isEqualTo("10.1.1.1");
        assertThat(config.port()).isZero();
        assertThat(config.service()).isEqualTo(MetricsConfig.DEFAULT_SERVICE);
    }

    @Test
    void build_portOutOfRange_throws() {
        assertThatThrownBy(() -> MetricsConfig.defaults().toBuilder().port(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port");
    }

    @Test
    void build_blankLabel_throws() {
        assertThatThrownBy(() -> MetricsConfig.defaults().toBuilder().datacenter(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("datacenter");
    }
}
