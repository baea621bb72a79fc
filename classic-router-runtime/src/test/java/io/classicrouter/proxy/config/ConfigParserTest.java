/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void emptyConfigurationGivesDefaults() {
        RouteConfig config = configParser.parseConfiguration("");

        assertThat(config).isEqualTo(RouteConfig.defaults());
        assertThat(config.connectionSharing()).isFalse();
        assertThat(config.connectRetryTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(config.connectRetryInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.routerRequireEnforce()).isTrue();
        assertThat(config.waitForMyWrites()).isTrue();
        assertThat(config.waitForMyWritesTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void parsesEveryProperty() {
        RouteConfig config = configParser.parseConfiguration("""
                connectionSharing: true
                connectRetryTimeout: PT3S
                connectRetryInterval: PT0.25S
                routerRequireEnforce: false
                waitForMyWrites: false
                waitForMyWritesTimeout: PT0S
                """);

        assertThat(config).isEqualTo(new RouteConfig(true, Duration.ofSeconds(3), Duration.ofMillis(250), false, false, Duration.ZERO));
    }

    @Test
    void unsetPropertiesKeepTheirDefaults() {
        RouteConfig config = configParser.parseConfiguration("""
                connectionSharing: true
                """);

        assertThat(config).isEqualTo(RouteConfig.defaults().withConnectionSharing(true));
    }

    @Test
    void parsesFromStream() {
        RouteConfig config = configParser.parseConfiguration(
                new ByteArrayInputStream("waitForMyWritesTimeout: PT5S\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(config.waitForMyWritesTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void parsesFromResource() throws IOException {
        try (InputStream yaml = getClass().getResourceAsStream("route-config.yaml")) {
            assertThat(yaml).isNotNull();

            RouteConfig config = configParser.parseConfiguration(yaml);

            assertThat(config).isEqualTo(new RouteConfig(true, Duration.ofSeconds(10), Duration.ofMillis(200), true, true, Duration.ofSeconds(1)));
        }
    }

    @Test
    void unknownPropertyIsRejected() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                connectionSharingg: true
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse configuration");
    }

    @Test
    void negativeDurationIsRejected() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                connectRetryInterval: PT-1S
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasRootCauseMessage("connectRetryInterval must not be negative, was PT-1S");
    }

    @Test
    void negativeDurationIsRejectedProgrammatically() {
        RouteConfig defaults = RouteConfig.defaults();
        Duration negative = Duration.ofSeconds(-1);

        assertThatThrownBy(() -> defaults.withWaitForMyWritesTimeout(negative))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("waitForMyWritesTimeout");
    }
}
