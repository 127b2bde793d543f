/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.common.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigPropertyResolverTest {

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty("subbridge.test.project");
    }

    @Test
    void plainValuesPassThrough() {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver();
        assertThat(resolver.resolve("orders")).isEqualTo("orders");
        assertThat(resolver.resolve(null)).isNull();
    }

    @Test
    void resolvesFromBackingProperties() {
        Properties props = new Properties();
        props.setProperty("gcp.project", "acme-prod");
        ConfigPropertyResolver resolver = new ConfigPropertyResolver(props);

        assertThat(resolver.resolve("projects/${gcp.project}/topics")).isEqualTo("projects/acme-prod/topics");
    }

    @Test
    void systemPropertyWinsOverBackingProperties() {
        Properties props = new Properties();
        props.setProperty("subbridge.test.project", "from-file");
        System.setProperty("subbridge.test.project", "from-jvm");

        assertThat(new ConfigPropertyResolver(props).resolve("${subbridge.test.project}")).isEqualTo("from-jvm");
    }

    @Test
    void fallsBackToDefaultWithEscapedColon() {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver();
        assertThat(resolver.resolve("${subbridge.unset.emulator:localhost\\:8085}")).isEqualTo("localhost:8085");
    }

    @Test
    void getResolvesStoredValue() {
        Properties props = new Properties();
        props.setProperty("a", "${b}-x");
        props.setProperty("b", "value");
        ConfigPropertyResolver resolver = new ConfigPropertyResolver(props);

        assertThat(resolver.get("a", null)).isEqualTo("value-x");
        assertThat(resolver.get("missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    void unresolvablePlaceholderFails() {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver();
        assertThatThrownBy(() -> resolver.resolve("${subbridge.definitely.unset.key}"))
                .isInstanceOf(ConfigPropertyResolver.ConfigResolutionException.class)
                .hasMessageContaining("subbridge.definitely.unset.key");
    }

    @Test
    void missingClasspathResourceIsIgnored() {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver();
        resolver.loadClasspathProperties("no-such-file.properties");
        assertThat(resolver.get("anything", "d")).isEqualTo("d");
    }
}
