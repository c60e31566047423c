package com.plotbinding.core.resources;

import com.plotbinding.core.model.LogLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DeploymentMode}.
 */
class DeploymentModeTest {

    @ParameterizedTest
    @CsvSource({
        "cdn,          REMOTE,         true",
        "cdn-dev,      REMOTE,         false",
        "inline,       EMBEDDED,       true",
        "inline-dev,   EMBEDDED,       false",
        "relative,     LOCAL_RELATIVE, true",
        "relative-dev, LOCAL_RELATIVE, false",
        "absolute,     LOCAL_ABSOLUTE, true",
        "absolute-dev, LOCAL_ABSOLUTE, false"
    })
    void fromString_knownName_returnsMode(String name, LocationKind locationKind, boolean minified) {
        DeploymentMode mode = DeploymentMode.fromString(name).orElseThrow();

        assertThat(mode.name()).isEqualTo(name);
        assertThat(mode.locationKind()).isEqualTo(locationKind);
        assertThat(mode.minified()).isEqualTo(minified);
    }

    @ParameterizedTest
    @ValueSource(strings = {"nonsense", "CDN", "Inline", "cdn-DEV", " cdn", "cdn ", ""})
    void fromString_unknownName_returnsEmpty(String name) {
        assertThat(DeploymentMode.fromString(name)).isEmpty();
    }

    @Test
    void fromString_null_returnsEmpty() {
        assertThat(DeploymentMode.fromString(null)).isEmpty();
    }

    @Test
    void developmentOverlay_isMoreVerboseThanProduction() {
        DeploymentMode prod = DeploymentMode.fromString("cdn").orElseThrow();
        DeploymentMode dev = DeploymentMode.fromString("cdn-dev").orElseThrow();

        assertThat(dev.logLevel().isMoreVerboseThan(prod.logLevel())).isTrue();
        assertThat(prod.logLevel()).isEqualTo(LogLevel.INFO);
        assertThat(dev.logLevel()).isEqualTo(LogLevel.DEBUG);
    }

    @Test
    void developmentOverlay_changesOnlyMinifiedLogLevelAndIndent() {
        for (DeploymentMode mode : DeploymentMode.values()) {
            if (!mode.isDevelopment()) {
                continue;
            }
            DeploymentMode prod = DeploymentMode.fromString(mode.name().replace("-dev", "")).orElseThrow();

            assertThat(mode.locationKind()).isEqualTo(prod.locationKind());
            assertThat(mode.baseUrl()).isEqualTo(prod.baseUrl());
            assertThat(mode.minified()).isFalse();
            assertThat(mode.indent()).isEqualTo(2);
            assertThat(prod.minified()).isTrue();
            assertThat(prod.indent()).isZero();
        }
    }

    @Test
    void values_containsEightModes() {
        assertThat(DeploymentMode.values()).hasSize(8)
            .extracting(DeploymentMode::name)
            .doesNotHaveDuplicates();
    }

    @Test
    void default_isProductionCdn() {
        assertThat(DeploymentMode.DEFAULT).isSameAs(DeploymentMode.CDN);
        assertThat(DeploymentMode.DEFAULT.baseUrl()).isEqualTo(URI.create("http://cdn.pydata.org/bokeh/release/"));
    }

    @Test
    void constructor_remoteWithoutBaseUrl_throwsException() {
        assertThatThrownBy(() -> new DeploymentMode("remote", LocationKind.REMOTE, true, LogLevel.INFO, 0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("base URL");
    }

    @Test
    void constructor_negativeIndent_throwsException() {
        assertThatThrownBy(() -> new DeploymentMode("inline", LocationKind.EMBEDDED, true, LogLevel.INFO, -1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
