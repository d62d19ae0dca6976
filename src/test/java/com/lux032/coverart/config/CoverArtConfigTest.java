package com.lux032.coverart.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class CoverArtConfigTest {

    @Test
    void should_ProvideUsableDefaults() {
        CoverArtConfig config = new CoverArtConfig();

        assertThat(config.isValid()).isTrue();
        assertThat(config.getMaxCandidates()).isEqualTo(12);
        assertThat(config.isParallelFetch()).isTrue();
        assertThat(config.getCourtesyDelayMs()).isEqualTo(500);
        assertThat(config.getMaxImageBytes()).isEqualTo(500_000);
        assertThat(config.getSimilarityThreshold()).isEqualTo(0.85);
        assertThat(config.isLastFmUsable()).isFalse();
    }

    @Test
    void should_LoadValuesFromPropertiesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.properties");
        Files.write(file, String.join("\n",
            "language=zh_CN",
            "fetch.maxCandidates=6",
            "fetch.parallel=false",
            "image.maxBytes=250000",
            "consensus.similarityThreshold=0.9",
            "provider.itunes.enabled=false",
            "provider.lastfm.apiKey=abc123",
            "proxy.enabled=true",
            "proxy.host=127.0.0.1",
            "proxy.port=7890").getBytes(StandardCharsets.UTF_8));

        CoverArtConfig config = new CoverArtConfig();
        boolean loaded = config.loadFromFile(file.toString());

        assertThat(loaded).isTrue();
        assertThat(config.getLanguage()).isEqualTo("zh_CN");
        assertThat(config.getMaxCandidates()).isEqualTo(6);
        assertThat(config.isParallelFetch()).isFalse();
        assertThat(config.getMaxImageBytes()).isEqualTo(250_000);
        assertThat(config.getSimilarityThreshold()).isEqualTo(0.9);
        assertThat(config.isItunesEnabled()).isFalse();
        assertThat(config.isLastFmUsable()).isTrue();
        assertThat(config.getProxyPort()).isEqualTo(7890);
        // 未出现的键保持默认值
        assertThat(config.isMusicBrainzEnabled()).isTrue();
    }

    @Test
    void should_KeepDefaults_When_FileIsMissing(@TempDir Path dir) {
        CoverArtConfig config = new CoverArtConfig();

        assertThat(config.loadFromFile(dir.resolve("missing.properties").toString())).isFalse();
        assertThat(config.getMaxCandidates()).isEqualTo(12);
    }

    @Test
    void should_KeepDefault_When_NumberIsMalformed() {
        Properties props = new Properties();
        props.setProperty("fetch.maxCandidates", "twelve");
        props.setProperty("fetch.providerTimeoutSeconds", " 15 ");

        CoverArtConfig config = new CoverArtConfig();
        config.applyProperties(props);

        assertThat(config.getMaxCandidates()).isEqualTo(12);
        assertThat(config.getProviderTimeoutSeconds()).isEqualTo(15);
    }

    @Test
    void should_BeInvalid_When_ThresholdIsOutOfRange() {
        CoverArtConfig config = new CoverArtConfig();
        config.setSimilarityThreshold(1.5);

        assertThat(config.isValid()).isFalse();
    }

    @Test
    void should_BeInvalid_When_LimitsAreNotPositive() {
        CoverArtConfig noBudget = new CoverArtConfig();
        noBudget.setMaxImageBytes(0);
        CoverArtConfig noCandidates = new CoverArtConfig();
        noCandidates.setMaxCandidates(0);
        CoverArtConfig negativeDelay = new CoverArtConfig();
        negativeDelay.setCourtesyDelayMs(-1);

        assertThat(noBudget.isValid()).isFalse();
        assertThat(noCandidates.isValid()).isFalse();
        assertThat(negativeDelay.isValid()).isFalse();
    }
}
