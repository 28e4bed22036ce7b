package org.csits.lzs.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.csits.lzs.manager.compression.CompressionVariant;
import org.csits.lzs.manager.lzop.CompressionSettings;
import org.csits.lzs.server.dto.StoreConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

class YamlConfigLoaderTest {

    private YamlConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlConfigLoader();
    }

    @Test
    void loadStoreConfig_parsesKeyFields() throws IOException {
        Resource resource = new ClassPathResource("conf/test_lzs.yaml");
        StoreConfig config = loader.loadStoreConfig(resource);

        assertThat(config).isNotNull();
        assertThat(config.getCompression().getLevel()).isEqualTo(9);
        assertThat(config.getCompression().getBlockSizeBytes()).isEqualTo(4096);
        assertThat(config.getCompression().getSuffix()).isEqualTo(".lzo");
        assertThat(config.getWrite().getChunkSizeBytes()).isEqualTo(1024);
        assertThat(config.getRetry().getMaxRetries()).isEqualTo(2);
        assertThat(config.getRetry().getRetryIntervalSec()).isZero();

        CompressionSettings settings = config.toCompressionSettings();
        assertThat(settings.getVariant()).isEqualTo(CompressionVariant.MAXIMAL);
        assertThat(settings.getBlockSizeBytes()).isEqualTo(4096);
        assertThat(config.chunkSizeOrDefault()).isEqualTo(1024);
    }

    @Test
    void toCompressionSettings_defaultsWhenSectionMissing() throws IOException {
        StoreConfig config = loader.loadStoreConfigFromString("retry:\n  maxRetries: 1\n");

        CompressionSettings settings = config.toCompressionSettings();
        assertThat(settings.getLevel()).isEqualTo(1);
        assertThat(settings.getBlockSizeBytes()).isEqualTo(256 * 1024);
        assertThat(settings.getNameSuffix()).isEqualTo(".lzo");
        assertThat(config.chunkSizeOrDefault()).isEqualTo(64 * 1024);
    }

    @Test
    void toCompressionSettings_rejectsInvalidLevel() throws IOException {
        StoreConfig config = loader.loadStoreConfigFromString("compression:\n  level: 12\n");

        assertThatThrownBy(config::toCompressionSettings).isInstanceOf(IllegalArgumentException.class);
    }
}
