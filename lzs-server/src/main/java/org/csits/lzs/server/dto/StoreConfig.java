package org.csits.lzs.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.csits.lzs.manager.lzop.CompressionSettings;
import org.csits.lzs.manager.lzop.LzopConstants;

/**
 * 写入配置，对应 lzs.yaml。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

    private CompressionConfig compression;

    private WriteConfig write;

    private RetryConfig retry;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompressionConfig {

        /**
         * 0 不压缩，1~8 快速，9 最大压缩比。
         */
        private Integer level;

        @JsonProperty("block_size_bytes")
        private Integer blockSizeBytes;

        /**
         * 压缩文件后缀，写入头部的文件名会去掉它。
         */
        private String suffix;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WriteConfig {

        /**
         * 启动程序从源文件读取的分片大小。
         */
        @JsonProperty("chunk_size_bytes")
        private Integer chunkSizeBytes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {

        private Integer maxRetries;

        /**
         * 重试间隔（秒）。
         */
        private Integer retryIntervalSec;
    }

    /**
     * 按配置生成压缩参数，未配置的项取默认值（级别 1、块 256KB、后缀 .lzo）。
     */
    public CompressionSettings toCompressionSettings() {
        int level = 1;
        int blockSize = LzopConstants.DEFAULT_BLOCK_SIZE;
        String suffix = LzopConstants.DEFAULT_SUFFIX;
        if (compression != null) {
            if (compression.getLevel() != null) {
                level = compression.getLevel();
            }
            if (compression.getBlockSizeBytes() != null) {
                blockSize = compression.getBlockSizeBytes();
            }
            if (compression.getSuffix() != null) {
                suffix = compression.getSuffix();
            }
        }
        return new CompressionSettings(level, blockSize, suffix);
    }

    public int chunkSizeOrDefault() {
        return write != null && write.getChunkSizeBytes() != null && write.getChunkSizeBytes() > 0
            ? write.getChunkSizeBytes() : 64 * 1024;
    }
}
