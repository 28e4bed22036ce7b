package org.csits.lzs.manager.lzop;

import lombok.Getter;
import org.csits.lzs.manager.compression.CompressionVariant;

/**
 * 单个压缩会话的不可变配置。
 */
@Getter
public final class CompressionSettings {

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 9;

    /**
     * 0 表示不压缩（直写），1~8 快速变体，9 最大压缩比变体。
     */
    private final int level;

    private final int blockSizeBytes;

    /**
     * 写入头部文件名前需去掉的压缩后缀。
     */
    private final String nameSuffix;

    public CompressionSettings(int level, int blockSizeBytes, String nameSuffix) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("压缩级别必须在 0~9 之间: " + level);
        }
        if (blockSizeBytes <= 0) {
            throw new IllegalArgumentException("块大小必须大于 0: " + blockSizeBytes);
        }
        this.level = level;
        this.blockSizeBytes = blockSizeBytes;
        this.nameSuffix = nameSuffix == null ? "" : nameSuffix;
    }

    public static CompressionSettings of(int level) {
        return new CompressionSettings(level, LzopConstants.DEFAULT_BLOCK_SIZE, LzopConstants.DEFAULT_SUFFIX);
    }

    public static CompressionSettings disabled() {
        return of(0);
    }

    public boolean isCompressionEnabled() {
        return level != 0;
    }

    public CompressionVariant getVariant() {
        return isCompressionEnabled() ? CompressionVariant.forLevel(level) : null;
    }

    public CompressionSettings withLevel(int newLevel) {
        return new CompressionSettings(newLevel, blockSizeBytes, nameSuffix);
    }

    @Override
    public String toString() {
        return "CompressionSettings{level=" + level + ", blockSizeBytes=" + blockSizeBytes
            + ", nameSuffix='" + nameSuffix + "'}";
    }
}
