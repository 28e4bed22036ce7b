package org.csits.lzs.manager.compression;

/**
 * 压缩算法变体。级别 9 使用最大压缩比变体，其余非零级别使用快速变体。
 */
public enum CompressionVariant {

    FAST,

    MAXIMAL;

    public static final int MAXIMAL_LEVEL = 9;

    /**
     * 按压缩级别选择变体，级别 0 表示不压缩，不应调用此方法。
     */
    public static CompressionVariant forLevel(int level) {
        if (level <= 0) {
            throw new IllegalArgumentException("压缩级别为 0 时不存在压缩变体: " + level);
        }
        return level == MAXIMAL_LEVEL ? MAXIMAL : FAST;
    }

    /**
     * 每次 flush 新建一个压缩器，其工作内存随 flush 结束释放。
     */
    public BlockCompressor newCompressor() {
        switch (this) {
            case MAXIMAL:
                return new MaximalLzoBlockCompressor();
            case FAST:
            default:
                return new FastLzoBlockCompressor();
        }
    }
}
