package org.csits.lzs.server.dto;

import lombok.Data;

/**
 * 单个写入会话的统计信息
 */
@Data
public class SessionStatistics {
    private String target;
    private int level;
    private boolean compressed;

    private long bytesIn;
    private long bytesOut;
    private int compressedFrames;
    private int rawFrames;
    private int fallbackCount;

    private long openedAtMillis;
    private long durationMs;

    private Double compressionRatio;

    /**
     * 计算压缩率（输出/输入）
     */
    public void calculateCompressionRatio() {
        if (bytesIn > 0 && bytesOut > 0) {
            this.compressionRatio = (double) bytesOut / bytesIn;
        }
    }
}
