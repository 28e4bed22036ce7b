package org.csits.lzs.server.service;

/**
 * {@link StoreFile#write} 的结果。
 */
public enum WriteResult {

    /**
     * 数据进入积压缓冲，尚未写出。
     */
    BUFFERED,

    /**
     * 若干完整块帧已写入存储。
     */
    FRAMED,

    /**
     * 未压缩（级别 0 或追加写入），数据已原样写入存储。
     */
    PASSTHROUGH,

    /**
     * 压缩失败，积压与本次数据已原样写入存储。
     */
    RAW_FALLBACK
}
