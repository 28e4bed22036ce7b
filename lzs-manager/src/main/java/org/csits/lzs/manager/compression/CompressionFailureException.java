package org.csits.lzs.manager.compression;

/**
 * 块压缩失败：算法内部错误，或输出超过该块的理论最坏长度。
 * 调用方回退为写入压缩前的原始字节。
 */
public class CompressionFailureException extends Exception {

    public CompressionFailureException(String message) {
        super(message);
    }

    public CompressionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
