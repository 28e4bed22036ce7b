package org.csits.lzs.manager.compression;

import io.airlift.compress.lzo.LzoCompressor;

/**
 * 快速变体：aircompressor 的 LZO1X-1 实现。
 */
public class FastLzoBlockCompressor implements BlockCompressor {

    private final LzoCompressor compressor = new LzoCompressor();

    @Override
    public int compress(byte[] input, int inputOffset, int inputLength,
                        byte[] output, int outputOffset, int maxOutputLength) throws CompressionFailureException {
        if (inputLength <= 0) {
            throw new CompressionFailureException("输入为空，不能编码为 LZO1X 块");
        }
        try {
            return compressor.compress(input, inputOffset, inputLength, output, outputOffset, maxOutputLength);
        } catch (RuntimeException e) {
            throw new CompressionFailureException("LZO1X-1 压缩失败: length=" + inputLength, e);
        }
    }

    @Override
    public int maxCompressedLength(int uncompressedLength) {
        return Math.max(compressor.maxCompressedLength(uncompressedLength),
            BlockCompressor.worstCaseBound(uncompressedLength));
    }
}
