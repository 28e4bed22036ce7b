package org.csits.lzs.manager.compression;

/**
 * 单块压缩抽象。输出为 LZO1X 原始比特流（以 0x11 0x00 0x00 结束），任意 LZO1X 解码器可读。
 */
public interface BlockCompressor {

    /**
     * 压缩 input[inputOffset, inputOffset + inputLength)，结果写入 output。inputLength 必须大于 0，
     * 空块没有合法的 LZO1X 编码。
     *
     * @return 压缩后长度
     * @throws CompressionFailureException 输入为空、压缩失败或输出缓冲不足
     */
    int compress(byte[] input, int inputOffset, int inputLength,
                 byte[] output, int outputOffset, int maxOutputLength) throws CompressionFailureException;

    /**
     * 给定原文长度时输出缓冲至少需要的长度。
     */
    int maxCompressedLength(int uncompressedLength);

    /**
     * 压缩结果允许的最大长度，超出即视为算法异常（LZO1X 最坏情况：n + n/16 + 64 + 3）。
     */
    static int worstCaseBound(int uncompressedLength) {
        return uncompressedLength + uncompressedLength / 16 + 64 + 3;
    }
}
