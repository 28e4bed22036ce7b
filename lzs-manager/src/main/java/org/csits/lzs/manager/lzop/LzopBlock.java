package org.csits.lzs.manager.lzop;

import lombok.Getter;

/**
 * 一个待编码的数据块，flush 时创建，编码成帧后即丢弃。
 */
@Getter
public final class LzopBlock {

    public enum Form {
        /**
         * 原样存储，帧中压缩长度等于原始长度，无校验字段。
         */
        RAW,

        /**
         * 压缩存储，带原文与压缩数据两个 Adler-32。
         */
        COMPRESSED
    }

    private final Form form;
    private final int rawLength;
    private final int rawChecksum;
    private final int compressedChecksum;

    /**
     * 帧负载：RAW 为原文，COMPRESSED 为压缩数据。
     */
    private final byte[] payload;
    private final int payloadOffset;
    private final int payloadLength;

    private LzopBlock(Form form, int rawLength, int rawChecksum, int compressedChecksum,
                      byte[] payload, int payloadOffset, int payloadLength) {
        this.form = form;
        this.rawLength = rawLength;
        this.rawChecksum = rawChecksum;
        this.compressedChecksum = compressedChecksum;
        this.payload = payload;
        this.payloadOffset = payloadOffset;
        this.payloadLength = payloadLength;
    }

    public static LzopBlock raw(byte[] data, int offset, int length) {
        return new LzopBlock(Form.RAW, length, 0, 0, data, offset, length);
    }

    public static LzopBlock compressed(int rawLength, int rawChecksum, int compressedChecksum,
                                       byte[] compressed, int compressedLength) {
        return new LzopBlock(Form.COMPRESSED, rawLength, rawChecksum, compressedChecksum,
            compressed, 0, compressedLength);
    }

    /**
     * RAW 帧的压缩长度字段与原始长度相同。
     */
    public int getCompressedLength() {
        return payloadLength;
    }
}
