package org.csits.lzs.manager.lzop;

import java.io.ByteArrayOutputStream;

/**
 * 将数据块序列化为 lzop 块帧，大端序。
 *
 * <pre>
 * COMPRESSED: rawLen[4] | compLen[4] | rawAdler32[4] | compAdler32[4] | payload[compLen]
 * RAW:        rawLen[4] | rawLen[4] | payload[rawLen]
 * 结束:        0[4]
 * </pre>
 */
public final class LzopFrameEncoder {

    private LzopFrameEncoder() {
    }

    public static void writeFrame(LzopBlock block, ByteArrayOutputStream out) {
        writeInt(out, block.getRawLength());
        writeInt(out, block.getCompressedLength());
        if (block.getForm() == LzopBlock.Form.COMPRESSED) {
            writeInt(out, block.getRawChecksum());
            writeInt(out, block.getCompressedChecksum());
        }
        out.write(block.getPayload(), block.getPayloadOffset(), block.getPayloadLength());
    }

    public static int frameLength(LzopBlock block) {
        int fields = block.getForm() == LzopBlock.Form.COMPRESSED ? 4 : 2;
        return fields * LzopConstants.FIELD_SIZE + block.getPayloadLength();
    }

    /**
     * 流结束标记：原始长度为 0 的帧。
     */
    public static byte[] terminator() {
        return new byte[LzopConstants.FIELD_SIZE];
    }

    static void writeInt(ByteArrayOutputStream out, int v) {
        out.write((v >>> 24) & 0xff);
        out.write((v >>> 16) & 0xff);
        out.write((v >>> 8) & 0xff);
        out.write(v & 0xff);
    }
}
