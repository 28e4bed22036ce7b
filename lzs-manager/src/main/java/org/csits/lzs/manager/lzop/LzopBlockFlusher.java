package org.csits.lzs.manager.lzop;

import java.io.ByteArrayOutputStream;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.manager.checksum.Adler32Checksum;
import org.csits.lzs.manager.compression.BlockCompressor;
import org.csits.lzs.manager.compression.CompressionFailureException;

/**
 * 积压缓冲的分块压缩与成帧。
 *
 * 非强制 flush 只处理完整块，余下不足一块的字节留在积压缓冲；强制 flush 将余数作为最后一个短块输出，
 * 任何情况下都不丢字节。
 */
@Slf4j
public class LzopBlockFlusher {

    private static final byte[] NO_BYTES = new byte[0];

    private final int blockSize;
    private final Supplier<BlockCompressor> compressorFactory;

    public LzopBlockFlusher(int blockSize, Supplier<BlockCompressor> compressorFactory) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("块大小必须大于 0: " + blockSize);
        }
        this.blockSize = blockSize;
        this.compressorFactory = compressorFactory;
    }

    public FlushResult flush(BacklogBuffer backlog, byte[] chunk, boolean force) {
        return flush(backlog, chunk == null ? NO_BYTES : chunk, 0, chunk == null ? 0 : chunk.length, force);
    }

    public FlushResult flush(BacklogBuffer backlog, byte[] chunk, int offset, int length, boolean force) {
        backlog.append(chunk, offset, length);
        int total = backlog.size();
        if (total < blockSize && !force) {
            return FlushResult.buffered();
        }

        int flushLength = force ? total : (total / blockSize) * blockSize;
        if (flushLength == 0) {
            return FlushResult.framed(NO_BYTES, 0, 0, 0);
        }

        byte[] data = backlog.array();
        // 压缩器工作内存与输出暂存区只在本次 flush 内有效
        BlockCompressor compressor = compressorFactory.get();
        byte[] scratch = new byte[compressor.maxCompressedLength(Math.min(blockSize, flushLength))];
        ByteArrayOutputStream frames = new ByteArrayOutputStream(flushLength + flushLength / 16 + 64);
        int compressedFrames = 0;
        int rawFrames = 0;
        try {
            for (int blockOffset = 0; blockOffset < flushLength; blockOffset += blockSize) {
                int blockLength = Math.min(blockSize, flushLength - blockOffset);
                LzopBlock block = compressBlock(compressor, data, blockOffset, blockLength, scratch);
                LzopFrameEncoder.writeFrame(block, frames);
                if (block.getForm() == LzopBlock.Form.COMPRESSED) {
                    compressedFrames++;
                } else {
                    rawFrames++;
                }
            }
        } catch (CompressionFailureException e) {
            log.warn("块压缩失败，回退为原样写出 {} 字节: {}", total, e.getMessage());
            byte[] original = backlog.toByteArray();
            backlog.clear();
            backlog.shrink(blockSize);
            return FlushResult.failed(original, e);
        }

        backlog.discard(flushLength);
        backlog.shrink(blockSize);
        log.debug("flush 完成: force={}, consumed={}, compressedFrames={}, rawFrames={}, retained={}",
            force, flushLength, compressedFrames, rawFrames, backlog.size());
        return FlushResult.framed(frames.toByteArray(), flushLength, compressedFrames, rawFrames);
    }

    private LzopBlock compressBlock(BlockCompressor compressor, byte[] data, int offset, int length,
                                    byte[] scratch) throws CompressionFailureException {
        int compressedLength = compressor.compress(data, offset, length, scratch, 0, scratch.length);
        if (compressedLength < 0 || compressedLength > BlockCompressor.worstCaseBound(length)) {
            throw new CompressionFailureException(
                "压缩输出超出理论上限: raw=" + length + ", compressed=" + compressedLength);
        }
        if (compressedLength < length) {
            int rawChecksum = Adler32Checksum.checksum(Adler32Checksum.ADLER32_INIT_VALUE, data, offset, length);
            int compressedChecksum = Adler32Checksum.checksum(
                Adler32Checksum.ADLER32_INIT_VALUE, scratch, 0, compressedLength);
            byte[] compressed = new byte[compressedLength];
            System.arraycopy(scratch, 0, compressed, 0, compressedLength);
            return LzopBlock.compressed(length, rawChecksum, compressedChecksum, compressed, compressedLength);
        }
        return LzopBlock.raw(data, offset, length);
    }
}
