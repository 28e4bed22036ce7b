package org.csits.lzs.manager.lzop;

import java.util.Arrays;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.manager.compression.BlockCompressor;
import org.csits.lzs.manager.compression.CompressionVariant;

/**
 * 单个写入流的 lzop 编码状态机。
 *
 * 会话不做任何同步，同一会话的 write/close 必须由调用方串行调用；不同会话之间没有共享可变状态。
 */
@Slf4j
public class CompressionSession {

    private static final byte[] NO_BYTES = new byte[0];

    @Getter
    private final CompressionSettings settings;
    private final LzopBlockFlusher flusher;
    private final BacklogBuffer backlog = new BacklogBuffer();

    @Getter
    private SessionState state = SessionState.UNOPENED;

    /**
     * 追加打开时即使配置了压缩级别也为 false。
     */
    @Getter
    private boolean compressionEnabled;

    @Getter
    private boolean headerEmitted;

    @Getter
    private long bytesIn;
    @Getter
    private long bytesOut;
    @Getter
    private int compressedFrames;
    @Getter
    private int rawFrames;
    @Getter
    private int fallbackCount;

    public CompressionSession(CompressionSettings settings) {
        this(settings, defaultCompressorFactory(settings));
    }

    public CompressionSession(CompressionSettings settings, Supplier<BlockCompressor> compressorFactory) {
        this.settings = settings;
        this.flusher = compressorFactory == null
            ? null : new LzopBlockFlusher(settings.getBlockSizeBytes(), compressorFactory);
    }

    /**
     * 打开会话，返回需要首先写出的字节（新建压缩文件时为 lzop 头部，否则为空）。
     *
     * @param targetName 目标路径，文件名去掉压缩后缀后写入头部
     * @param append     目标已存在，以追加方式打开；此时禁用压缩
     */
    public byte[] open(String targetName, boolean append) {
        if (state != SessionState.UNOPENED) {
            throw new IllegalStateException("会话已打开过: state=" + state);
        }
        compressionEnabled = settings.isCompressionEnabled() && flusher != null && !append;
        state = SessionState.WRITING;
        if (!compressionEnabled) {
            if (append && settings.isCompressionEnabled()) {
                log.info("追加写入 {}，本次会话关闭 LZO 压缩", targetName);
            }
            return NO_BYTES;
        }
        String baseName = LzopHeaderWriter.baseName(targetName, settings.getNameSuffix());
        byte[] header = LzopHeaderWriter.writeHeader(baseName, settings.getLevel());
        headerEmitted = true;
        bytesOut += header.length;
        log.debug("生成 lzop 头部: target={}, name={}, level={}", targetName, baseName, settings.getLevel());
        return header;
    }

    public FlushResult write(byte[] chunk) {
        return write(chunk, 0, chunk.length);
    }

    public FlushResult write(byte[] chunk, int offset, int length) {
        if (state != SessionState.WRITING) {
            throw new IllegalStateException("会话不可写: state=" + state);
        }
        bytesIn += length;
        if (!compressionEnabled) {
            byte[] copy = Arrays.copyOfRange(chunk, offset, offset + length);
            bytesOut += copy.length;
            return FlushResult.passthrough(copy);
        }
        FlushResult result = flusher.flush(backlog, chunk, offset, length, false);
        record(result);
        return result;
    }

    /**
     * 关闭会话：强制 flush 积压数据并追加结束标记。未打开或已关闭时不做任何事。
     */
    public FlushResult close() {
        if (state != SessionState.WRITING) {
            return FlushResult.buffered();
        }
        state = SessionState.CLOSED;
        if (!compressionEnabled) {
            return FlushResult.buffered();
        }
        FlushResult result = flusher.flush(backlog, NO_BYTES, 0, 0, true);
        record(result);
        byte[] terminator = LzopFrameEncoder.terminator();
        bytesOut += terminator.length;
        return result.withTrailer(terminator);
    }

    private static Supplier<BlockCompressor> defaultCompressorFactory(CompressionSettings settings) {
        if (!settings.isCompressionEnabled()) {
            return null;
        }
        CompressionVariant variant = settings.getVariant();
        return variant::newCompressor;
    }

    public int getBacklogSize() {
        return backlog.size();
    }

    private void record(FlushResult result) {
        bytesOut += result.getOutput().length;
        compressedFrames += result.getCompressedFrames();
        rawFrames += result.getRawFrames();
        if (result.isFailed()) {
            fallbackCount++;
        }
    }
}
