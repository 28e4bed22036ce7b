package org.csits.lzs.manager.lzop;

import java.util.Arrays;
import lombok.Getter;
import org.csits.lzs.manager.compression.CompressionFailureException;

/**
 * 一次 write/close 的编码结果。{@link #getOutput()} 是需要按顺序推送到存储的字节，
 * 任何状态下都可直接写出。
 */
@Getter
public final class FlushResult {

    private static final byte[] EMPTY = new byte[0];

    public enum Status {
        /**
         * 数据进入积压缓冲，无输出。
         */
        BUFFERED,

        /**
         * 输出为若干完整块帧。
         */
        FRAMED,

        /**
         * 未启用压缩，输出即输入。
         */
        PASSTHROUGH,

        /**
         * 压缩失败，输出为压缩前的原始字节（积压 + 本次输入）。
         */
        FAILED
    }

    private final Status status;

    /**
     * 返回的数组不再被会话引用，归调用方所有。
     */
    private final byte[] output;

    /**
     * 输出所覆盖的逻辑输入字节数。
     */
    private final long consumedBytes;
    private final int compressedFrames;
    private final int rawFrames;
    private final CompressionFailureException failure;

    private FlushResult(Status status, byte[] output, long consumedBytes, int compressedFrames,
                        int rawFrames, CompressionFailureException failure) {
        this.status = status;
        this.output = output;
        this.consumedBytes = consumedBytes;
        this.compressedFrames = compressedFrames;
        this.rawFrames = rawFrames;
        this.failure = failure;
    }

    public static FlushResult buffered() {
        return new FlushResult(Status.BUFFERED, EMPTY, 0, 0, 0, null);
    }

    public static FlushResult framed(byte[] frames, long consumedBytes, int compressedFrames, int rawFrames) {
        return new FlushResult(Status.FRAMED, frames, consumedBytes, compressedFrames, rawFrames, null);
    }

    public static FlushResult passthrough(byte[] data) {
        return new FlushResult(Status.PASSTHROUGH, data, data.length, 0, 0, null);
    }

    public static FlushResult failed(byte[] original, CompressionFailureException cause) {
        return new FlushResult(Status.FAILED, original, original.length, 0, 0, cause);
    }

    public boolean hasOutput() {
        return output.length > 0;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * 在输出末尾追加字节（close 时的结束标记），状态不变；仅缓冲时变为 FRAMED。
     */
    public FlushResult withTrailer(byte[] trailer) {
        byte[] merged = Arrays.copyOf(output, output.length + trailer.length);
        System.arraycopy(trailer, 0, merged, output.length, trailer.length);
        Status mergedStatus = status == Status.BUFFERED ? Status.FRAMED : status;
        return new FlushResult(mergedStatus, merged, consumedBytes, compressedFrames, rawFrames, failure);
    }
}
