package org.csits.lzs.server.service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.manager.lzop.CompressionSession;
import org.csits.lzs.manager.lzop.CompressionSettings;
import org.csits.lzs.manager.lzop.FlushResult;
import org.csits.lzs.manager.lzop.SessionState;
import org.csits.lzs.manager.store.OpenFailedException;
import org.csits.lzs.manager.store.OpenMode;
import org.csits.lzs.manager.store.ShortWriteException;
import org.csits.lzs.manager.store.StoreFileSystem;
import org.csits.lzs.manager.store.StoreHandle;
import org.csits.lzs.manager.store.StoreUnavailableException;
import org.csits.lzs.server.dto.SessionStatistics;

/**
 * 外部存储上的单个目标文件。新建文件时写入 lzop 头部并按块压缩，已存在的文件以追加方式原样写入。
 *
 * 非线程安全：同一实例的操作须由调用方串行执行，每个写线程使用自己的实例。
 */
@Slf4j
public class StoreFile {

    @Getter
    private final String name;
    private final StoreFileSystem fileSystem;
    private final CompressionMetrics metrics;

    @Getter
    private CompressionSettings settings;

    private StoreHandle handle;

    /**
     * 最近一次写打开的会话，关闭后保留以便查看统计；只读打开时为 null。
     */
    @Getter
    private CompressionSession session;
    private long openedAt;

    /**
     * @param fileSystem 外部存储，为 null 表示未配置存储
     * @param metrics    会话统计，可为 null
     */
    public StoreFile(String name, StoreFileSystem fileSystem, CompressionSettings settings,
                     CompressionMetrics metrics) {
        this.name = name;
        this.fileSystem = fileSystem;
        this.settings = settings;
        this.metrics = metrics;
        if (fileSystem == null) {
            log.error("未配置外部存储，文件不可用: {}", name);
        }
    }

    public boolean openRead() throws IOException {
        requireFileSystem();
        if (handle != null) {
            log.info("文件已打开，忽略读打开: {}", name);
            return false;
        }
        try {
            handle = fileSystem.open(name, OpenMode.READ);
        } catch (OpenFailedException e) {
            log.warn("读打开失败: {}, {}", name, e.getMessage());
            return false;
        }
        session = null;
        log.info("已打开读取: {}", name);
        return true;
    }

    /**
     * 打开写入。文件已存在时追加且本次会话不压缩；否则新建并在压缩时写入 lzop 头部。
     *
     * @return 已打开或存储拒绝打开时返回 false
     * @throws StoreUnavailableException 未配置存储或存储不可用
     */
    public boolean openWrite() throws IOException {
        requireFileSystem();
        if (handle != null) {
            log.info("文件已打开写入，忽略: {}", name);
            return false;
        }
        boolean append = fileSystem.exists(name);
        OpenMode mode = append ? OpenMode.APPEND : OpenMode.WRITE;
        try {
            handle = fileSystem.open(name, mode);
        } catch (OpenFailedException e) {
            log.error("打开文件失败: {}, mode={}, {}", name, mode, e.getMessage());
            return false;
        }
        session = new CompressionSession(settings);
        openedAt = System.currentTimeMillis();
        byte[] header = session.open(name, append);
        log.info("已打开{}: {}", append ? "追加" : "写入", name);
        if (header.length > 0) {
            log.info("写入 LZO 头部: {}", name);
            writeFully(header);
        }
        return true;
    }

    /**
     * 删除后重新打开写入。
     */
    public boolean openTruncate() throws IOException {
        log.info("截断文件: {}", name);
        deleteFile();
        return openWrite();
    }

    public boolean isOpen() {
        return handle != null && handle.isOpen();
    }

    public WriteResult write(byte[] data) throws IOException {
        return write(data, 0, data.length);
    }

    /**
     * 写入一段数据，未打开时先以写方式打开。
     *
     * @throws OpenFailedException 无法打开写入
     * @throws ShortWriteException 存储接收的字节不足，文件应视为损坏
     */
    public WriteResult write(byte[] data, int offset, int length) throws IOException {
        if (!isOpen() && !openWrite()) {
            throw new OpenFailedException("无法打开文件写入: " + name);
        }
        if (session == null) {
            throw new IllegalStateException("文件以只读方式打开: " + name);
        }
        FlushResult result = session.write(data, offset, length);
        if (result.hasOutput()) {
            writeFully(result.getOutput());
        }
        switch (result.getStatus()) {
            case PASSTHROUGH:
                return WriteResult.PASSTHROUGH;
            case FAILED:
                log.warn("压缩失败，已原样写出 {} 字节: {}", result.getOutput().length, name);
                return WriteResult.RAW_FALLBACK;
            case FRAMED:
                return WriteResult.FRAMED;
            case BUFFERED:
            default:
                return WriteResult.BUFFERED;
        }
    }

    public void flush() throws IOException {
        if (isOpen()) {
            fileSystem.flush(handle);
        }
    }

    /**
     * 写出积压数据与结束标记后关闭。未打开时不做任何事。
     */
    public void close() throws IOException {
        if (handle == null) {
            log.debug("文件未打开，无需关闭: {}", name);
            return;
        }
        try {
            if (session != null && session.getState() == SessionState.WRITING) {
                FlushResult result = session.close();
                if (result.hasOutput()) {
                    writeFully(result.getOutput());
                }
                recordStatistics();
            }
        } finally {
            StoreHandle closing = handle;
            handle = null;
            fileSystem.close(closing);
            log.info("已关闭: {}", name);
        }
    }

    /**
     * 文件大小，存储不可用或文件不存在时为 0。
     */
    public long fileSize() throws IOException {
        if (fileSystem == null) {
            return 0L;
        }
        long size = fileSystem.stat(name);
        return size < 0 ? 0L : size;
    }

    public void deleteFile() throws IOException {
        requireFileSystem();
        boolean deleted = fileSystem.delete(name);
        log.info("删除文件: {}, deleted={}", name, deleted);
    }

    /**
     * 列出目录下的条目名，目录不存在或未配置存储时返回空列表。
     */
    public List<String> list(String path) throws IOException {
        if (fileSystem == null || !fileSystem.exists(path)) {
            return Collections.emptyList();
        }
        return fileSystem.listDirectory(path);
    }

    /**
     * 设置下一次打开写入时使用的压缩级别。
     */
    public void setCompressionLevel(int level) {
        if (isOpen()) {
            throw new IllegalStateException("文件已打开，不能修改压缩级别: " + name);
        }
        log.info("设置 LZO 压缩级别为 {}: {}", level, name);
        settings = settings.withLevel(level);
    }

    private void writeFully(byte[] bytes) throws IOException {
        int written;
        try {
            written = fileSystem.write(handle, bytes, 0, bytes.length);
        } catch (IOException e) {
            log.error("写入存储失败: {}, {}", name, e.getMessage());
            throw e;
        }
        if (written != bytes.length) {
            log.error("写入不完整: {}, requested={}, written={}", name, bytes.length, written);
            throw new ShortWriteException(name, bytes.length, written);
        }
    }

    private void recordStatistics() {
        if (metrics == null) {
            return;
        }
        SessionStatistics stats = new SessionStatistics();
        stats.setTarget(name);
        stats.setLevel(settings.getLevel());
        stats.setCompressed(session.isCompressionEnabled());
        stats.setBytesIn(session.getBytesIn());
        stats.setBytesOut(session.getBytesOut());
        stats.setCompressedFrames(session.getCompressedFrames());
        stats.setRawFrames(session.getRawFrames());
        stats.setFallbackCount(session.getFallbackCount());
        stats.setOpenedAtMillis(openedAt);
        stats.setDurationMs(System.currentTimeMillis() - openedAt);
        metrics.recordSession(stats);
    }

    private void requireFileSystem() throws StoreUnavailableException {
        if (fileSystem == null) {
            throw new StoreUnavailableException("未配置外部存储: " + name);
        }
    }
}
