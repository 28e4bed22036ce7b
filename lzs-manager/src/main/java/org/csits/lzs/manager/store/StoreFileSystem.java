package org.csits.lzs.manager.store;

import java.io.IOException;
import java.util.List;

/**
 * 外部分布式文件存储抽象。编解码层只依赖这些直通操作，连接管理由实现负责。
 */
public interface StoreFileSystem {

    /**
     * 存储是否可用（已连接）。
     */
    boolean isAvailable();

    /**
     * 打开文件。
     *
     * @throws OpenFailedException       无法以该模式打开
     * @throws StoreUnavailableException 存储不可用
     */
    StoreHandle open(String path, OpenMode mode) throws IOException;

    /**
     * 写入字节，返回存储实际接收的字节数，可能小于 length。
     */
    int write(StoreHandle handle, byte[] data, int offset, int length) throws IOException;

    void flush(StoreHandle handle) throws IOException;

    void close(StoreHandle handle) throws IOException;

    /**
     * 删除文件，文件不存在时返回 false。
     */
    boolean delete(String path) throws IOException;

    /**
     * 文件大小，文件不存在时返回 -1。
     */
    long stat(String path) throws IOException;

    /**
     * 目录下条目的文件名（不含父路径），目录不存在时返回空列表。
     */
    List<String> listDirectory(String path) throws IOException;

    boolean exists(String path) throws IOException;
}
