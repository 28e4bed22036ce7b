package org.csits.lzs.manager.store;

import lombok.Getter;

/**
 * 存储接收的字节少于请求字节。帧边界无法再对齐，写出的流应视为已损坏。
 */
@Getter
public class ShortWriteException extends StoreException {

    private final String path;
    private final int requested;
    private final int written;

    public ShortWriteException(String path, int requested, int written) {
        super("写入不完整: path=" + path + ", requested=" + requested + ", written=" + written);
        this.path = path;
        this.requested = requested;
        this.written = written;
    }
}
