package org.csits.lzs.manager.store;

import java.io.IOException;

/**
 * 外部文件存储错误的基类，原样抛给调用方，由调用方决定是否重试。
 */
public class StoreException extends IOException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
