package org.csits.lzs.manager.store;

/**
 * 无法连接外部存储，会话上的所有操作都失败。
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
