package org.csits.lzs.manager.store;

/**
 * 目标无法以指定模式打开。
 */
public class OpenFailedException extends StoreException {

    public OpenFailedException(String message) {
        super(message);
    }

    public OpenFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
