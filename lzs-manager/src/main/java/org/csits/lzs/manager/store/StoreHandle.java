package org.csits.lzs.manager.store;

/**
 * 外部存储上已打开文件的句柄，只在创建它的 {@link StoreFileSystem} 内有效。
 */
public interface StoreHandle {

    String getPath();

    OpenMode getMode();

    boolean isOpen();
}
