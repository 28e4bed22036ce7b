package org.csits.lzs.manager.store;

/**
 * 存储文件打开模式。
 */
public enum OpenMode {

    READ,

    /**
     * 新建（或覆盖）写入。
     */
    WRITE,

    /**
     * 在已有文件末尾追加。
     */
    APPEND
}
