package org.csits.lzs.manager.lzop;

/**
 * 压缩会话状态：UNOPENED -> WRITING -> CLOSED，不可回退。
 */
public enum SessionState {

    UNOPENED,

    WRITING,

    CLOSED
}
