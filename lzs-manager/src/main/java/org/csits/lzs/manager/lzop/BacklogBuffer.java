package org.csits.lzs.manager.lzop;

import java.util.Arrays;

/**
 * 跨多次 write 累积尚未凑满一个块的字节。非线程安全，由所属会话独占。
 */
public class BacklogBuffer {

    private static final int INITIAL_CAPACITY = 8192;

    private byte[] buffer;
    private int size;

    public BacklogBuffer() {
        this(INITIAL_CAPACITY);
    }

    public BacklogBuffer(int initialCapacity) {
        this.buffer = new byte[Math.max(initialCapacity, 16)];
    }

    public void append(byte[] data, int offset, int length) {
        if (length == 0) {
            return;
        }
        ensureCapacity(size + length);
        System.arraycopy(data, offset, buffer, size, length);
        size += length;
    }

    /**
     * 丢弃已成帧的前 length 个字节，剩余字节移到缓冲区头部。
     */
    public void discard(int length) {
        if (length < 0 || length > size) {
            throw new IllegalArgumentException("discard length " + length + " out of range, size=" + size);
        }
        int remaining = size - length;
        if (remaining > 0) {
            System.arraycopy(buffer, length, buffer, 0, remaining);
        }
        size = remaining;
    }

    public void clear() {
        size = 0;
    }

    /**
     * 容量超过 max(size(), minCapacity) 两倍时收缩回该值，避免一次大写入长期占住大数组。
     */
    public void shrink(int minCapacity) {
        int target = Math.max(Math.max(size, minCapacity), 16);
        if (buffer.length > target * 2L) {
            buffer = Arrays.copyOf(buffer, target);
        }
    }

    public int capacity() {
        return buffer.length;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 底层数组，有效数据为 [0, size())。
     */
    byte[] array() {
        return buffer;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(int required) {
        if (required < 0) {
            throw new OutOfMemoryError("backlog too large");
        }
        if (required > buffer.length) {
            int newCapacity = Math.max(required, buffer.length << 1);
            if (newCapacity < 0) {
                newCapacity = required;
            }
            buffer = Arrays.copyOf(buffer, newCapacity);
        }
    }
}
