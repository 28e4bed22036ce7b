package org.csits.lzs.manager.checksum;

/**
 * 带初始值的 Adler-32 校验和。
 *
 * lzop 头校验、块原文校验、块压缩数据校验都以 {@link #ADLER32_INIT_VALUE} 为种子独立计算，不跨块串联。
 */
public final class Adler32Checksum {

    /**
     * 空输入的 Adler-32 值，lzop 约定的种子。
     */
    public static final int ADLER32_INIT_VALUE = 1;

    private static final int MOD_ADLER = 65521;

    // 每累加 NMAX 个字节取一次模
    private static final int NMAX = 5552;

    private Adler32Checksum() {
    }

    public static int checksum(byte[] data) {
        return checksum(ADLER32_INIT_VALUE, data, 0, data.length);
    }

    public static int checksum(int seed, byte[] data) {
        return checksum(seed, data, 0, data.length);
    }

    /**
     * 以 seed 为起点继续计算 data[offset, offset + length) 的 Adler-32。
     */
    public static int checksum(int seed, byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IndexOutOfBoundsException(
                "offset=" + offset + ", length=" + length + ", size=" + data.length);
        }
        long s1 = seed & 0xffff;
        long s2 = (seed >>> 16) & 0xffff;
        int pos = offset;
        int remaining = length;
        while (remaining > 0) {
            int n = Math.min(remaining, NMAX);
            remaining -= n;
            while (n-- > 0) {
                s1 += data[pos++] & 0xff;
                s2 += s1;
            }
            s1 %= MOD_ADLER;
            s2 %= MOD_ADLER;
        }
        return (int) ((s2 << 16) | s1);
    }
}
