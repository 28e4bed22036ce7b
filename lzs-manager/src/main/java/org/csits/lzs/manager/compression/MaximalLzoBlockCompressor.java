package org.csits.lzs.manager.compression;

import java.util.Arrays;

/**
 * 最大压缩比变体：哈希链深度搜索加一步惰性匹配的 LZO1X 编码器。
 *
 * 只输出 M2/M3/M4 三类匹配指令，不使用依赖前一条指令状态的 M1 短匹配，
 * 因此输出可由标准 LZO1X 解码器（lzop、aircompressor）直接解码。
 * 工作内存（哈希头表与链表）在每次 {@link #compress} 调用内分配。
 */
public class MaximalLzoBlockCompressor implements BlockCompressor {

    private static final int MIN_MATCH = 3;

    private static final int M2_MAX_LEN = 8;
    private static final int M3_MAX_LEN = 33;
    private static final int M4_MAX_LEN = 9;

    private static final int M2_MAX_OFFSET = 0x0800;
    private static final int M3_MAX_OFFSET = 0x4000;
    private static final int M4_MAX_OFFSET = 0xbfff;

    private static final int M3_MARKER = 32;
    private static final int M4_MARKER = 16;

    /**
     * 流首条指令可直接编码的最长字面量（17 + 238 = 255）。
     */
    private static final int FIRST_LITERAL_MAX = 238;

    private static final int HASH_BITS = 15;
    private static final int HASH_SIZE = 1 << HASH_BITS;
    private static final int MAX_CHAIN = 512;
    private static final int NICE_LENGTH = 2048;

    @Override
    public int compress(byte[] input, int inputOffset, int inputLength,
                        byte[] output, int outputOffset, int maxOutputLength) throws CompressionFailureException {
        if (inputOffset < 0 || inputLength < 0 || inputOffset + inputLength > input.length) {
            throw new CompressionFailureException(
                "输入范围越界: offset=" + inputOffset + ", length=" + inputLength + ", size=" + input.length);
        }
        if (inputLength == 0) {
            throw new CompressionFailureException("输入为空，不能编码为 LZO1X 块");
        }
        if (outputOffset < 0 || outputOffset > output.length) {
            throw new CompressionFailureException("输出偏移越界: offset=" + outputOffset + ", size=" + output.length);
        }
        int outputLimit = (int) Math.min(output.length, (long) outputOffset + maxOutputLength);
        return new Encoder(input, inputOffset, inputLength, output, outputOffset, outputLimit).encode();
    }

    @Override
    public int maxCompressedLength(int uncompressedLength) {
        return BlockCompressor.worstCaseBound(uncompressedLength);
    }

    private static final class Encoder {

        private final byte[] in;
        private final int base;
        private final int length;
        private final byte[] out;
        private final int outStart;
        private final int outLimit;

        private final int[] head = new int[HASH_SIZE];
        private final int[] prev;

        private int op;
        private int matchLength;
        private int matchDistance;

        Encoder(byte[] in, int base, int length, byte[] out, int outStart, int outLimit) {
            this.in = in;
            this.base = base;
            this.length = length;
            this.out = out;
            this.outStart = outStart;
            this.outLimit = outLimit;
            this.prev = new int[Math.max(length, 1)];
            this.op = outStart;
            Arrays.fill(head, -1);
        }

        int encode() throws CompressionFailureException {
            int ip = 0;
            int anchor = 0;
            while (ip + MIN_MATCH <= length) {
                findMatch(ip);
                int len = matchLength;
                int dist = matchDistance;
                insert(ip);
                if (!acceptable(len, dist)) {
                    ip++;
                    continue;
                }
                if (len < NICE_LENGTH && ip + 1 + MIN_MATCH <= length) {
                    findMatch(ip + 1);
                    if (acceptable(matchLength, matchDistance)
                        && gain(matchLength, matchDistance) > gain(len, dist) + 1) {
                        // 下一位置的匹配更划算，当前字节作为字面量
                        ip++;
                        continue;
                    }
                }
                emitLiterals(anchor, ip);
                emitMatch(len, dist);
                int end = ip + len;
                for (int k = ip + 1; k < end && k + MIN_MATCH <= length; k++) {
                    insert(k);
                }
                ip = end;
                anchor = end;
            }
            emitLiterals(anchor, length);

            // 结束标记：距离为 0x4000 的 M4 指令
            ensureCapacity(3);
            out[op++] = (byte) (M4_MARKER | 1);
            out[op++] = 0;
            out[op++] = 0;
            return op - outStart;
        }

        private void findMatch(int pos) {
            matchLength = 0;
            matchDistance = 0;
            int maxLength = length - pos;
            int p = base + pos;
            int candidate = head[hash(pos)];
            int chain = MAX_CHAIN;
            while (candidate >= 0 && chain-- > 0) {
                int distance = pos - candidate;
                if (distance > M4_MAX_OFFSET) {
                    break;
                }
                int c = base + candidate;
                if (in[c + matchLength] == in[p + matchLength] && in[c] == in[p]) {
                    int l = 0;
                    while (l < maxLength && in[c + l] == in[p + l]) {
                        l++;
                    }
                    if (l > matchLength) {
                        matchLength = l;
                        matchDistance = distance;
                        if (l >= maxLength || l >= NICE_LENGTH) {
                            break;
                        }
                    }
                }
                candidate = prev[candidate];
            }
        }

        private void insert(int pos) {
            int h = hash(pos);
            prev[pos] = head[h];
            head[h] = pos;
        }

        private int hash(int pos) {
            int p = base + pos;
            int v = ((in[p] & 0xff) << 16) | ((in[p + 1] & 0xff) << 8) | (in[p + 2] & 0xff);
            return (v * 0x9E3779B1) >>> (32 - HASH_BITS);
        }

        private void emitLiterals(int from, int to) throws CompressionFailureException {
            int t = to - from;
            if (t == 0) {
                return;
            }
            ensureCapacity(t + t / 255 + 3);
            if (op == outStart) {
                if (t <= FIRST_LITERAL_MAX) {
                    out[op++] = (byte) (17 + t);
                } else {
                    writeLongLiteralRun(t);
                }
            } else if (t <= 3) {
                // 1~3 个字面量写入上一条匹配指令倒数第二字节的低 2 位
                out[op - 2] |= (byte) t;
            } else if (t <= 18) {
                out[op++] = (byte) (t - 3);
            } else {
                writeLongLiteralRun(t);
            }
            System.arraycopy(in, base + from, out, op, t);
            op += t;
        }

        private void writeLongLiteralRun(int t) {
            out[op++] = 0;
            writeRunLength(t - 18);
        }

        private void emitMatch(int len, int dist) throws CompressionFailureException {
            ensureCapacity(len / 255 + 5);
            if (len <= M2_MAX_LEN && dist <= M2_MAX_OFFSET) {
                int d = dist - 1;
                out[op++] = (byte) (((len - 1) << 5) | ((d & 7) << 2));
                out[op++] = (byte) (d >>> 3);
            } else if (dist <= M3_MAX_OFFSET) {
                int d = dist - 1;
                if (len <= M3_MAX_LEN) {
                    out[op++] = (byte) (M3_MARKER | (len - 2));
                } else {
                    out[op++] = (byte) M3_MARKER;
                    writeRunLength(len - M3_MAX_LEN);
                }
                out[op++] = (byte) ((d & 63) << 2);
                out[op++] = (byte) (d >>> 6);
            } else {
                int d = dist - 0x4000;
                int marker = M4_MARKER | ((d & 0x4000) >>> 11);
                if (len <= M4_MAX_LEN) {
                    out[op++] = (byte) (marker | (len - 2));
                } else {
                    out[op++] = (byte) marker;
                    writeRunLength(len - M4_MAX_LEN);
                }
                out[op++] = (byte) ((d & 63) << 2);
                out[op++] = (byte) ((d >>> 6) & 0xff);
            }
        }

        private void writeRunLength(int n) {
            while (n > 255) {
                n -= 255;
                out[op++] = 0;
            }
            out[op++] = (byte) n;
        }

        private void ensureCapacity(int n) throws CompressionFailureException {
            if (op + n > outLimit) {
                throw new CompressionFailureException(
                    "LZO1X 输出缓冲不足: required=" + (op + n - outStart) + ", limit=" + (outLimit - outStart));
            }
        }
    }

    /**
     * 3 字节匹配只有在 M2 距离内才比字面量短。
     */
    private static boolean acceptable(int len, int dist) {
        return len > MIN_MATCH || (len == MIN_MATCH && dist <= M2_MAX_OFFSET);
    }

    private static int gain(int len, int dist) {
        if (len <= M2_MAX_LEN && dist <= M2_MAX_OFFSET) {
            return len - 2;
        }
        int extra;
        if (dist <= M3_MAX_OFFSET) {
            extra = len > M3_MAX_LEN ? runLengthBytes(len - M3_MAX_LEN) : 0;
        } else {
            extra = len > M4_MAX_LEN ? runLengthBytes(len - M4_MAX_LEN) : 0;
        }
        return len - 3 - extra;
    }

    private static int runLengthBytes(int n) {
        return (n - 1) / 255 + 1;
    }
}
