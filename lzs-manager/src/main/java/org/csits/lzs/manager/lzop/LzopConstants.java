package org.csits.lzs.manager.lzop;

/**
 * lzop 容器格式常量。所有多字节整数均为大端序。
 */
public final class LzopConstants {

    /**
     * lzop 文件魔数。
     */
    public static final byte[] MAGIC = {
        (byte) 0x89, 0x4c, 0x5a, 0x4f, 0x00, 0x0d, 0x0a, 0x1a, 0x0a
    };

    public static final int LZOP_VERSION = 0x1010;

    /**
     * 写入头部的 LZO 库版本（2.10）。
     */
    public static final int LZO_LIB_VERSION = 0x20a0;

    /**
     * 解压所需最低版本，此版本不含 CRC-32 与 filter 支持。
     */
    public static final int VERSION_NEEDED_TO_EXTRACT = 0x0940;

    /**
     * LZO1X 系列方法号。
     */
    public static final int METHOD_LZO1X = 1;

    public static final int F_ADLER32_D = 0x00000001;

    public static final int F_ADLER32_C = 0x00000002;

    public static final int FLAGS = F_ADLER32_D | F_ADLER32_C;

    public static final int MAX_NAME_LENGTH = 255;

    /**
     * lzop 默认块大小 256KB。
     */
    public static final int DEFAULT_BLOCK_SIZE = 256 * 1024;

    public static final String DEFAULT_SUFFIX = ".lzo";

    /**
     * 块帧中每个长度/校验字段的字节数。
     */
    public static final int FIELD_SIZE = 4;

    private LzopConstants() {
    }
}
