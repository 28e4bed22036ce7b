package org.csits.lzs.manager.lzop;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.commons.io.FilenameUtils;
import org.csits.lzs.manager.checksum.Adler32Checksum;

/**
 * 生成 lzop 流头部，每个会话仅在新建文件时写一次。
 *
 * <pre>
 * magic[9] | version[2] | libVersion[2] | versionNeeded[2] | method[1] | level[1] | flags[4]
 *   | mode[4] | mtime[4] | gmtdiff[4] | nameLen[1] | name[nameLen] | headerChecksum[4]
 * </pre>
 *
 * 头部校验为以 1 为种子、覆盖魔数之后直到文件名末尾全部字节的 Adler-32。
 */
public final class LzopHeaderWriter {

    private LzopHeaderWriter() {
    }

    public static byte[] writeHeader(String baseFilename, int level) {
        byte[] name = truncateName(baseFilename);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(64 + name.length);
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.write(LzopConstants.MAGIC);
            out.writeShort(LzopConstants.LZOP_VERSION);
            out.writeShort(LzopConstants.LZO_LIB_VERSION);
            out.writeShort(LzopConstants.VERSION_NEEDED_TO_EXTRACT);
            out.writeByte(LzopConstants.METHOD_LZO1X);
            out.writeByte(level);
            out.writeInt(LzopConstants.FLAGS);
            // mode / mtime / gmtdiff：编解码层没有真实文件元数据，全部写 0
            out.writeInt(0);
            out.writeInt(0);
            out.writeInt(0);
            out.writeByte(name.length);
            out.write(name);
            out.flush();
            byte[] fields = buffer.toByteArray();
            int checksum = Adler32Checksum.checksum(Adler32Checksum.ADLER32_INIT_VALUE, fields,
                LzopConstants.MAGIC.length, fields.length - LzopConstants.MAGIC.length);
            out.writeInt(checksum);
        } catch (IOException e) {
            throw new UncheckedIOException("写入 lzop 头部失败", e);
        }
        return buffer.toByteArray();
    }

    /**
     * 取目标路径的文件名部分并去掉压缩后缀，例如 /logs/a/app.log.lzo -> app.log。
     */
    public static String baseName(String target, String suffix) {
        String name = FilenameUtils.getName(target);
        if (suffix != null && !suffix.isEmpty() && name.endsWith(suffix) && name.length() > suffix.length()) {
            name = name.substring(0, name.length() - suffix.length());
        }
        return name;
    }

    private static byte[] truncateName(String baseFilename) {
        byte[] name = (baseFilename == null ? "" : baseFilename).getBytes(StandardCharsets.UTF_8);
        if (name.length > LzopConstants.MAX_NAME_LENGTH) {
            return Arrays.copyOf(name, LzopConstants.MAX_NAME_LENGTH);
        }
        return name;
    }
}
