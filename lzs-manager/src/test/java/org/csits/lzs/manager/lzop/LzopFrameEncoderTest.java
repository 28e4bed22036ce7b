package org.csits.lzs.manager.lzop;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LzopFrameEncoderTest {

    @Test
    void writeFrame_rawHasNoChecksums() {
        byte[] data = "xxhelloxx".getBytes(StandardCharsets.US_ASCII);
        LzopBlock block = LzopBlock.raw(data, 2, 5);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        LzopFrameEncoder.writeFrame(block, out);

        ByteBuffer frame = ByteBuffer.wrap(out.toByteArray());
        assertThat(frame.remaining()).isEqualTo(LzopFrameEncoder.frameLength(block)).isEqualTo(13);
        assertThat(frame.getInt()).isEqualTo(5);
        assertThat(frame.getInt()).isEqualTo(5);
        byte[] payload = new byte[5];
        frame.get(payload);
        assertThat(new String(payload, StandardCharsets.US_ASCII)).isEqualTo("hello");
    }

    @Test
    void writeFrame_compressedCarriesBothChecksums() {
        byte[] payload = {1, 2, 3};
        LzopBlock block = LzopBlock.compressed(10, 0x01020304, 0xcafebabe, payload, 3);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        LzopFrameEncoder.writeFrame(block, out);

        ByteBuffer frame = ByteBuffer.wrap(out.toByteArray());
        assertThat(frame.remaining()).isEqualTo(LzopFrameEncoder.frameLength(block)).isEqualTo(19);
        assertThat(frame.getInt()).isEqualTo(10);
        assertThat(frame.getInt()).isEqualTo(3);
        assertThat(frame.getInt()).isEqualTo(0x01020304);
        assertThat(frame.getInt()).isEqualTo(0xcafebabe);
        assertThat(frame.get()).isEqualTo((byte) 1);
    }

    @Test
    void terminator_isFourZeroBytes() {
        assertThat(LzopFrameEncoder.terminator()).containsExactly(0, 0, 0, 0);
    }
}
