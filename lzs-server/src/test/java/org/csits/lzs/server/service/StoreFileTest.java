package org.csits.lzs.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.csits.lzs.manager.lzop.CompressionSettings;
import org.csits.lzs.manager.lzop.LzopConstants;
import org.csits.lzs.manager.lzop.LzopStreamReader;
import org.csits.lzs.manager.store.InMemoryStoreFileSystem;
import org.csits.lzs.manager.store.OpenFailedException;
import org.csits.lzs.manager.store.OpenMode;
import org.csits.lzs.manager.store.ShortWriteException;
import org.csits.lzs.manager.store.StoreFileSystem;
import org.csits.lzs.manager.store.StoreHandle;
import org.csits.lzs.manager.store.StoreUnavailableException;
import org.csits.lzs.server.dto.SessionStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StoreFileTest {

    private static final String TARGET = "hdfs://namenode:9000/scribe/app/app_00000.lzo";

    private InMemoryStoreFileSystem store;
    private CompressionMetrics metrics;

    @Mock
    private StoreFileSystem mockStore;
    @Mock
    private StoreHandle mockHandle;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreFileSystem();
        metrics = new CompressionMetrics();
    }

    private StoreFile newFile(int level, int blockSize) {
        return new StoreFile(TARGET, store, new CompressionSettings(level, blockSize, ".lzo"), metrics);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void openWrite_newTarget_writesHeaderAndFramesOnClose() throws IOException {
        StoreFile file = newFile(1, 4);

        assertThat(file.openWrite()).isTrue();
        assertThat(file.write(ascii("ab"))).isEqualTo(WriteResult.BUFFERED);
        assertThat(file.write(ascii("cd"))).isEqualTo(WriteResult.FRAMED);
        assertThat(file.write(ascii("ef"))).isEqualTo(WriteResult.BUFFERED);
        file.close();

        LzopStreamReader.Stream stream = LzopStreamReader.parse(store.getContent(TARGET));
        assertThat(stream.header.name).isEqualTo("app_00000");
        assertThat(stream.header.checksum).isEqualTo(stream.header.expectedChecksum);
        assertThat(stream.frames).extracting(f -> f.rawLength).containsExactly(4, 2);
        assertThat(stream.content).isEqualTo(ascii("abcdef"));
        assertThat(stream.terminated).isTrue();
        assertThat(stream.trailingBytes).isZero();
        assertThat(file.isOpen()).isFalse();
    }

    @Test
    void openWrite_twice_returnsFalse() throws IOException {
        StoreFile file = newFile(1, 1024);

        assertThat(file.openWrite()).isTrue();
        assertThat(file.openWrite()).isFalse();
    }

    @Test
    void openWrite_existingTarget_appendsUncompressed() throws IOException {
        StoreFile first = newFile(1, 1024);
        first.write(ascii("first session "));
        first.close();
        byte[] before = store.getContent(TARGET);

        StoreFile second = newFile(1, 1024);
        assertThat(second.openWrite()).isTrue();
        assertThat(second.getSession().isCompressionEnabled()).isFalse();
        assertThat(second.write(ascii("appended"))).isEqualTo(WriteResult.PASSTHROUGH);
        second.close();

        byte[] after = store.getContent(TARGET);
        assertThat(after).startsWith(before);
        assertThat(after).hasSize(before.length + 8);
        assertThat(new String(after, before.length, 8, StandardCharsets.US_ASCII)).isEqualTo("appended");
    }

    @Test
    void write_notOpen_opensLazily() throws IOException {
        StoreFile file = newFile(1, 1024);

        file.write(ascii("lazy"));

        assertThat(file.isOpen()).isTrue();
        assertThat(store.getContent(TARGET)).startsWith(LzopConstants.MAGIC);
    }

    @Test
    void levelZero_writesPlainBytes() throws IOException {
        StoreFile file = newFile(0, 1024);

        assertThat(file.write(ascii("plain"))).isEqualTo(WriteResult.PASSTHROUGH);
        file.close();

        assertThat(store.getContent(TARGET)).isEqualTo(ascii("plain"));
    }

    @Test
    void close_notOpen_isNoop() throws IOException {
        StoreFile file = newFile(1, 1024);

        file.close();

        assertThat(store.getContent(TARGET)).isNull();
    }

    @Test
    void openTruncate_replacesExistingContent() throws IOException {
        StoreFile first = newFile(0, 1024);
        first.write(ascii("old content"));
        first.close();

        StoreFile second = newFile(1, 1024);
        assertThat(second.openTruncate()).isTrue();
        second.write(ascii("new"));
        second.close();

        LzopStreamReader.Stream stream = LzopStreamReader.parse(store.getContent(TARGET));
        assertThat(stream.content).isEqualTo(ascii("new"));
    }

    @Test
    void openRead_missingTarget_returnsFalse() throws IOException {
        StoreFile file = newFile(1, 1024);

        assertThat(file.openRead()).isFalse();

        file.write(ascii("x"));
        file.close();
        StoreFile reader = newFile(1, 1024);
        assertThat(reader.openRead()).isTrue();
        assertThatThrownBy(() -> reader.write(ascii("y"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reopenForRead_afterWriteSession_recordsSessionOnce() throws IOException {
        StoreFile file = newFile(1, 4);
        assertThat(file.openWrite()).isTrue();
        file.write(ascii("abcdef"));
        file.close();

        assertThat(file.openRead()).isTrue();
        assertThat(file.getSession()).isNull();
        assertThatThrownBy(() -> file.write(ascii("x")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("只读");
        file.close();

        assertThat(metrics.getSessions(TARGET)).hasSize(1);
        assertThat(metrics.getSessions(TARGET).get(0).getBytesIn()).isEqualTo(6);
    }

    @Test
    void fileSizeListAndDelete() throws IOException {
        StoreFile file = newFile(0, 1024);
        assertThat(file.fileSize()).isZero();
        file.write(ascii("12345"));
        file.flush();

        assertThat(file.fileSize()).isEqualTo(5);
        assertThat(file.list("/scribe/app")).containsExactly("app_00000.lzo");
        assertThat(file.list("/scribe/missing")).isEmpty();

        file.close();
        file.deleteFile();
        assertThat(file.fileSize()).isZero();
    }

    @Test
    void setCompressionLevel_appliesToNextOpen() throws IOException {
        StoreFile file = newFile(0, 1024);
        file.setCompressionLevel(9);

        file.write(ascii("maximal"));
        assertThatThrownBy(() -> file.setCompressionLevel(1)).isInstanceOf(IllegalStateException.class);
        file.close();

        LzopStreamReader.Stream stream = LzopStreamReader.parse(store.getContent(TARGET));
        assertThat(stream.header.level).isEqualTo(9);
        assertThat(stream.content).isEqualTo(ascii("maximal"));
    }

    @Test
    void close_recordsSessionStatistics() throws IOException {
        StoreFile file = newFile(1, 64 * 1024);
        byte[] data = new byte[200_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) ("scribe category message ".charAt(i % 24));
        }
        file.write(data);
        file.close();

        assertThat(metrics.getSessions(TARGET)).hasSize(1);
        SessionStatistics stats = metrics.getSessions(TARGET).get(0);
        assertThat(stats.getBytesIn()).isEqualTo(200_000);
        assertThat(stats.getBytesOut()).isEqualTo(store.getContent(TARGET).length);
        assertThat(stats.getCompressedFrames()).isEqualTo(4);
        assertThat(stats.getCompressionRatio()).isLessThan(0.5);
        assertThat(LzopStreamReader.parse(store.getContent(TARGET)).content).isEqualTo(data);
    }

    @Test
    void manyRandomWrites_noDataLoss() throws IOException {
        Random random = new Random(42);
        StoreFile file = newFile(9, 16 * 1024);
        java.io.ByteArrayOutputStream expected = new java.io.ByteArrayOutputStream();
        for (int i = 0; i < 200; i++) {
            byte[] chunk = new byte[random.nextInt(3000)];
            for (int j = 0; j < chunk.length; j++) {
                chunk[j] = (byte) ('a' + random.nextInt(3));
            }
            file.write(chunk);
            expected.write(chunk, 0, chunk.length);
        }
        file.close();

        LzopStreamReader.Stream stream = LzopStreamReader.parse(store.getContent(TARGET));
        assertThat(stream.content).isEqualTo(expected.toByteArray());
        assertThat(stream.terminated).isTrue();
    }

    @Test
    void storeUnavailable_propagates() {
        store.setAvailable(false);
        StoreFile file = newFile(1, 1024);

        assertThatThrownBy(file::openWrite).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void noStoreConfigured_failsOpenButSizeAndListAreEmpty() throws IOException {
        StoreFile file = new StoreFile(TARGET, null, CompressionSettings.of(1), null);

        assertThatThrownBy(file::openWrite).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> file.write(ascii("x"))).isInstanceOf(StoreUnavailableException.class);
        assertThat(file.fileSize()).isZero();
        assertThat(file.list("/scribe")).isEmpty();
    }

    @Test
    void shortWrite_throwsAndStreamIsNotRetried() throws IOException {
        when(mockStore.exists(TARGET)).thenReturn(false);
        when(mockStore.open(TARGET, OpenMode.WRITE)).thenReturn(mockHandle);
        when(mockHandle.isOpen()).thenReturn(true);
        when(mockStore.write(eq(mockHandle), any(byte[].class), eq(0), anyInt())).thenReturn(0);
        StoreFile file = new StoreFile(TARGET, mockStore, CompressionSettings.disabled(), null);
        assertThat(file.openWrite()).isTrue();

        assertThatThrownBy(() -> file.write(ascii("abc")))
            .isInstanceOfSatisfying(ShortWriteException.class, e -> {
                assertThat(e.getRequested()).isEqualTo(3);
                assertThat(e.getWritten()).isZero();
            });
    }

    @Test
    void openRefused_returnsFalseAndKeepsNoState() throws IOException {
        when(mockStore.exists(TARGET)).thenReturn(false);
        when(mockStore.open(TARGET, OpenMode.WRITE)).thenThrow(new OpenFailedException("refused"));
        StoreFile file = new StoreFile(TARGET, mockStore, CompressionSettings.of(1), null);

        assertThat(file.openWrite()).isFalse();
        assertThat(file.isOpen()).isFalse();
        assertThat(file.getSession()).isNull();
        file.close();
        verify(mockStore, never()).close(any());
    }
}
