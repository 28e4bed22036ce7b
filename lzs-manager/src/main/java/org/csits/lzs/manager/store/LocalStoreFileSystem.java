package org.csits.lzs.manager.store;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 以本地目录模拟外部存储。存储路径（可带 hdfs:// 等前缀）映射到根目录下的相对路径。
 *
 * 当配置 lzs.store.provider=local 或未配置时使用此实现。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lzs.store.provider", havingValue = "local", matchIfMissing = true)
public class LocalStoreFileSystem implements StoreFileSystem {

    private final Path root;

    public LocalStoreFileSystem(@Value("${lzs.store.root:store}") String root) {
        this(Paths.get(root));
    }

    public LocalStoreFileSystem(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root) || Files.notExists(root);
    }

    @Override
    public StoreHandle open(String path, OpenMode mode) throws IOException {
        if (!isAvailable()) {
            throw new StoreUnavailableException("存储根目录不可用: " + root);
        }
        Path file = resolve(path);
        try {
            FileChannel channel;
            switch (mode) {
                case READ:
                    channel = FileChannel.open(file, StandardOpenOption.READ);
                    break;
                case APPEND:
                    channel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                    break;
                case WRITE:
                default:
                    // 打开文件时自动创建父目录
                    ensureParent(file);
                    channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING);
                    break;
            }
            return new LocalStoreHandle(path, mode, channel);
        } catch (IOException e) {
            throw new OpenFailedException("打开文件失败: path=" + path + ", mode=" + mode, e);
        }
    }

    @Override
    public int write(StoreHandle handle, byte[] data, int offset, int length) throws IOException {
        FileChannel channel = channelOf(handle);
        return channel.write(ByteBuffer.wrap(data, offset, length));
    }

    @Override
    public void flush(StoreHandle handle) throws IOException {
        channelOf(handle).force(false);
    }

    @Override
    public void close(StoreHandle handle) throws IOException {
        LocalStoreHandle local = (LocalStoreHandle) handle;
        local.channel.close();
    }

    @Override
    public boolean delete(String path) throws IOException {
        return Files.deleteIfExists(resolve(path));
    }

    @Override
    public long stat(String path) throws IOException {
        Path file = resolve(path);
        if (Files.notExists(file)) {
            return -1L;
        }
        return Files.size(file);
    }

    @Override
    public List<String> listDirectory(String path) throws IOException {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public boolean exists(String path) throws IOException {
        return Files.exists(resolve(path));
    }

    public Path getRoot() {
        return root;
    }

    /**
     * 将存储路径映射为根目录下的本地路径，拒绝越出根目录的路径。
     */
    Path resolve(String path) throws IOException {
        String relative = stripScheme(path);
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new OpenFailedException("路径越出存储根目录: " + path);
        }
        return resolved;
    }

    private static String stripScheme(String path) throws IOException {
        if (path == null || path.isEmpty()) {
            throw new OpenFailedException("存储路径不能为空");
        }
        if (!path.contains("://")) {
            return path;
        }
        try {
            String uriPath = new URI(path).getPath();
            return uriPath == null ? "" : uriPath;
        } catch (URISyntaxException e) {
            throw new OpenFailedException("非法的存储路径: " + path, e);
        }
    }

    private static void ensureParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
    }

    private static FileChannel channelOf(StoreHandle handle) throws IOException {
        if (!(handle instanceof LocalStoreHandle) || !handle.isOpen()) {
            throw new StoreException("句柄无效或已关闭: " + (handle == null ? null : handle.getPath()));
        }
        return ((LocalStoreHandle) handle).channel;
    }

    private static final class LocalStoreHandle implements StoreHandle {

        private final String path;
        private final OpenMode mode;
        private final FileChannel channel;

        LocalStoreHandle(String path, OpenMode mode, FileChannel channel) {
            this.path = path;
            this.mode = mode;
            this.channel = channel;
        }

        @Override
        public String getPath() {
            return path;
        }

        @Override
        public OpenMode getMode() {
            return mode;
        }

        @Override
        public boolean isOpen() {
            return channel.isOpen();
        }
    }
}
