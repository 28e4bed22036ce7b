package org.csits.lzs.manager.store;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 内存实现，主要用于测试和演示。路径以 "/" 分隔，目录由文件路径隐式存在。
 *
 * 当配置 lzs.store.provider=memory 时使用此实现。
 */
@Component
@ConditionalOnProperty(name = "lzs.store.provider", havingValue = "memory")
public class InMemoryStoreFileSystem implements StoreFileSystem {

    private final Map<String, ByteArrayOutputStream> files = new ConcurrentHashMap<>();

    private volatile boolean available = true;

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public StoreHandle open(String path, OpenMode mode) throws IOException {
        checkAvailable();
        String key = normalize(path);
        switch (mode) {
            case READ:
            case APPEND:
                if (!files.containsKey(key)) {
                    throw new OpenFailedException("文件不存在: " + path);
                }
                break;
            case WRITE:
            default:
                files.put(key, new ByteArrayOutputStream());
                break;
        }
        return new MemoryHandle(key, mode);
    }

    @Override
    public int write(StoreHandle handle, byte[] data, int offset, int length) throws IOException {
        checkAvailable();
        MemoryHandle memory = handleOf(handle);
        if (memory.mode == OpenMode.READ) {
            throw new StoreException("只读句柄不可写: " + memory.path);
        }
        ByteArrayOutputStream content = files.get(memory.path);
        if (content == null) {
            throw new StoreException("文件已被删除: " + memory.path);
        }
        synchronized (content) {
            content.write(data, offset, length);
        }
        return length;
    }

    @Override
    public void flush(StoreHandle handle) throws IOException {
        checkAvailable();
        handleOf(handle);
    }

    @Override
    public void close(StoreHandle handle) throws IOException {
        handleOf(handle).open = false;
    }

    @Override
    public boolean delete(String path) throws IOException {
        checkAvailable();
        return files.remove(normalize(path)) != null;
    }

    @Override
    public long stat(String path) throws IOException {
        checkAvailable();
        ByteArrayOutputStream content = files.get(normalize(path));
        return content == null ? -1L : content.size();
    }

    @Override
    public List<String> listDirectory(String path) throws IOException {
        checkAvailable();
        String prefix = normalize(path);
        if (!prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        TreeSet<String> names = new TreeSet<>();
        for (String key : files.keySet()) {
            if (key.startsWith(prefix)) {
                String rest = key.substring(prefix.length());
                int slash = rest.indexOf('/');
                names.add(slash < 0 ? rest : rest.substring(0, slash));
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public boolean exists(String path) throws IOException {
        checkAvailable();
        String key = normalize(path);
        if (files.containsKey(key)) {
            return true;
        }
        String prefix = key.endsWith("/") ? key : key + "/";
        return files.keySet().stream().anyMatch(k -> k.startsWith(prefix));
    }

    /**
     * 文件当前内容的副本，不存在时返回 null。
     */
    public byte[] getContent(String path) {
        ByteArrayOutputStream content = files.get(normalize(path));
        if (content == null) {
            return null;
        }
        synchronized (content) {
            return content.toByteArray();
        }
    }

    private void checkAvailable() throws StoreUnavailableException {
        if (!available) {
            throw new StoreUnavailableException("内存存储不可用");
        }
    }

    private static String normalize(String path) {
        String p = path;
        int scheme = p.indexOf("://");
        if (scheme >= 0) {
            int slash = p.indexOf('/', scheme + 3);
            p = slash < 0 ? "/" : p.substring(slash);
        }
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        return p;
    }

    private static MemoryHandle handleOf(StoreHandle handle) throws StoreException {
        if (!(handle instanceof MemoryHandle) || !handle.isOpen()) {
            throw new StoreException("句柄无效或已关闭: " + (handle == null ? null : handle.getPath()));
        }
        return (MemoryHandle) handle;
    }

    private static final class MemoryHandle implements StoreHandle {

        private final String path;
        private final OpenMode mode;
        private volatile boolean open = true;

        MemoryHandle(String path, OpenMode mode) {
            this.path = path;
            this.mode = mode;
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
            return open;
        }
    }
}
