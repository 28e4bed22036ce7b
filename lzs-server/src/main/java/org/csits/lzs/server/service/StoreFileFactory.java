package org.csits.lzs.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.manager.lzop.CompressionSettings;
import org.csits.lzs.manager.store.StoreFileSystem;
import org.csits.lzs.server.dto.StoreConfig;
import org.springframework.stereotype.Service;

/**
 * 按配置创建 {@link StoreFile}，共享同一个存储与统计服务。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreFileFactory {

    private final StoreFileSystem fileSystem;
    private final CompressionMetrics metrics;

    public StoreFile create(String name, StoreConfig config) {
        return create(name, config.toCompressionSettings());
    }

    public StoreFile create(String name, CompressionSettings settings) {
        log.debug("创建存储文件: name={}, settings={}", name, settings);
        return new StoreFile(name, fileSystem, settings, metrics);
    }
}
