package org.csits.lzs.server.service;

import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.server.dto.StoreConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载写入配置。配置位置由 lzs.conf.location 指定，支持 classpath: 与 file: 前缀。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;

    @Value("${lzs.conf.location:classpath:conf/lzs.yaml}")
    private String confLocation;

    private volatile StoreConfig cached;

    /**
     * 读取配置，首次加载后缓存。配置文件不存在时使用默认配置。
     */
    public StoreConfig loadStoreConfig() throws IOException {
        StoreConfig config = cached;
        if (config == null) {
            config = load(confLocation);
            cached = config;
        }
        return config;
    }

    public StoreConfig load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("配置文件不存在，使用默认配置: {}", location);
            return new StoreConfig();
        }
        StoreConfig config = yamlConfigLoader.loadStoreConfig(resource);
        return config == null ? new StoreConfig() : config;
    }

    /**
     * 丢弃缓存，下次读取时重新加载。
     */
    public void reload() {
        cached = null;
        log.info("配置缓存已清理: {}", confLocation);
    }
}
