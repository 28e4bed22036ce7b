package org.csits.lzs.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.server.dto.StoreConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将配置文件映射为 Java 对象。
 */
@Slf4j
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public StoreConfig loadStoreConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            StoreConfig config = yamlMapper.readValue(in, StoreConfig.class);
            log.info("加载配置: {}", resource.getDescription());
            return config;
        }
    }

    public StoreConfig loadStoreConfigFromString(String yaml) throws IOException {
        return yamlMapper.readValue(new StringReader(yaml), StoreConfig.class);
    }
}
