package org.csits.lzs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.csits.lzs.manager.store.OpenFailedException;
import org.csits.lzs.server.dto.StoreConfig;
import org.csits.lzs.server.service.RetryService;
import org.csits.lzs.server.service.StoreConfigService;
import org.csits.lzs.server.service.StoreFile;
import org.csits.lzs.server.service.StoreFileFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 启动类，将本地文件按分片写入外部存储上的目标文件。
 *
 * 示例：
 *  java -jar lzs-start.jar --source=/data/app.log --target=hdfs://nn:9000/logs/app.log.lzo
 *  可选 --level=0~9 覆盖配置中的压缩级别
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class LzsApplication implements CommandLineRunner {

    private final StoreConfigService storeConfigService;
    private final StoreFileFactory storeFileFactory;
    private final RetryService retryService;

    public static void main(String[] args) {
        SpringApplication.run(LzsApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        String source = null;
        String target = null;
        Integer level = null;
        for (String arg : args) {
            if (arg.startsWith("--source=")) {
                source = arg.substring("--source=".length());
            } else if (arg.startsWith("--target=")) {
                target = arg.substring("--target=".length());
            } else if (arg.startsWith("--level=")) {
                level = Integer.valueOf(arg.substring("--level=".length()));
            }
        }
        if (isBlank(source) || isBlank(target)) {
            log.info("未指定 source/target，不执行写入");
            return;
        }
        transfer(Paths.get(source), target, level);
    }

    /**
     * 读取本地文件并分片写入目标，返回写入的原始字节数。
     */
    long transfer(Path source, String target, Integer level) throws IOException {
        StoreConfig config = storeConfigService.loadStoreConfig();
        StoreFile file = storeFileFactory.create(target, config);
        if (level != null) {
            file.setCompressionLevel(level);
        }
        boolean opened = retryService.executeWithRetry(file::openWrite, config.getRetry(), "打开 " + target);
        if (!opened) {
            throw new OpenFailedException("无法打开目标文件: " + target);
        }
        byte[] chunk = new byte[config.chunkSizeOrDefault()];
        long total = 0;
        try (InputStream in = Files.newInputStream(source)) {
            int n;
            while ((n = IOUtils.read(in, chunk)) > 0) {
                file.write(chunk, 0, n);
                total += n;
            }
            file.flush();
        } finally {
            file.close();
        }
        log.info("写入完成: source={}, target={}, bytes={}, size={}", source, target, total, file.fileSize());
        return total;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
