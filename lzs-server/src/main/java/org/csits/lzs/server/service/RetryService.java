package org.csits.lzs.server.service;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.manager.store.StoreUnavailableException;
import org.csits.lzs.server.dto.StoreConfig;
import org.springframework.stereotype.Service;

/**
 * 重试服务
 * 存储不可用时按配置重试，其余存储错误直接抛出
 */
@Slf4j
@Service
public class RetryService {

    /**
     * 执行带重试的操作
     *
     * @param operation 要执行的存储操作
     * @param retryConfig 重试配置
     * @param operationName 操作名称（用于日志）
     * @param <T> 返回类型
     * @return 操作结果
     * @throws IOException 所有重试失败后抛出最后一次异常
     */
    public <T> T executeWithRetry(StoreOperation<T> operation, StoreConfig.RetryConfig retryConfig,
                                  String operationName) throws IOException {
        int maxRetries = retryConfig != null && retryConfig.getMaxRetries() != null
            ? retryConfig.getMaxRetries() : 0;
        int retryInterval = retryConfig != null && retryConfig.getRetryIntervalSec() != null
            ? retryConfig.getRetryIntervalSec() : 60;

        StoreUnavailableException lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.info("重试 {} (第 {}/{} 次)", operationName, attempt, maxRetries);
                }
                return operation.execute();
            } catch (StoreUnavailableException e) {
                lastException = e;
                log.warn("{} 失败 (第 {}/{} 次): {}", operationName, attempt + 1, maxRetries + 1, e.getMessage());

                if (attempt < maxRetries && retryInterval > 0) {
                    try {
                        log.info("等待 {} 秒后重试...", retryInterval);
                        Thread.sleep(retryInterval * 1000L);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new StoreUnavailableException("重试被中断", ie);
                    }
                }
            }
        }

        log.error("{} 失败，已达到最大重试次数 {}", operationName, maxRetries);
        throw lastException;
    }

    /**
     * 可抛出 IOException 的存储操作
     */
    @FunctionalInterface
    public interface StoreOperation<T> {
        T execute() throws IOException;
    }
}
