package org.csits.lzs.server.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.csits.lzs.server.dto.SessionStatistics;
import org.springframework.stereotype.Service;

/**
 * 指标收集服务
 * 按目标文件在内存中保存已关闭会话的统计
 */
@Slf4j
@Service
public class CompressionMetrics {

    private final Map<String, List<SessionStatistics>> sessionsByTarget = new ConcurrentHashMap<>();

    /**
     * 记录会话统计
     */
    public void recordSession(SessionStatistics stats) {
        stats.calculateCompressionRatio();
        sessionsByTarget.computeIfAbsent(stats.getTarget(), k -> Collections.synchronizedList(new ArrayList<>()))
            .add(stats);
        log.info("记录会话统计: target={}, level={}, in={}bytes, out={}bytes, ratio={}, frames={}/{}, fallback={}",
            stats.getTarget(), stats.getLevel(), stats.getBytesIn(), stats.getBytesOut(),
            stats.getCompressionRatio(), stats.getCompressedFrames(), stats.getRawFrames(),
            stats.getFallbackCount());
    }

    /**
     * 获取目标文件的全部会话统计
     */
    public List<SessionStatistics> getSessions(String target) {
        List<SessionStatistics> sessions = sessionsByTarget.get(target);
        if (sessions == null) {
            return Collections.emptyList();
        }
        synchronized (sessions) {
            return new ArrayList<>(sessions);
        }
    }

    /**
     * 所有目标累计的输入字节数
     */
    public long totalBytesIn() {
        return sessionsByTarget.values().stream()
            .flatMap(list -> new ArrayList<>(list).stream())
            .mapToLong(SessionStatistics::getBytesIn)
            .sum();
    }

    /**
     * 所有目标累计的输出字节数
     */
    public long totalBytesOut() {
        return sessionsByTarget.values().stream()
            .flatMap(list -> new ArrayList<>(list).stream())
            .mapToLong(SessionStatistics::getBytesOut)
            .sum();
    }

    /**
     * 清理目标文件的统计缓存
     */
    public void clear(String target) {
        sessionsByTarget.remove(target);
        log.debug("清理会话统计缓存: target={}", target);
    }
}
