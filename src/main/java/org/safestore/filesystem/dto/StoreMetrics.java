package org.safestore.filesystem.dto;

import java.util.Map;

/**
 * {@code metricsSnapshot} 的返回结果。
 *
 * @param operations       操作类型 -> 统计
 * @param cacheSize        当前缓存条目数
 * @param cacheCapacity    缓存容量
 * @param cacheHits        缓存命中次数
 * @param cacheMisses      缓存未命中次数
 * @param cacheHitRate     命中率估计（0~1）
 * @param checksumEntries  checksum 表条目数
 * @param securityEvents   已记录的安全事件数
 * @param indexEntries     文件索引条目数
 */
public record StoreMetrics(
        Map<String, OperationStats> operations,
        int cacheSize,
        int cacheCapacity,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        int checksumEntries,
        long securityEvents,
        int indexEntries
) {
}
