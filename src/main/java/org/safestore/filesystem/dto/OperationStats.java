package org.safestore.filesystem.dto;

/**
 * 单个操作类型的统计。
 *
 * @param count              调用次数
 * @param totalTimeSeconds   累计耗时（秒）
 * @param errors             失败次数
 * @param averageTimeSeconds 平均耗时（秒）
 * @param errorRate          失败率（0~1）
 */
public record OperationStats(
        long count,
        double totalTimeSeconds,
        long errors,
        double averageTimeSeconds,
        double errorRate
) {
}
