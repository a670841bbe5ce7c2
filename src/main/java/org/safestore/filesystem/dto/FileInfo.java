package org.safestore.filesystem.dto;

import java.time.Instant;

/**
 * {@code getFileInfo} 的返回结果。
 *
 * @param metadata       完整元信息
 * @param humanSize      可读的大小（例如 1.5 KB）
 * @param cached         内容当前是否在缓存中
 * @param accessCount    累计读取次数
 * @param lastAccessedAt 最近一次读取时间（从未读取为 null）
 */
public record FileInfo(
        FileMetadata metadata,
        String humanSize,
        boolean cached,
        long accessCount,
        Instant lastAccessedAt
) {
}
