package org.safestore.filesystem.dto;

import java.time.Instant;

/**
 * 某个文件的一份历史版本。
 *
 * @param name      版本文件名（{@code <扁平化路径>@<时间戳>}）
 * @param path      版本文件相对 BaseDirectory 的路径（统一使用 / 分隔）
 * @param sizeBytes 版本内容大小
 * @param createdAt 快照时间
 */
public record FileVersion(
        String name,
        String path,
        long sizeBytes,
        Instant createdAt
) {
}
