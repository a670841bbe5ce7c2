package org.safestore.filesystem.dto;

import java.time.Instant;

/**
 * 文件/目录的元信息。
 *
 * @param name        名称（文件名/目录名）
 * @param path        相对 BaseDirectory 的路径（统一使用 / 分隔）
 * @param sizeBytes   大小（目录为 0）
 * @param modifiedAt  最后修改时间
 * @param createdAt   创建时间（平台不支持时等于修改时间）
 * @param directory   是否为目录
 * @param file        是否为普通文件
 * @param mimeType    MIME 类型猜测（目录为 null）
 * @param permissions POSIX 权限位（例如 rw-r--r--；平台不支持时为 null）
 * @param sha256      已知的内容 checksum（没有记录时为 null）
 */
public record FileMetadata(
        String name,
        String path,
        long sizeBytes,
        Instant modifiedAt,
        Instant createdAt,
        boolean directory,
        boolean file,
        String mimeType,
        String permissions,
        String sha256
) {
}
