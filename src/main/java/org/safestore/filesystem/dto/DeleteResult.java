package org.safestore.filesystem.dto;

/**
 * {@code deleteFile} 的返回结果。
 *
 * @param path        被删除文件的相对路径
 * @param archived    是否为软删除（移入归档区）
 * @param archivePath 归档后的相对路径（永久删除时为 null）
 */
public record DeleteResult(
        String path,
        boolean archived,
        String archivePath
) {
}
