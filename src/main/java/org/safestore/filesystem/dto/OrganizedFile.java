package org.safestore.filesystem.dto;

/**
 * {@code organizeFile} 的返回结果。
 *
 * @param originalName 上传时的文件名
 * @param category     按扩展名归类得到的分类目录
 * @param path         最终写入的相对路径
 * @param sha256       写入内容的 checksum
 * @param indexed      是否已收录到文件索引（索引已满时为 false）
 */
public record OrganizedFile(
        String originalName,
        String category,
        String path,
        String sha256,
        boolean indexed
) {
}
