package org.safestore.filesystem.dto;

import java.time.Instant;

/**
 * 文件索引中的一条记录。
 *
 * @param path         文件相对 BaseDirectory 的路径
 * @param originalName 上传时的文件名
 * @param category     归类得到的分类目录
 * @param uploadedAt   加入索引的时间
 * @param snippet      内容开头的片段（最多 2000 个字符），用于全文搜索
 */
public record IndexedFile(
        String path,
        String originalName,
        String category,
        Instant uploadedAt,
        String snippet
) {
}
