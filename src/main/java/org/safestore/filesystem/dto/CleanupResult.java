package org.safestore.filesystem.dto;

import java.time.Instant;

/**
 * 清理操作（归档区/版本区/临时文件）的结果。
 *
 * @param area         被清理的区域（archive / versions / temp）
 * @param cutoff       早于该时间的条目被删除
 * @param removedFiles 删除的文件数
 * @param freedBytes   释放的字节数（临时文件清理不统计，为 0）
 */
public record CleanupResult(
        String area,
        Instant cutoff,
        int removedFiles,
        long freedBytes
) {
}
