package org.safestore.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * 原子写入与临时文件相关的工具方法。
 * <p>
 * 临时文件统一以 {@link #TEMP_PREFIX} 开头、{@link #TEMP_SUFFIX} 结尾，
 * 既是隐藏文件（不会出现在列表/搜索结果中），也便于崩溃后识别并清理。
 */
final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    static final String TEMP_PREFIX = ".fs-write-";
    static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    /**
     * 原子写入：
     * <ol>
     *   <li>先写到同目录的临时文件（保证与目标文件在同一文件系统内）。</li>
     *   <li>目标已存在时，把它的 POSIX 权限位复制到临时文件，替换后权限保持不变。</li>
     *   <li>再通过 move 原子替换到目标路径（ATOMIC_MOVE 不支持时降级为普通 move）。</li>
     * </ol>
     * 无论成功失败，临时文件都会在返回前被删除。
     */
    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path parent = target.getParent();
        if (parent == null) {
            throw new IOException("目标路径无效：" + target);
        }
        Path tmp = Files.createTempFile(parent, TEMP_PREFIX, TEMP_SUFFIX);
        try {
            Files.write(tmp, bytes);
            copyPosixPermissions(target, tmp);
            moveReplacing(tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("删除临时文件失败：{}", tmp, e);
            }
        }
    }

    /**
     * 替换式移动；优先使用原子移动。
     */
    static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyPosixPermissions(Path from, Path to) throws IOException {
        if (!Files.isRegularFile(from, LinkOption.NOFOLLOW_LINKS)
                || !from.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from, LinkOption.NOFOLLOW_LINKS));
    }

    static boolean isTempFile(String name) {
        return name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX);
    }

    /**
     * 删除目录下（非递归）早于 {@code cutoff} 的遗留临时文件。
     *
     * @return 删除的文件数
     */
    static int sweepStaleTempFiles(Path directory, Instant cutoff) {
        if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, TEMP_PREFIX + "*" + TEMP_SUFFIX)) {
            for (Path candidate : stream) {
                try {
                    if (Files.getLastModifiedTime(candidate, LinkOption.NOFOLLOW_LINKS).toInstant().isBefore(cutoff)
                            && Files.deleteIfExists(candidate)) {
                        removed++;
                        log.info("已清理遗留临时文件：{}", candidate);
                    }
                } catch (IOException e) {
                    log.warn("清理临时文件失败：{}", candidate, e);
                }
            }
        } catch (IOException e) {
            log.warn("扫描临时文件失败：{}", directory, e);
        }
        return removed;
    }
}
