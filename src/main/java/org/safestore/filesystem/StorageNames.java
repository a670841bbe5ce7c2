package org.safestore.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 版本区/归档区的布局与命名规则。
 * <p>
 * 区域内镜像 BaseDirectory 的目录结构：{@code notes/a.txt} 的条目位于 {@code <区域>/notes/} 下，
 * 文件名为 {@code <原文件名>@<yyyyMMdd'T'HHmmss>[-序号]}。
 * 时间戳精确到秒（UTC）；同一秒内的重复条目追加序号，保证不覆盖已有文件。
 */
final class StorageNames {

    private static final Logger log = LoggerFactory.getLogger(StorageNames.class);

    static final char STAMP_SEPARATOR = '@';
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final Pattern STAMPED_NAME = Pattern.compile("^(.+)@(\\d{8}T\\d{6})(-\\d+)?$");

    private StorageNames() {
    }

    static String stamp(Clock clock) {
        return LocalDateTime.ofInstant(Instant.now(clock), ZoneOffset.UTC).format(STAMP);
    }

    /**
     * 区域内存放 {@code relativePath} 各条目的目录（与原文件的父目录一一对应）。
     */
    static Path entryDirectory(Path areaDir, Path relativePath) {
        Path parent = relativePath.getParent();
        return (parent == null) ? areaDir : areaDir.resolve(parent);
    }

    /**
     * 在区域内为 {@code relativePath} 生成一个带时间戳且尚不存在的目标路径（父目录按需创建）。
     */
    static Path uniqueStampedTarget(Path areaDir, Path relativePath, Clock clock) throws IOException {
        Path directory = entryDirectory(areaDir, relativePath);
        Files.createDirectories(directory);
        String base = relativePath.getFileName().toString() + STAMP_SEPARATOR + stamp(clock);
        Path candidate = directory.resolve(base);
        int sequence = 1;
        while (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            candidate = directory.resolve(base + "-" + sequence++);
        }
        return candidate;
    }

    /**
     * 名称中的原始文件名部分；不符合命名规则时返回 {@code null}。
     */
    static String originalName(String stampedName) {
        Matcher m = STAMPED_NAME.matcher(stampedName);
        return m.matches() ? m.group(1) : null;
    }

    /**
     * 解析名称中的时间戳；不符合命名规则时返回 {@code null}。
     */
    static Instant parseStamp(String stampedName) {
        Matcher m = STAMPED_NAME.matcher(stampedName);
        if (!m.matches()) {
            return null;
        }
        try {
            return LocalDateTime.parse(m.group(2), STAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 条目的创建时间：优先取名称中的时间戳，否则退回文件修改时间。
     */
    static Instant createdAt(Path entry) throws IOException {
        Instant stamped = parseStamp(entry.getFileName().toString());
        return (stamped != null) ? stamped : Files.getLastModifiedTime(entry, LinkOption.NOFOLLOW_LINKS).toInstant();
    }

    /**
     * 递归删除区域内创建时间早于 {@code cutoff} 的普通文件，并移除因此变空的子目录（区域根目录保留）。
     */
    static CleanupStats sweepOlderThan(Path areaDir, Instant cutoff) throws IOException {
        if (!Files.isDirectory(areaDir, LinkOption.NOFOLLOW_LINKS)) {
            return new CleanupStats(0, 0);
        }
        int[] removed = {0};
        long[] freed = {0};
        Files.walkFileTree(areaDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                try {
                    if (createdAt(file).isBefore(cutoff) && Files.deleteIfExists(file)) {
                        removed[0]++;
                        freed[0] += attrs.size();
                    }
                } catch (IOException e) {
                    log.warn("清理过期条目失败：{}", file, e);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("清理时无法访问：{}", file, exc);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (!dir.equals(areaDir)) {
                    deleteIfEmpty(dir);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return new CleanupStats(removed[0], freed[0]);
    }

    private static void deleteIfEmpty(Path dir) {
        try {
            boolean empty;
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                empty = !stream.iterator().hasNext();
            }
            if (empty) {
                Files.delete(dir);
            }
        } catch (IOException e) {
            log.warn("删除空目录失败：{}", dir, e);
        }
    }

    record CleanupStats(int removedFiles, long freedBytes) {
    }
}
