package org.safestore.filesystem;

import org.safestore.filesystem.dto.CleanupResult;
import org.safestore.filesystem.dto.FileVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 版本快照：覆盖写入前把文件的旧内容复制到 {@code versions/} 目录。
 * <p>
 * 版本区镜像 BaseDirectory 的目录结构：{@code notes/a.txt} 的快照为 {@code versions/notes/a.txt@<时间戳>}。
 * <p>
 * 快照是“尽力而为”的便利功能而不是持久性保证：快照失败只记日志，不会中止随后的写入。
 * 版本文件不会被自动删除，只有显式调用 {@link #cleanup(Duration)} 时按年龄清理。
 */
public class VersionArchive {

    private static final Logger log = LoggerFactory.getLogger(VersionArchive.class);

    private final Path baseDir;
    private final Path versionsDir;
    private final boolean enabled;
    private final Clock clock;

    public VersionArchive(Path baseDir, Path versionsDir, boolean enabled, Clock clock) {
        this.baseDir = baseDir;
        this.versionsDir = versionsDir;
        this.enabled = enabled;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 为 {@code absolutePath} 的当前内容创建快照。
     *
     * @return 新建的版本文件；未启用、文件不存在或快照失败时返回 {@code null}
     */
    public Path snapshot(Path absolutePath) {
        if (!enabled || !Files.isRegularFile(absolutePath, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        try {
            Path target = StorageNames.uniqueStampedTarget(versionsDir, relative(absolutePath), clock);
            Files.copy(absolutePath, target, StandardCopyOption.COPY_ATTRIBUTES);
            log.debug("已创建版本快照：{} -> {}", absolutePath, target);
            return target;
        } catch (IOException e) {
            log.warn("创建版本快照失败（不影响本次写入）：{}", absolutePath, e);
            return null;
        }
    }

    /**
     * 列出某个文件的全部版本，最新的在前。
     */
    public List<FileVersion> listVersions(Path absolutePath) throws IOException {
        Path relative = relative(absolutePath);
        Path directory = StorageNames.entryDirectory(versionsDir, relative);
        if (relative.getFileName() == null || !Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            return List.of();
        }
        String fileName = relative.getFileName().toString();
        List<FileVersion> versions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)
                        || !fileName.equals(StorageNames.originalName(name))) {
                    continue;
                }
                versions.add(new FileVersion(
                        name,
                        baseDir.relativize(entry).toString().replace('\\', '/'),
                        Files.size(entry),
                        StorageNames.createdAt(entry)
                ));
            }
        }
        versions.sort(Comparator.comparing(FileVersion::createdAt)
                .thenComparing(FileVersion::name)
                .reversed());
        return versions;
    }

    /**
     * 删除早于 {@code maxAge} 的版本。
     */
    public CleanupResult cleanup(Duration maxAge) throws IOException {
        Instant cutoff = Instant.now(clock).minus(maxAge);
        StorageNames.CleanupStats stats = StorageNames.sweepOlderThan(versionsDir, cutoff);
        if (stats.removedFiles() > 0) {
            log.info("已清理 {} 个过期版本（早于 {}）", stats.removedFiles(), cutoff);
        }
        return new CleanupResult("versions", cutoff, stats.removedFiles(), stats.freedBytes());
    }

    private Path relative(Path absolutePath) {
        return baseDir.relativize(absolutePath.toAbsolutePath().normalize());
    }
}
