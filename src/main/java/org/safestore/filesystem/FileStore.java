package org.safestore.filesystem;

import org.safestore.filesystem.dto.CleanupResult;
import org.safestore.filesystem.dto.DeleteResult;
import org.safestore.filesystem.dto.FileInfo;
import org.safestore.filesystem.dto.FileMetadata;
import org.safestore.filesystem.dto.FileVersion;
import org.safestore.filesystem.dto.IndexedFile;
import org.safestore.filesystem.dto.OrganizedFile;
import org.safestore.filesystem.dto.StoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 沙箱文件存储：所有读/写/列表/搜索/删除操作都被限制在 BaseDirectory 之内。
 * <p>
 * 每个公开操作的流程一致：
 * <ol>
 *   <li>{@link PathValidator} 校验路径（失败直接返回 {@link FileErrorKind#ACCESS_DENIED}，不做任何 IO）。</li>
 *   <li>持有实例锁执行 IO，并按需更新 checksum / 版本快照 / 缓存。</li>
 *   <li>无论成功失败都记录性能指标，并返回 {@link FileResult}，异常不会越过操作边界。</li>
 * </ol>
 * <p>
 * 并发：一个可重入锁串行化写入、缓存读写与访问记录；只读取文件系统元信息的列表/搜索在锁外执行
 * （checksum 表本身是并发安全的）。对同一路径，原子替换完成后的任何读取（缓存或磁盘）都能看到该次写入。
 * <p>
 * 目录布局（相对 BaseDirectory）：{@code logs/}、{@code temp/}、{@code archive/}、{@code versions/}、
 * {@code metadata/checksums.json}，以及按需创建的业务子目录。前五个是保留目录，
 * 不能通过任何公开操作读写，也不会出现在列表与搜索结果中。
 */
public class FileStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileStore.class);

    /**
     * 上传文件按扩展名归类（无 AI 分析时的兜底规则）。
     */
    private static final Map<String, String> CATEGORY_BY_EXTENSION = Map.of(
            "py", "code",
            "js", "code",
            "html", "code",
            "css", "code",
            "json", "data",
            "csv", "data",
            "txt", "documentation",
            "md", "documentation"
    );

    /**
     * 只由存储内部维护的一级目录。
     */
    static final List<String> RESERVED_DIRS = List.of("logs", "temp", "archive", "versions", "metadata");

    /**
     * {@code searchIndex} 未指定条数时的默认上限。
     */
    static final int DEFAULT_INDEX_RESULTS = 5;

    private final Path baseDir;
    private final Path archiveDir;
    private final Clock clock;

    private final SecurityAuditLog auditLog;
    private final PathValidator validator;
    private final ChecksumStore checksums;
    private final VersionArchive versions;
    private final ContentCache cache;
    private final FileIndex index;
    private final OperationMetrics metrics = new OperationMetrics();

    private final Set<String> hiddenWhitelist;
    private final long maxBinaryBytes;
    private final Duration tempFileMaxAge;
    private final Duration archiveRetention;
    private final Duration versionRetention;
    private final int accessLogMaxEntries;
    private final int searchMaxResults;

    private final ReentrantLock lock = new ReentrantLock();
    // 访问记录（路径 -> 最近读取时间 + 累计次数），由 lock 保护
    private final Map<String, AccessRecord> accessLog = new HashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FileStore(FileStoreProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public FileStore(FileStoreProperties properties, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.baseDir = Path.of(properties.getBaseDir()).toAbsolutePath().normalize();
        this.archiveDir = baseDir.resolve("archive");
        Path tempDir = baseDir.resolve("temp");
        Path logsDir = baseDir.resolve("logs");
        Path versionsDir = baseDir.resolve("versions");
        Path metadataDir = baseDir.resolve("metadata");

        try {
            for (Path dir : List.of(baseDir, logsDir, tempDir, archiveDir, versionsDir, metadataDir)) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法初始化存储目录：" + baseDir, e);
        }

        this.hiddenWhitelist = Set.copyOf(properties.getHiddenFileWhitelist());
        this.maxBinaryBytes = properties.getMaxBinarySize().toBytes();
        this.tempFileMaxAge = properties.getTempFileMaxAge();
        this.archiveRetention = properties.getArchiveRetention();
        this.versionRetention = properties.getVersionRetention();
        this.accessLogMaxEntries = Math.max(1, properties.getAccessLogMaxEntries());
        this.searchMaxResults = Math.max(1, properties.getSearchMaxResults());

        this.auditLog = new SecurityAuditLog(logsDir.resolve("security.log"), clock);
        this.validator = new PathValidator(baseDir, hiddenWhitelist, Set.copyOf(RESERVED_DIRS), auditLog);
        this.checksums = new ChecksumStore(metadataDir.resolve("checksums.json"), properties.getChecksumPersistInterval(), auditLog);
        this.versions = new VersionArchive(baseDir, versionsDir, properties.isVersioningEnabled(), clock);
        this.cache = new ContentCache(properties.getCacheMaxEntries(), properties.getCacheTtl(), clock);
        this.index = new FileIndex(properties.getIndexMaxEntries(), clock);

        checksums.load();
        log.info("文件存储已初始化：{}（版本快照：{}，缓存容量：{}）", baseDir, versions.isEnabled(), cache.capacity());
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * 路径是否能通过安全校验（拒绝时写入安全审计日志）。
     */
    public boolean isSafe(String relativePath) {
        return validator.isSafe(relativePath);
    }

    public FileResult<String> readText(String path) {
        return readText(path, true);
    }

    /**
     * 以 UTF-8 读取文本文件（非法字节序列用替换字符兜底）。
     * <p>
     * checksum 不一致时仍返回内容，只在结果的 warnings 中提示。
     *
     * @param useCache 是否先查缓存，并在读取磁盘后写入缓存
     */
    public FileResult<String> readText(String path, boolean useCache) {
        return execute(OperationKind.READ, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            String key = cacheKey(file);
            lock.lock();
            try {
                if (useCache) {
                    String cached = cache.get(key);
                    if (cached != null) {
                        recordAccess(key);
                        return FileResult.ok(cached);
                    }
                }
                FileResult<String> problem = checkRegularFile(file, path);
                if (problem != null) {
                    return problem;
                }

                byte[] bytes = Files.readAllBytes(file);
                String content = decodeUtf8(bytes);

                List<String> warnings = new ArrayList<>();
                verifyIntegrity(file, path, bytes, warnings);
                if (useCache) {
                    cache.put(key, content);
                }
                recordAccess(key);
                return FileResult.ok(content, warnings);
            } finally {
                lock.unlock();
            }
        });
    }

    public FileResult<FileMetadata> writeText(String path, String content) {
        return writeText(path, content, false, true);
    }

    /**
     * 写入文本文件（UTF-8）。
     * <p>
     * 写入采用“同目录临时文件 -> 原子替换”，读者不会看到写了一半的内容；覆盖前按需保存版本快照。
     *
     * @param append 是否追加到现有内容之后
     * @param backup 目标已存在时是否先保存版本快照
     */
    public FileResult<FileMetadata> writeText(String path, String content, boolean append, boolean backup) {
        return execute(OperationKind.WRITE, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            byte[] payload = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
            return writeBytes(file, path, payload, append, backup);
        });
    }

    public FileResult<FileMetadata> writeBinary(String path, byte[] content) {
        return writeBinary(path, content, true);
    }

    /**
     * 写入二进制文件；超过 {@code app.store.max-binary-size} 时直接拒绝，不触碰磁盘。
     */
    public FileResult<FileMetadata> writeBinary(String path, byte[] content, boolean backup) {
        return execute(OperationKind.WRITE_BINARY, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            if (content == null) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "二进制内容不能为空：" + path);
            }
            if (content.length > maxBinaryBytes) {
                return FileResult.failure(FileErrorKind.SIZE_EXCEEDED,
                        "内容过大：" + content.length + " 字节（上限 " + maxBinaryBytes + "）");
            }
            return writeBytes(file, path, content, false, backup);
        });
    }

    /**
     * 读取二进制文件原始字节（不经过缓存）。
     */
    public FileResult<byte[]> readBinary(String path) {
        return execute(OperationKind.READ_BINARY, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            lock.lock();
            try {
                FileResult<byte[]> problem = checkRegularFile(file, path);
                if (problem != null) {
                    return problem;
                }
                byte[] bytes = Files.readAllBytes(file);
                List<String> warnings = new ArrayList<>();
                verifyIntegrity(file, path, bytes, warnings);
                recordAccess(cacheKey(file));
                return FileResult.ok(bytes, warnings);
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * 列出目录（非递归）。
     * <p>
     * 排序：文件在前、目录在后，同类按名称（不区分大小写）。无法读取属性的条目被跳过而不是让整个列表失败。
     * 隐藏文件（含写入中的临时文件）不会出现在结果中。
     *
     * @param includeDirs 是否包含子目录
     * @param pattern     可选正则，对条目名称做 find 匹配
     */
    public FileResult<List<FileMetadata>> listDirectory(String path, boolean includeDirs, String pattern) {
        return execute(OperationKind.LIST, path, () -> {
            Path dir = validator.resolve(path);
            if (dir == null) {
                return accessDenied(path);
            }
            FileResult<List<FileMetadata>> problem = checkDirectory(dir, path);
            if (problem != null) {
                return problem;
            }
            Pattern regex = null;
            if (pattern != null && !pattern.isBlank()) {
                try {
                    regex = Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "正则表达式不合法：" + e.getDescription());
                }
            }

            List<FileMetadata> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path child : stream) {
                    String name = FileAttributesReader.fileName(child);
                    if (isHiddenName(name) || isReservedArea(child)) {
                        continue;
                    }
                    if (regex != null && !regex.matcher(name).find()) {
                        continue;
                    }
                    try {
                        FileMetadata metadata = FileAttributesReader.read(baseDir, child, checksums.get(child));
                        if (metadata.directory() && !includeDirs) {
                            continue;
                        }
                        entries.add(metadata);
                    } catch (IOException e) {
                        log.debug("跳过无法读取属性的条目：{}", child, e);
                    }
                }
            }
            entries.sort(Comparator.comparing(FileMetadata::directory)
                    .thenComparing(FileMetadata::name, String.CASE_INSENSITIVE_ORDER));
            return FileResult.ok(entries);
        });
    }

    public FileResult<FileMetadata> createDirectory(String path) {
        return createDirectory(path, null);
    }

    /**
     * 创建目录（已存在时同样成功）。
     *
     * @param permissions 可选 POSIX 权限位（例如 {@code rwxr-x---}）；平台不支持时忽略
     */
    public FileResult<FileMetadata> createDirectory(String path, String permissions) {
        return execute(OperationKind.CREATE_DIR, path, () -> {
            Path dir = validator.resolve(path);
            if (dir == null) {
                return accessDenied(path);
            }
            Set<PosixFilePermission> perms = null;
            if (permissions != null && !permissions.isBlank()) {
                try {
                    perms = PosixFilePermissions.fromString(permissions);
                } catch (IllegalArgumentException e) {
                    return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "权限位格式不合法：" + permissions);
                }
            }
            if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                return FileResult.failure(FileErrorKind.NOT_A_DIRECTORY, "路径已存在且不是目录：" + path);
            }
            Files.createDirectories(dir);
            if (perms != null && dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(dir, perms);
            }
            return FileResult.ok(FileAttributesReader.read(baseDir, dir, null));
        });
    }

    public FileResult<DeleteResult> deleteFile(String path) {
        return deleteFile(path, true);
    }

    /**
     * 删除文件。
     *
     * @param archive {@code true} 时移入归档区（带时间戳后缀，可恢复）；{@code false} 时永久删除
     */
    public FileResult<DeleteResult> deleteFile(String path, boolean archive) {
        return execute(OperationKind.DELETE, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            lock.lock();
            try {
                FileResult<DeleteResult> problem = checkRegularFile(file, path);
                if (problem != null) {
                    return problem;
                }
                String relative = FileAttributesReader.relativeDisplayPath(baseDir, file);
                String archivePath = null;
                if (archive) {
                    Path target = StorageNames.uniqueStampedTarget(archiveDir, baseDir.relativize(file), clock);
                    AtomicFiles.moveReplacing(file, target);
                    archivePath = FileAttributesReader.relativeDisplayPath(baseDir, target);
                    log.info("已归档删除：{} -> {}", relative, archivePath);
                } else {
                    Files.delete(file);
                    log.info("已永久删除：{}", relative);
                }
                String key = cacheKey(file);
                cache.invalidate(key);
                accessLog.remove(key);
                checksums.remove(file);
                index.remove(relative);
                return FileResult.ok(new DeleteResult(relative, archive, archivePath));
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * 移动文件；目标父目录按需创建，checksum 随文件迁移。
     */
    public FileResult<FileMetadata> moveFile(String source, String destination) {
        return transfer(OperationKind.MOVE, source, destination, true);
    }

    /**
     * 复制文件；目标父目录按需创建，checksum 复制到新路径。
     */
    public FileResult<FileMetadata> copyFile(String source, String destination) {
        return transfer(OperationKind.COPY, source, destination, false);
    }

    /**
     * 文件/目录的完整元信息，附带可读大小、是否已缓存与访问次数。
     */
    public FileResult<FileInfo> getFileInfo(String path) {
        return execute(OperationKind.INFO, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
                return FileResult.failure(FileErrorKind.NOT_FOUND, "路径不存在：" + path);
            }
            FileMetadata metadata = FileAttributesReader.read(baseDir, file, checksums.get(file));
            String key = cacheKey(file);
            lock.lock();
            try {
                AccessRecord access = accessLog.get(key);
                return FileResult.ok(new FileInfo(
                        metadata,
                        FileAttributesReader.humanReadableSize(metadata.sizeBytes()),
                        cache.contains(key),
                        (access == null) ? 0 : access.total,
                        (access == null) ? null : access.recent.peekLast()
                ));
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * 在 {@code directory} 下递归按文件名搜索（不区分大小写的子串匹配），跳过隐藏目录与隐藏文件。
     *
     * @param extensions 可选扩展名白名单（{@code txt} 或 {@code .txt} 均可）；为空表示不过滤
     */
    public FileResult<List<FileMetadata>> searchFiles(String term, String directory, Collection<String> extensions) {
        String dirPath = (directory == null) ? "" : directory;
        return execute(OperationKind.SEARCH, dirPath, () -> {
            if (term == null) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "搜索关键字不能为空");
            }
            Path root = validator.resolve(dirPath);
            if (root == null) {
                return accessDenied(dirPath);
            }
            FileResult<List<FileMetadata>> problem = checkDirectory(root, dirPath);
            if (problem != null) {
                return problem;
            }
            String needle = term.toLowerCase(Locale.ROOT);
            Set<String> allowed = normalizeExtensions(extensions);

            List<FileMetadata> matches = new ArrayList<>();
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && (isHiddenName(FileAttributesReader.fileName(dir)) || isReservedArea(dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String name = FileAttributesReader.fileName(file);
                    if (!attrs.isRegularFile() || isHiddenName(name)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String lowerName = name.toLowerCase(Locale.ROOT);
                    if (!lowerName.contains(needle)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (!allowed.isEmpty() && !allowed.contains(extension(lowerName))) {
                        return FileVisitResult.CONTINUE;
                    }
                    try {
                        matches.add(FileAttributesReader.read(baseDir, file, checksums.get(file)));
                    } catch (IOException e) {
                        log.debug("跳过无法读取属性的文件：{}", file, e);
                    }
                    return (matches.size() >= searchMaxResults) ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("搜索时无法访问：{}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
            matches.sort(Comparator.comparing(FileMetadata::path));
            return FileResult.ok(matches);
        });
    }

    /**
     * 某个文件的全部历史版本（最新在前）；文件已被删除时仍可查询。
     */
    public FileResult<List<FileVersion>> listVersions(String path) {
        return execute(OperationKind.VERSIONS, path, () -> {
            Path file = validator.resolve(path);
            if (file == null) {
                return accessDenied(path);
            }
            return FileResult.ok(versions.listVersions(file));
        });
    }

    public FileResult<CleanupResult> cleanupArchive() {
        return cleanupArchive(archiveRetention);
    }

    /**
     * 删除归档区中早于 {@code maxAge} 的条目（只在调用时执行，没有后台定时任务）。
     */
    public FileResult<CleanupResult> cleanupArchive(Duration maxAge) {
        return execute(OperationKind.CLEANUP, "archive", () -> {
            if (maxAge == null || maxAge.isNegative()) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "保留期不合法：" + maxAge);
            }
            Instant cutoff = Instant.now(clock).minus(maxAge);
            StorageNames.CleanupStats stats;
            lock.lock();
            try {
                stats = StorageNames.sweepOlderThan(archiveDir, cutoff);
            } finally {
                lock.unlock();
            }
            if (stats.removedFiles() > 0) {
                log.info("已清理 {} 个过期归档（早于 {}）", stats.removedFiles(), cutoff);
            }
            return FileResult.ok(new CleanupResult("archive", cutoff, stats.removedFiles(), stats.freedBytes()));
        });
    }

    public FileResult<CleanupResult> cleanupVersions() {
        return cleanupVersions(versionRetention);
    }

    /**
     * 删除版本区中早于 {@code maxAge} 的快照。
     */
    public FileResult<CleanupResult> cleanupVersions(Duration maxAge) {
        return execute(OperationKind.CLEANUP, "versions", () -> {
            if (maxAge == null || maxAge.isNegative()) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "保留期不合法：" + maxAge);
            }
            lock.lock();
            try {
                return FileResult.ok(versions.cleanup(maxAge));
            } finally {
                lock.unlock();
            }
        });
    }

    /**
     * 清理崩溃遗留的写入临时文件（早于 {@code app.store.temp-file-max-age}）。
     */
    public FileResult<CleanupResult> cleanupTempFiles() {
        return execute(OperationKind.CLEANUP, "temp", () -> {
            Instant cutoff = Instant.now(clock).minus(tempFileMaxAge);
            int[] removed = {0};
            lock.lock();
            try {
                Files.walkFileTree(baseDir, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        removed[0] += AtomicFiles.sweepStaleTempFiles(dir, cutoff);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.debug("清理临时文件时无法访问：{}", file, exc);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } finally {
                lock.unlock();
            }
            if (removed[0] > 0) {
                log.info("已清理 {} 个遗留临时文件", removed[0]);
            }
            return FileResult.ok(new CleanupResult("temp", cutoff, removed[0], 0));
        });
    }

    /**
     * 按扩展名把上传的文本文件放入分类目录（code / data / documentation / other），并收录到文件索引。
     * <p>
     * 索引已满时文件照常保存，结果中带一条告警。
     *
     * @param fileName 上传时的文件名（只取最后一级）
     */
    public FileResult<OrganizedFile> organizeFile(String fileName, String content) {
        String name = (fileName == null) ? "" : fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        if (name.isBlank()) {
            return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "文件名不能为空");
        }
        String category = CATEGORY_BY_EXTENSION.getOrDefault(extension(name.toLowerCase(Locale.ROOT)), "other");
        FileResult<FileMetadata> written = writeText(category + "/" + name, content, false, true);
        if (!written.success()) {
            return FileResult.failure(written.errorKind(), written.message());
        }
        FileMetadata metadata = written.value();
        boolean indexed = index.add(metadata.path(), fileName, category, content);
        List<String> warnings = new ArrayList<>(written.warnings());
        if (!indexed) {
            warnings.add("文件索引已满（上限 " + index.capacity() + "），文件已保存但未收录：" + metadata.path());
        }
        return FileResult.ok(new OrganizedFile(fileName, category, metadata.path(), metadata.sha256(), indexed), warnings);
    }

    public FileResult<List<IndexedFile>> searchIndex(String query) {
        return searchIndex(query, DEFAULT_INDEX_RESULTS);
    }

    /**
     * 在文件索引中按路径或内容片段搜索（不区分大小写），按收录顺序返回。
     */
    public FileResult<List<IndexedFile>> searchIndex(String query, int maxResults) {
        return execute(OperationKind.INDEX_SEARCH, String.valueOf(query), () -> {
            if (query == null || query.isBlank()) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "搜索关键字不能为空");
            }
            if (maxResults < 1) {
                return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "结果条数必须大于 0：" + maxResults);
            }
            return FileResult.ok(index.search(query, maxResults));
        });
    }

    /**
     * 性能指标快照：各操作的次数/耗时/错误率，以及缓存、checksum 表与安全事件的统计。
     */
    public FileResult<StoreMetrics> metricsSnapshot() {
        lock.lock();
        try {
            return FileResult.ok(new StoreMetrics(
                    metrics.snapshot(),
                    cache.size(),
                    cache.capacity(),
                    cache.hits(),
                    cache.misses(),
                    cache.hitRate(),
                    checksums.size(),
                    auditLog.eventCount(),
                    index.size()
            ));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 立即把 checksum 表落盘。
     */
    public FileResult<Integer> flush() {
        try {
            checksums.save();
            return FileResult.ok(checksums.size());
        } catch (IOException e) {
            log.error("持久化 checksum 表失败", e);
            return FileResult.failure(FileErrorKind.OS_FAILURE, "持久化 checksum 表失败：" + e.getMessage());
        }
    }

    /**
     * 受控关闭：落盘 checksum 表。重复调用无副作用。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        FileResult<Integer> flushed = flush();
        if (flushed.success()) {
            log.info("文件存储已关闭，已保存 {} 条 checksum 记录", flushed.value());
        }
    }

    private FileResult<FileMetadata> transfer(OperationKind kind, String source, String destination, boolean move) {
        return execute(kind, source + " -> " + destination, () -> {
            Path from = validator.resolve(source);
            if (from == null) {
                return accessDenied(source);
            }
            Path to = validator.resolve(destination);
            if (to == null) {
                return accessDenied(destination);
            }
            lock.lock();
            try {
                FileResult<FileMetadata> problem = checkRegularFile(from, source);
                if (problem != null) {
                    return problem;
                }
                if (from.equals(to)) {
                    return FileResult.failure(FileErrorKind.INVALID_ARGUMENT, "源路径与目标路径相同：" + source);
                }
                if (to.equals(baseDir) || Files.isDirectory(to, LinkOption.NOFOLLOW_LINKS)) {
                    return FileResult.failure(FileErrorKind.NOT_A_FILE, "目标路径是目录：" + destination);
                }
                Files.createDirectories(to.getParent());

                List<String> warnings = new ArrayList<>();
                if (versions.isEnabled() && Files.isRegularFile(to, LinkOption.NOFOLLOW_LINKS) && versions.snapshot(to) == null) {
                    warnings.add("目标文件的版本快照失败，已继续覆盖：" + destination);
                }
                if (move) {
                    AtomicFiles.moveReplacing(from, to);
                    checksums.move(from, to);
                    String fromKey = cacheKey(from);
                    cache.invalidate(fromKey);
                    accessLog.remove(fromKey);
                    index.move(fromKey, cacheKey(to));
                } else {
                    Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    checksums.copy(from, to);
                    index.remove(cacheKey(to));
                }
                String toKey = cacheKey(to);
                cache.invalidate(toKey);
                // 目标路径上的访问记录属于被覆盖的旧内容
                accessLog.remove(toKey);
                return FileResult.ok(FileAttributesReader.read(baseDir, to, checksums.get(to)), warnings);
            } finally {
                lock.unlock();
            }
        });
    }

    private FileResult<FileMetadata> writeBytes(Path file, String path, byte[] payload, boolean append, boolean backup) throws IOException {
        if (file.equals(baseDir)) {
            return FileResult.failure(FileErrorKind.NOT_A_FILE, "不能写入根目录：" + path);
        }
        lock.lock();
        try {
            if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS)) {
                return FileResult.failure(FileErrorKind.NOT_A_FILE, "目标路径是目录，无法写入文件：" + path);
            }
            Path parent = file.getParent();
            Files.createDirectories(parent);

            boolean exists = Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS);
            byte[] bytes = payload;
            if (append && exists) {
                byte[] existing = Files.readAllBytes(file);
                bytes = new byte[existing.length + payload.length];
                System.arraycopy(existing, 0, bytes, 0, existing.length);
                System.arraycopy(payload, 0, bytes, existing.length, payload.length);
            }

            List<String> warnings = new ArrayList<>();
            if (backup && exists && versions.isEnabled() && versions.snapshot(file) == null) {
                warnings.add("版本快照失败，已继续写入：" + path);
            }

            try {
                AtomicFiles.writeAtomically(file, bytes);
            } catch (AccessDeniedException e) {
                log.warn("写入被拒绝（权限不足）：{}", path, e);
                return FileResult.failure(FileErrorKind.PERMISSION_DENIED, "权限不足，无法写入：" + path);
            } catch (IOException e) {
                log.error("写入文件失败：{}", path, e);
                return FileResult.failure(FileErrorKind.WRITE_FAILURE, "写入文件失败：" + path + "（" + e.getMessage() + "）");
            }

            checksums.update(file, bytes);
            cache.invalidate(cacheKey(file));
            AtomicFiles.sweepStaleTempFiles(parent, Instant.now(clock).minus(tempFileMaxAge));
            log.debug("已写入 {}（{} 字节）", path, bytes.length);
            return FileResult.ok(FileAttributesReader.read(baseDir, file, checksums.get(file)), warnings);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 统一的操作边界：记录指标、把异常转换为失败结果。
     */
    private <T> FileResult<T> execute(OperationKind kind, String target, StoreOperation<T> operation) {
        long started = System.nanoTime();
        boolean success = false;
        try {
            FileResult<T> result = operation.run();
            success = result.success();
            return result;
        } catch (AccessDeniedException e) {
            log.warn("{} 被拒绝（权限不足）：{}", kind.key(), target, e);
            return FileResult.failure(FileErrorKind.PERMISSION_DENIED, "权限不足：" + target);
        } catch (NoSuchFileException e) {
            return FileResult.failure(FileErrorKind.NOT_FOUND, "路径不存在：" + target);
        } catch (IOException e) {
            log.error("{} 失败：{}", kind.key(), target, e);
            return FileResult.failure(FileErrorKind.OS_FAILURE, kind.key() + " 失败：" + e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} 出现意外错误：{}", kind.key(), target, e);
            return FileResult.failure(FileErrorKind.OS_FAILURE, kind.key() + " 出现意外错误：" + e.getMessage());
        } finally {
            metrics.record(kind, System.nanoTime() - started, success);
        }
    }

    private void verifyIntegrity(Path file, String path, byte[] bytes, List<String> warnings) {
        if (checksums.get(file) == null) {
            checksums.update(file, bytes);
        } else if (!checksums.verify(file, bytes)) {
            warnings.add("完整性告警：内容与记录的 checksum 不一致：" + path);
        }
    }

    private void recordAccess(String key) {
        accessLog.computeIfAbsent(key, k -> new AccessRecord()).add(Instant.now(clock), accessLogMaxEntries);
    }

    private String cacheKey(Path file) {
        return FileAttributesReader.relativeDisplayPath(baseDir, file);
    }

    /**
     * 是否为 BaseDirectory 下的保留目录本身。
     */
    private boolean isReservedArea(Path path) {
        return baseDir.equals(path.getParent()) && validator.isReserved(baseDir.relativize(path));
    }

    private boolean isHiddenName(String name) {
        return name.startsWith(".") && !hiddenWhitelist.contains(name);
    }

    private static <T> FileResult<T> checkRegularFile(Path file, String path) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return FileResult.failure(FileErrorKind.NOT_FOUND, "文件不存在：" + path);
        }
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            return FileResult.failure(FileErrorKind.NOT_A_FILE, "不是普通文件：" + path);
        }
        return null;
    }

    private static <T> FileResult<T> checkDirectory(Path dir, String path) {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return FileResult.failure(FileErrorKind.NOT_FOUND, "目录不存在：" + path);
        }
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return FileResult.failure(FileErrorKind.NOT_A_DIRECTORY, "不是目录：" + path);
        }
        return null;
    }

    private static <T> FileResult<T> accessDenied(String path) {
        return FileResult.failure(FileErrorKind.ACCESS_DENIED, "拒绝访问：" + path);
    }

    private static String decodeUtf8(byte[] bytes) {
        // String 构造器对非法 UTF-8 字节用替换字符兜底，不会抛异常
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return (dot >= 0 && dot < name.length() - 1) ? name.substring(dot + 1) : "";
    }

    private static Set<String> normalizeExtensions(Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new HashSet<>();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String e = ext.trim().toLowerCase(Locale.ROOT);
            normalized.add(e.startsWith(".") ? e.substring(1) : e);
        }
        return normalized;
    }

    @FunctionalInterface
    private interface StoreOperation<T> {
        FileResult<T> run() throws IOException;
    }

    /**
     * 单个路径的读取记录：最近 N 次读取时间（环形缓冲）+ 累计次数。
     */
    private static final class AccessRecord {
        private final ArrayDeque<Instant> recent = new ArrayDeque<>();
        private long total;

        private void add(Instant at, int maxEntries) {
            if (recent.size() >= maxEntries) {
                recent.pollFirst();
            }
            recent.addLast(at);
            total++;
        }
    }
}
