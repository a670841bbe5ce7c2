package org.safestore.filesystem;

import org.safestore.filesystem.dto.FileMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * 读取文件属性并组装 {@link FileMetadata}。
 */
final class FileAttributesReader {

    private static final Logger log = LoggerFactory.getLogger(FileAttributesReader.class);

    /**
     * 常见扩展名 -> MIME 类型。
     * <p>
     * {@link Files#probeContentType} 在精简系统上经常返回 null，此表作为兜底。
     */
    private static final Map<String, String> MIME_BY_EXTENSION = Map.ofEntries(
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("log", "text/plain"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("js", "text/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"),
            Map.entry("py", "text/x-python"),
            Map.entry("java", "text/x-java-source"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("zip", "application/zip"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav")
    );

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileAttributesReader() {
    }

    static FileMetadata read(Path baseDir, Path path, String sha256) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        String name = fileName(path);
        Instant modifiedAt = attrs.lastModifiedTime().toInstant();
        Instant createdAt = (attrs.creationTime() != null) ? attrs.creationTime().toInstant() : modifiedAt;
        boolean directory = attrs.isDirectory();
        return new FileMetadata(
                name,
                relativeDisplayPath(baseDir, path),
                directory ? 0L : attrs.size(),
                modifiedAt,
                createdAt,
                directory,
                attrs.isRegularFile(),
                directory ? null : mimeType(path),
                permissions(path),
                sha256
        );
    }

    static String mimeType(Path path) {
        String probed = null;
        try {
            probed = Files.probeContentType(path);
        } catch (IOException e) {
            log.debug("探测 MIME 类型失败，改用扩展名判断：{}", path, e);
        }
        if (probed != null) {
            return probed;
        }
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && dot < name.length() - 1) {
            String mime = MIME_BY_EXTENSION.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (mime != null) {
                return mime;
            }
        }
        return "application/octet-stream";
    }

    /**
     * 以 1024 为进制格式化大小，保留一位小数（字节数不带小数）。
     */
    static String humanReadableSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, SIZE_UNITS[unit]);
    }

    static String relativeDisplayPath(Path baseDir, Path path) {
        return baseDir.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    static String fileName(Path path) {
        Path name = path.getFileName();
        return (name != null) ? name.toString() : path.toString();
    }

    private static String permissions(Path path) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (view == null) {
            return null;
        }
        return PosixFilePermissions.toString(view.readAttributes().permissions());
    }
}
