package org.safestore.filesystem;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内容 checksum 表：绝对路径 -> 最近一次已知内容的 sha256（十六进制）。
 * <p>
 * 说明：
 * <ul>
 *   <li>每次成功写入或校验通过的读取都会更新该表。</li>
 *   <li>读取时发现 checksum 不一致只记录安全事件，不阻止读取（检测而非阻断）。</li>
 *   <li>持久化到 {@code metadata/checksums.json}；为避免每次写入都序列化整张表，
 *       每累计 {@code persistInterval} 次更新才落盘一次，关闭时再强制落盘。</li>
 *   <li>持久化文件缺失或损坏时退化为空表，不影响启动。</li>
 * </ul>
 */
public class ChecksumStore {

    private static final Logger log = LoggerFactory.getLogger(ChecksumStore.class);

    private static final HexFormat HEX = HexFormat.of();
    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ConcurrentHashMap<String, String> checksums = new ConcurrentHashMap<>();
    private final AtomicLong updateCounter = new AtomicLong();
    private final Object saveLock = new Object();

    private final Path metadataFile;
    private final int persistInterval;
    private final SecurityAuditLog auditLog;

    public ChecksumStore(Path metadataFile, int persistInterval, SecurityAuditLog auditLog) {
        this.metadataFile = metadataFile;
        this.persistInterval = Math.max(1, persistInterval);
        this.auditLog = auditLog;
    }

    public static String checksum(byte[] content) {
        return HEX.formatHex(sha256Digest().digest(content));
    }

    public static String checksum(String content) {
        return checksum(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 对比新计算的 checksum 与表中记录。
     *
     * @return 一致或尚无记录时为 {@code true}；不一致时记录安全事件并返回 {@code false}
     */
    public boolean verify(Path path, byte[] content) {
        String expected = checksums.get(key(path));
        if (expected == null) {
            return true;
        }
        String actual = checksum(content);
        if (expected.equalsIgnoreCase(actual)) {
            return true;
        }
        auditLog.record("INTEGRITY_MISMATCH", "path=" + path + " expected=" + expected + " actual=" + actual);
        return false;
    }

    public void update(Path path, byte[] content) {
        update(path, checksum(content));
    }

    public void update(Path path, String digest) {
        checksums.put(key(path), digest);
        onMutation();
    }

    public String get(Path path) {
        return checksums.get(key(path));
    }

    public void remove(Path path) {
        if (checksums.remove(key(path)) != null) {
            onMutation();
        }
    }

    /**
     * 把 checksum 从旧路径迁移到新路径（移动文件后调用）。
     */
    public void move(Path from, Path to) {
        String digest = checksums.remove(key(from));
        if (digest != null) {
            update(to, digest);
        } else {
            // 源文件没有记录时，目标路径上旧的记录已经失效
            remove(to);
        }
    }

    /**
     * 为复制出的新路径复制一份 checksum。
     */
    public void copy(Path from, Path to) {
        String digest = checksums.get(key(from));
        if (digest != null) {
            update(to, digest);
        } else {
            remove(to);
        }
    }

    public int size() {
        return checksums.size();
    }

    /**
     * 从持久化文件加载整张表（覆盖内存中的内容）。
     */
    public void load() {
        checksums.clear();
        if (!Files.isRegularFile(metadataFile)) {
            log.info("checksum 元数据文件不存在，使用空表：{}", metadataFile);
            return;
        }
        try {
            Map<String, String> loaded = objectMapper.readValue(metadataFile.toFile(), MAP_TYPE);
            if (loaded != null) {
                loaded.forEach((k, v) -> {
                    if (k != null && v != null) {
                        checksums.put(k, v);
                    }
                });
            }
            log.info("已加载 {} 条 checksum 记录", checksums.size());
        } catch (IOException e) {
            log.warn("checksum 元数据文件损坏或无法读取，使用空表：{}", metadataFile, e);
            checksums.clear();
        }
    }

    /**
     * 把整张表写入持久化文件（原子替换）。
     */
    public void save() throws IOException {
        synchronized (saveLock) {
            Files.createDirectories(metadataFile.getParent());
            byte[] json = objectMapper.writeValueAsBytes(new TreeMap<>(checksums));
            AtomicFiles.writeAtomically(metadataFile, json);
        }
    }

    private void onMutation() {
        if (updateCounter.incrementAndGet() % persistInterval != 0) {
            return;
        }
        try {
            save();
        } catch (IOException e) {
            log.warn("周期性持久化 checksum 失败（下次更新或关闭时重试）：{}", metadataFile, e);
        }
    }

    private static String key(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
