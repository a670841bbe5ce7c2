package org.safestore.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 安全事件审计日志：每个事件在 {@code logs/security.log} 中追加一行，并计数。
 * <p>
 * 事件包括：路径校验拒绝、内容 checksum 不一致。写审计文件失败只记 ERROR 日志，不影响调用方。
 */
public class SecurityAuditLog {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditLog.class);

    private final Path logFile;
    private final Clock clock;
    private final AtomicLong eventCount = new AtomicLong();
    private final Object writeLock = new Object();

    public SecurityAuditLog(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    /**
     * 记录一条安全事件。
     *
     * @param event  事件类型（例如 PATH_REJECTED、INTEGRITY_MISMATCH）
     * @param detail 事件详情（路径与原因）
     */
    public void record(String event, String detail) {
        eventCount.incrementAndGet();
        log.warn("安全事件 {}：{}", event, detail);

        String line = Instant.now(clock) + " " + event + " " + sanitize(detail) + System.lineSeparator();
        // 多线程同时追加时保证一行一个事件，不交错
        synchronized (writeLock) {
            try {
                Path parent = logFile.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(logFile, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                log.error("写入安全审计日志失败：{}", logFile, e);
            }
        }
    }

    public long eventCount() {
        return eventCount.get();
    }

    private static String sanitize(String detail) {
        if (detail == null) {
            return "";
        }
        // 路径来自不可信输入，换行符会伪造出额外的审计行
        return detail.replace('\r', ' ').replace('\n', ' ');
    }
}
