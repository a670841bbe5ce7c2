package org.safestore.filesystem;

import org.safestore.filesystem.dto.IndexedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 上传文件索引：路径 -> 原始文件名、分类、上传时间与内容片段。
 * <p>
 * 说明：
 * <ul>
 *   <li>容量有上限：满了以后拒绝新路径（已收录路径仍可更新），只记 WARN 日志。</li>
 *   <li>搜索对路径与内容片段做不区分大小写的子串匹配，按收录顺序返回。</li>
 * </ul>
 */
public class FileIndex {

    private static final Logger log = LoggerFactory.getLogger(FileIndex.class);

    static final int SNIPPET_LENGTH = 2000;

    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, IndexedFile> entries = new LinkedHashMap<>();

    public FileIndex(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    /**
     * 收录（或更新）一个文件。
     *
     * @return 索引已满且该路径尚未收录时返回 {@code false}
     */
    public boolean add(String path, String originalName, String category, String content) {
        IndexedFile entry = new IndexedFile(path, originalName, category, Instant.now(clock), snippet(content));
        lock.lock();
        try {
            if (!entries.containsKey(path) && entries.size() >= maxEntries) {
                log.warn("文件索引已满（上限 {}），未收录：{}", maxEntries, path);
                return false;
            }
            entries.put(path, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public List<IndexedFile> search(String query, int maxResults) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<IndexedFile> matches = new ArrayList<>();
        lock.lock();
        try {
            for (IndexedFile entry : entries.values()) {
                if (matches.size() >= maxResults) {
                    break;
                }
                if (entry.path().toLowerCase(Locale.ROOT).contains(needle)
                        || entry.snippet().toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return matches;
    }

    public void remove(String path) {
        lock.lock();
        try {
            entries.remove(path);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 文件被移动后让记录跟随到新路径（目标路径上原有的记录被替换）。
     */
    public void move(String from, String to) {
        lock.lock();
        try {
            IndexedFile entry = entries.remove(from);
            entries.remove(to);
            if (entry != null) {
                entries.put(to, new IndexedFile(to, entry.originalName(), entry.category(), entry.uploadedAt(), entry.snippet()));
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return maxEntries;
    }

    private static String snippet(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= SNIPPET_LENGTH) {
            return content;
        }
        int end = SNIPPET_LENGTH;
        // 不把代理对拆成两半
        if (Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end);
    }
}
