package org.safestore.filesystem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 文本内容缓存（内存版，带 TTL + 容量上限）。
 * <p>
 * 两种淘汰互相独立：
 * <ul>
 *   <li>容量：插入新 key 前如果已满，淘汰最后访问时间最早的那一条。</li>
 *   <li>TTL：条目从写入缓存起超过 TTL 即视为过期，访问时顺带移除，即使负载很轻也会过期。</li>
 * </ul>
 * <p>
 * 该类本身不加锁，所有调用都在 {@link FileStore} 的实例锁内进行。
 */
public class ContentCache {

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;

    private final Map<String, Entry> entries = new HashMap<>();

    // 访问序号：同一时刻的多次访问也能区分先后
    private long accessSequence;
    private long hits;
    private long misses;

    public ContentCache(int maxEntries, Duration ttl, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * 命中且未过期时返回内容，否则返回 {@code null}。
     */
    public String get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        Instant now = Instant.now(clock);
        if (isExpired(entry, now)) {
            entries.remove(key);
            misses++;
            return null;
        }
        entry.sequence = ++accessSequence;
        hits++;
        return entry.content;
    }

    public void put(String key, String content) {
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictLeastRecentlyAccessed();
        }
        entries.put(key, new Entry(content, Instant.now(clock), ++accessSequence));
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    /**
     * 是否存在未过期的条目（不计入命中率，不刷新访问时间）。
     */
    public boolean contains(String key) {
        Entry entry = entries.get(key);
        return entry != null && !isExpired(entry, Instant.now(clock));
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return maxEntries;
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public double hitRate() {
        long total = hits + misses;
        return (total == 0) ? 0.0 : (double) hits / total;
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !now.isBefore(entry.storedAt.plus(ttl));
    }

    private void evictLeastRecentlyAccessed() {
        String oldestKey = null;
        long oldestSequence = Long.MAX_VALUE;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().sequence < oldestSequence) {
                oldestSequence = e.getValue().sequence;
                oldestKey = e.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
        }
    }

    private static final class Entry {
        private final String content;
        private final Instant storedAt;
        private long sequence;

        private Entry(String content, Instant storedAt, long sequence) {
            this.content = content;
            this.storedAt = storedAt;
            this.sequence = sequence;
        }
    }
}
