package org.safestore.filesystem;

import org.safestore.filesystem.dto.OperationStats;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 按操作类型累计的性能/错误计数（只增不减）。
 * <p>
 * 记录时不加锁（{@link LongAdder}），平均耗时与错误率在 {@link #snapshot()} 时才计算。
 */
public class OperationMetrics {

    private final ConcurrentHashMap<OperationKind, Counter> counters = new ConcurrentHashMap<>();

    public void record(OperationKind kind, long durationNanos, boolean success) {
        Counter counter = counters.computeIfAbsent(kind, k -> new Counter());
        counter.count.increment();
        counter.totalNanos.add(Math.max(0, durationNanos));
        if (!success) {
            counter.errors.increment();
        }
    }

    /**
     * 当前快照：只包含至少被记录过一次的操作类型，按枚举顺序排列。
     */
    public Map<String, OperationStats> snapshot() {
        Map<OperationKind, Counter> ordered = new EnumMap<>(OperationKind.class);
        ordered.putAll(counters);

        Map<String, OperationStats> result = new LinkedHashMap<>();
        for (Map.Entry<OperationKind, Counter> e : ordered.entrySet()) {
            Counter c = e.getValue();
            long count = c.count.sum();
            long errors = c.errors.sum();
            double totalSeconds = c.totalNanos.sum() / 1_000_000_000.0;
            result.put(e.getKey().key(), new OperationStats(
                    count,
                    totalSeconds,
                    errors,
                    (count == 0) ? 0.0 : totalSeconds / count,
                    (count == 0) ? 0.0 : (double) errors / count
            ));
        }
        return result;
    }

    private static final class Counter {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final LongAdder errors = new LongAdder();
    }
}
