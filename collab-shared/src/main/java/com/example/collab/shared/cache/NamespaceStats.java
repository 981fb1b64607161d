package com.example.collab.shared.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-namespace counters. Read and write times are accumulated so averages can be reported.
 */
class NamespaceStats {
    final LongAdder hits = new LongAdder();
    final LongAdder misses = new LongAdder();
    final LongAdder sets = new LongAdder();
    final LongAdder deletes = new LongAdder();
    final LongAdder readErrors = new LongAdder();
    final LongAdder writeErrors = new LongAdder();
    final LongAdder readTimeMs = new LongAdder();
    final LongAdder writeTimeMs = new LongAdder();

    Map<String, Object> snapshot() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long reads = hitCount + missCount;
        long writes = sets.sum();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("hits", hitCount);
        stats.put("misses", missCount);
        stats.put("sets", writes);
        stats.put("deletes", deletes.sum());
        stats.put("hitRate", reads == 0 ? 0.0 : (double) hitCount / reads);
        stats.put("avgReadMs", reads == 0 ? 0.0 : (double) readTimeMs.sum() / reads);
        stats.put("avgWriteMs", writes == 0 ? 0.0 : (double) writeTimeMs.sum() / writes);
        stats.put("readErrors", readErrors.sum());
        stats.put("writeErrors", writeErrors.sum());
        return stats;
    }
}
