package com.jreinhal.zerag.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-data-source version counters. A bump makes every result-cache key built under the old
 * version unreachable; stale entries then age out on their own.
 */
@Component
public class SourceVersionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceVersionRegistry.class);

    private final Map<String, AtomicLong> versions = new ConcurrentHashMap<>();

    /**
     * Current version; 0 for unknown sources and for unscoped (global) requests.
     */
    public long current(String dataSourceId) {
        if (dataSourceId == null) {
            return 0L;
        }
        AtomicLong version = this.versions.get(dataSourceId);
        return version != null ? version.get() : 0L;
    }

    public long bump(String dataSourceId) {
        if (dataSourceId == null) {
            return 0L;
        }
        long next = this.versions.computeIfAbsent(dataSourceId, id -> new AtomicLong()).incrementAndGet();
        log.info("Data source {} version bumped to {}", dataSourceId, next);
        return next;
    }
}
