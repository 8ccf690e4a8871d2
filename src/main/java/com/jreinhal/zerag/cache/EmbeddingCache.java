package com.jreinhal.zerag.cache;

import com.jreinhal.zerag.util.Hashing;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Query-embedding cache keyed by the SHA-256 of the text. Entries never expire: identical text
 * maps to the same vector under a fixed model. Eviction is strict least-recently-used.
 */
@Component
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    @Value("${zerag.embedding.cache.enabled:true}")
    private boolean enabled;

    @Value("${zerag.embedding.cache.capacity:2000}")
    private int capacity;

    private final Object lock = new Object();
    private LruMap entries;

    @PostConstruct
    public void init() {
        this.entries = new LruMap(Math.max(1, this.capacity));
        log.info("Embedding cache initialized (enabled={}, capacity={})", this.enabled, this.capacity);
    }

    /**
     * Returns the cached vector for {@code text}, computing and inserting it on a miss.
     * When the cache is disabled every call goes straight to {@code embedder}. Callers get their
     * own copy of the vector and may modify it.
     */
    public float[] getOrCompute(String text, Function<String, float[]> embedder) {
        if (!this.enabled) {
            return embedder.apply(text);
        }
        String key = Hashing.sha256(text);
        synchronized (this.lock) {
            float[] cached = this.entries.get(key);
            if (cached != null) {
                return cached.clone();
            }
        }
        float[] computed = embedder.apply(text);
        // A failing embedder may return nothing; never pin that result.
        if (computed != null && computed.length > 0) {
            synchronized (this.lock) {
                this.entries.put(key, computed.clone());
            }
        }
        return computed;
    }

    public boolean contains(String text) {
        String key = Hashing.sha256(text);
        synchronized (this.lock) {
            return this.entries.containsKey(key);
        }
    }

    public int size() {
        synchronized (this.lock) {
            return this.entries.size();
        }
    }

    public void clear() {
        synchronized (this.lock) {
            this.entries.clear();
        }
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    private static final class LruMap extends LinkedHashMap<String, float[]> {
        private final int maxSize;

        private LruMap(int maxSize) {
            super(Math.max(16, maxSize), 0.75f, true);
            this.maxSize = maxSize;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
            return size() > this.maxSize;
        }
    }
}
