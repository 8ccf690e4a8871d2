package com.jreinhal.zerag.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.zerag.dto.AnswerResult;
import com.jreinhal.zerag.util.Hashing;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * TTL cache of final answers. The key folds in the data source's current version, read at
 * lookup time, so a completed sync invalidates every earlier entry without an active purge.
 */
@Component
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final SourceVersionRegistry versions;

    @Value("${zerag.cache.result.enabled:true}")
    private boolean enabled = true;

    @Value("${zerag.cache.result.capacity:200}")
    private int capacity = 200;

    @Value("${zerag.cache.result.ttl-seconds:300}")
    private long ttlSeconds = 300L;

    private Cache<String, AnswerResult> cache;

    public ResultCache(SourceVersionRegistry versions) {
        this.versions = versions;
    }

    @PostConstruct
    public void init() {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, this.capacity))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, this.ttlSeconds)))
                .build();
        log.info("Result cache initialized (enabled={}, capacity={}, ttl={}s)", this.enabled, this.capacity, this.ttlSeconds);
    }

    public Optional<AnswerResult> get(String question, String dataSourceId, int topK) {
        return this.get(this.keyFor(question, dataSourceId, topK));
    }

    public Optional<AnswerResult> get(String key) {
        if (!this.enabled || key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.cache.getIfPresent(key));
    }

    /**
     * Stores under a key taken before generation started. A sync that completes in between
     * bumps the version, so the entry is never reachable under the newer version.
     */
    public void put(String key, AnswerResult result) {
        if (!this.enabled || key == null || result == null) {
            return;
        }
        this.cache.put(key, result);
    }

    /**
     * Key for the data source's version as of now.
     */
    public String keyFor(String question, String dataSourceId, int topK) {
        long version = this.versions.current(dataSourceId);
        return Hashing.sha256(question + "|" + dataSourceId + "|" + topK + "|v" + version);
    }

    public long estimatedSize() {
        return this.cache.estimatedSize();
    }
}
