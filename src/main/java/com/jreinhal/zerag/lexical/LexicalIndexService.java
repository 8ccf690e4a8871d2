package com.jreinhal.zerag.lexical;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.model.DocumentChunk;
import com.jreinhal.zerag.repository.DocumentChunkRepository;
import com.jreinhal.zerag.util.LogSanitizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Per-data-source BM25 indexes, built lazily from the stored chunks on first search and
 * dropped on {@link #invalidate(String)}. Builds run outside the lock; a generation counter
 * keeps a build that raced with an invalidation from being installed.
 */
@Service
public class LexicalIndexService {

    private static final Logger log = LoggerFactory.getLogger(LexicalIndexService.class);
    static final double KEYWORD_SIMILARITY = 0.99;
    private static final double NORMALIZED_CEILING = 0.99;
    private static final double EPSILON = 1e-9;

    private final DocumentChunkRepository chunkRepository;
    private final MongoTemplate mongoTemplate;
    private final LexicalAnalyzerProvider analyzerProvider;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, LexicalIndex> indexes = new HashMap<>();
    private final Map<String, Long> generations = new HashMap<>();

    public LexicalIndexService(DocumentChunkRepository chunkRepository, MongoTemplate mongoTemplate,
                               LexicalAnalyzerProvider analyzerProvider) {
        this.chunkRepository = chunkRepository;
        this.mongoTemplate = mongoTemplate;
        this.analyzerProvider = analyzerProvider;
    }

    /**
     * BM25 search scoped to one data source. Returns at most {@code 2 * topK} hits with a
     * positive score; similarity is the score normalized against the best hit.
     */
    public List<RetrievedChunk> search(String query, String dataSourceId, int topK) {
        if (dataSourceId == null || topK <= 0) {
            return List.of();
        }
        List<String> tokens = this.analyzerProvider.tokenize(query);
        if (tokens.isEmpty()) {
            return List.of();
        }
        LexicalIndex index = this.indexFor(dataSourceId);
        List<LexicalIndex.Hit> hits = index.search(tokens, topK * 2);
        if (hits.isEmpty()) {
            return List.of();
        }
        double maxScore = hits.get(0).score();
        List<RetrievedChunk> results = new ArrayList<>(hits.size());
        for (LexicalIndex.Hit hit : hits) {
            DocumentChunk chunk = hit.chunk();
            double normalized = Math.min(hit.score() / (maxScore + EPSILON) * NORMALIZED_CEILING, NORMALIZED_CEILING);
            results.add(new RetrievedChunk(chunk.getId(), chunk.getDataSourceId(), chunk.getUnitName(),
                    chunk.getRowId(), chunk.getText(), normalized, RetrievalSource.BM25, hit.score(), null));
        }
        if (log.isDebugEnabled()) {
            log.debug("BM25 {} on {}: {} hits (max score {})", LogSanitizer.querySummary(query), dataSourceId,
                    results.size(), maxScore);
        }
        return results;
    }

    /**
     * Case-insensitive substring match on any keyword, optionally scoped. Every hit gets the
     * fixed similarity {@value #KEYWORD_SIMILARITY}.
     */
    public List<RetrievedChunk> substringSearch(List<String> keywords, String dataSourceId, int limit) {
        if (keywords == null || limit <= 0) {
            return List.of();
        }
        List<Criteria> matchers = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                matchers.add(Criteria.where("text").regex(Pattern.quote(keyword.strip()), "i"));
            }
        }
        if (matchers.isEmpty()) {
            return List.of();
        }
        Criteria criteria = new Criteria().orOperator(matchers.toArray(new Criteria[0]));
        if (dataSourceId != null) {
            criteria = new Criteria().andOperator(Criteria.where("dataSourceId").is(dataSourceId), criteria);
        }
        Query query = new Query(criteria).limit(limit);
        List<RetrievedChunk> results = new ArrayList<>();
        for (DocumentChunk chunk : this.mongoTemplate.find(query, DocumentChunk.class)) {
            results.add(new RetrievedChunk(chunk.getId(), chunk.getDataSourceId(), chunk.getUnitName(),
                    chunk.getRowId(), chunk.getText(), KEYWORD_SIMILARITY, RetrievalSource.KEYWORD, null, null));
        }
        return results;
    }

    public void invalidate(String dataSourceId) {
        if (dataSourceId == null) {
            return;
        }
        this.lock.lock();
        try {
            this.indexes.remove(dataSourceId);
            this.generations.merge(dataSourceId, 1L, Long::sum);
        }
        finally {
            this.lock.unlock();
        }
        log.info("Lexical index invalidated for data source {}", dataSourceId);
    }

    public boolean isIndexed(String dataSourceId) {
        this.lock.lock();
        try {
            return this.indexes.containsKey(dataSourceId);
        }
        finally {
            this.lock.unlock();
        }
    }

    private LexicalIndex indexFor(String dataSourceId) {
        long generation;
        this.lock.lock();
        try {
            LexicalIndex existing = this.indexes.get(dataSourceId);
            if (existing != null) {
                return existing;
            }
            generation = this.generations.getOrDefault(dataSourceId, 0L);
        }
        finally {
            this.lock.unlock();
        }

        long start = System.currentTimeMillis();
        List<DocumentChunk> chunks = this.chunkRepository.findByDataSourceId(dataSourceId);
        LexicalIndex built = LexicalIndex.build(chunks, this.analyzerProvider.newAnalyzer());

        this.lock.lock();
        try {
            LexicalIndex raced = this.indexes.get(dataSourceId);
            if (raced != null) {
                return raced;
            }
            if (this.generations.getOrDefault(dataSourceId, 0L) == generation) {
                this.indexes.put(dataSourceId, built);
            }
            else {
                log.debug("Discarding stale lexical index for {} (invalidated during build)", dataSourceId);
            }
        }
        finally {
            this.lock.unlock();
        }
        log.info("Lexical index built for data source {} ({} chunks, {}ms)", dataSourceId, built.size(),
                System.currentTimeMillis() - start);
        return built;
    }
}
