package com.jreinhal.zerag.rag.hyde;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.util.LogSanitizer;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * HyDE retrieval: generate a passage that would answer the question, then search with its
 * embedding. Any failure yields no candidates.
 */
@Service
public class HydeService {

    private static final Logger log = LoggerFactory.getLogger(HydeService.class);

    private final GenerationService generationService;
    private final ChunkVectorStore vectorStore;

    public HydeService(GenerationService generationService, ChunkVectorStore vectorStore) {
        this.generationService = generationService;
        this.vectorStore = vectorStore;
    }

    public HydeResult retrieve(String question, String hint, String dataSourceId, int limit) {
        long start = System.currentTimeMillis();
        try {
            String hypothetical = this.generationService.hypotheticalPassage(question, hint);
            if (hypothetical.isBlank()) {
                log.warn("HyDE produced an empty passage for '{}' on {}", LogSanitizer.prefix(question), dataSourceId);
                return HydeResult.empty();
            }
            List<RetrievedChunk> hits = this.vectorStore.searchText(hypothetical, dataSourceId, limit).stream()
                    .map(hit -> hit.withSource(RetrievalSource.HYDE))
                    .toList();
            if (log.isDebugEnabled()) {
                log.debug("HyDE: {} hits on {} ({}ms)", hits.size(), dataSourceId, System.currentTimeMillis() - start);
            }
            return new HydeResult(hits, hypothetical);
        }
        catch (RuntimeException e) {
            log.warn("HyDE step failed for '{}' on {}: {}", LogSanitizer.prefix(question), dataSourceId, e.getMessage());
            return HydeResult.empty();
        }
    }

    public record HydeResult(List<RetrievedChunk> chunks, String hypotheticalDocument) {

        public static HydeResult empty() {
            return new HydeResult(List.of(), null);
        }

        public boolean applied() {
            return this.hypotheticalDocument != null;
        }
    }
}
