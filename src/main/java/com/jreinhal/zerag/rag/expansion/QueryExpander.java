package com.jreinhal.zerag.rag.expansion;

import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rewrites a question into keywords, paraphrases and a HyDE hint. Never throws: any failure
 * yields {@link QueryExpansion#identity(String)}.
 */
@Component
public class QueryExpander {

    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

    private final GenerationService generationService;

    public QueryExpander(GenerationService generationService) {
        this.generationService = generationService;
    }

    public QueryExpansion expand(String question) {
        if (question == null || question.isBlank()) {
            return QueryExpansion.identity(question == null ? "" : question);
        }
        try {
            QueryExpansion expansion = this.generationService.expandQuery(question);
            if (log.isDebugEnabled()) {
                log.debug("Expanded {} into {} keywords, {} variants", LogSanitizer.querySummary(question),
                        expansion.keywords().size(), expansion.queries().size());
            }
            return expansion;
        }
        catch (RuntimeException e) {
            log.warn("Query expansion failed for '{}', using original question: {}", LogSanitizer.prefix(question), e.getMessage());
            return QueryExpansion.identity(question);
        }
    }
}
