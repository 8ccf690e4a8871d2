package com.jreinhal.zerag.rag.expansion;

import java.util.ArrayList;
import java.util.List;

/**
 * Keywords for lexical search, paraphrase variants for extra vector searches, and a
 * one-line hint describing what a matching record would look like.
 */
public record QueryExpansion(List<String> keywords, List<String> queries, String hydeHint) {

    public QueryExpansion {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        queries = queries != null ? List.copyOf(queries) : List.of();
    }

    /**
     * The no-op expansion: the question stands in for every part.
     */
    public static QueryExpansion identity(String question) {
        return new QueryExpansion(List.of(question), List.of(question), question);
    }

    /**
     * Up to {@code max} variants, skipping any that repeat the question.
     */
    public List<String> variants(String question, int max) {
        List<String> variants = new ArrayList<>();
        for (String query : this.queries.subList(0, Math.min(max, this.queries.size()))) {
            if (query != null && !query.isBlank() && !query.equals(question)) {
                variants.add(query);
            }
        }
        return variants;
    }

    public String lexicalQuery() {
        return String.join(" ", this.keywords);
    }
}
