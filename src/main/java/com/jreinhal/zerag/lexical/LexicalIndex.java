package com.jreinhal.zerag.lexical;

import com.jreinhal.zerag.model.DocumentChunk;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;

/**
 * Immutable in-memory BM25 index over one data source's chunks at build time.
 * Heap-backed, so it is released with the object; searches are thread-safe.
 */
final class LexicalIndex {

    static final String FIELD_CONTENT = "content";
    private static final String FIELD_POSITION = "pos";

    private final List<DocumentChunk> chunks;
    private final IndexSearcher searcher;

    private LexicalIndex(List<DocumentChunk> chunks, IndexSearcher searcher) {
        this.chunks = chunks;
        this.searcher = searcher;
    }

    static LexicalIndex build(List<DocumentChunk> chunks, Analyzer analyzer) {
        List<DocumentChunk> snapshot = List.copyOf(chunks);
        if (snapshot.isEmpty()) {
            return new LexicalIndex(snapshot, null);
        }
        try {
            ByteBuffersDirectory directory = new ByteBuffersDirectory();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setSimilarity(new BM25Similarity());
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            try (IndexWriter writer = new IndexWriter(directory, config)) {
                for (int i = 0; i < snapshot.size(); i++) {
                    String text = snapshot.get(i).getText();
                    Document doc = new Document();
                    doc.add(new StoredField(FIELD_POSITION, i));
                    doc.add(new TextField(FIELD_CONTENT, text != null ? text : "", Field.Store.NO));
                    writer.addDocument(doc);
                }
                writer.commit();
            }
            IndexSearcher searcher = new IndexSearcher(DirectoryReader.open(directory));
            searcher.setSimilarity(new BM25Similarity());
            return new LexicalIndex(snapshot, searcher);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Lexical index build failed", e);
        }
    }

    int size() {
        return this.chunks.size();
    }

    /**
     * Scores every chunk against the tokens and returns the positive hits, best first.
     * Equal scores keep chunk order.
     */
    List<Hit> search(List<String> queryTokens, int limit) {
        if (this.searcher == null || queryTokens.isEmpty() || limit <= 0) {
            return List.of();
        }
        BooleanQuery.Builder query = new BooleanQuery.Builder();
        int clauses = 0;
        for (String token : new LinkedHashSet<>(queryTokens)) {
            if (clauses >= IndexSearcher.getMaxClauseCount()) {
                break;
            }
            query.add(new TermQuery(new Term(FIELD_CONTENT, token)), BooleanClause.Occur.SHOULD);
            clauses++;
        }
        try {
            TopDocs top = this.searcher.search(query.build(), Math.min(limit, this.chunks.size()));
            List<Hit> hits = new ArrayList<>(top.scoreDocs.length);
            for (ScoreDoc scoreDoc : top.scoreDocs) {
                if (scoreDoc.score <= 0f) {
                    break;
                }
                int position = this.searcher.storedFields().document(scoreDoc.doc)
                        .getField(FIELD_POSITION).numericValue().intValue();
                hits.add(new Hit(this.chunks.get(position), scoreDoc.score));
            }
            return hits;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Lexical search failed", e);
        }
    }

    record Hit(DocumentChunk chunk, double score) {
    }
}
