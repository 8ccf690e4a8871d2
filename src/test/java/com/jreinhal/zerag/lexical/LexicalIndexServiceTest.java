package com.jreinhal.zerag.lexical;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.model.DocumentChunk;
import com.jreinhal.zerag.repository.DocumentChunkRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LexicalIndexServiceTest {

    private DocumentChunkRepository chunkRepository;
    private MongoTemplate mongoTemplate;
    private LexicalAnalyzerProvider analyzerProvider;
    private LexicalIndexService service;

    @BeforeEach
    void setUp() {
        chunkRepository = mock(DocumentChunkRepository.class);
        mongoTemplate = mock(MongoTemplate.class);
        analyzerProvider = new LexicalAnalyzerProvider();
        analyzerProvider.init();
        service = new LexicalIndexService(chunkRepository, mongoTemplate, analyzerProvider);
    }

    @Test
    void bestMatchIsNormalizedToCeiling() {
        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(List.of(
                chunk("c1", "quarterly revenue report for the north region"),
                chunk("c2", "employee handbook and vacation policy"),
                chunk("c3", "revenue revenue revenue growth")));

        List<RetrievedChunk> results = service.search("revenue", "ds-1", 5);

        assertEquals(2, results.size());
        assertEquals("c3", results.get(0).chunkId());
        assertEquals(0.99, results.get(0).similarity(), 1e-6);
        assertTrue(results.get(1).similarity() < 0.99);
        assertTrue(results.get(1).similarity() > 0.0);
        results.forEach(r -> {
            assertEquals(RetrievalSource.BM25, r.source());
            assertNotNull(r.bm25Score());
        });
    }

    @Test
    void resultCountIsCappedAtTwiceTopK() {
        List<DocumentChunk> chunks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            chunks.add(chunk("c" + i, "invoice number " + i + " for invoice totals"));
        }
        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(chunks);

        assertEquals(4, service.search("invoice", "ds-1", 2).size());
    }

    @Test
    void blankQueryNeverBuildsIndex() {
        assertTrue(service.search("   ", "ds-1", 5).isEmpty());
        verifyNoInteractions(chunkRepository);
    }

    @Test
    void unscopedSearchReturnsNothing() {
        assertTrue(service.search("revenue", null, 5).isEmpty());
        verifyNoInteractions(chunkRepository);
    }

    @Test
    void indexIsBuiltOnceAndRebuiltAfterInvalidate() {
        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(List.of(chunk("c1", "alpha beta")));

        service.search("alpha", "ds-1", 5);
        service.search("beta", "ds-1", 5);
        assertTrue(service.isIndexed("ds-1"));
        verify(chunkRepository, times(1)).findByDataSourceId("ds-1");

        service.invalidate("ds-1");
        assertFalse(service.isIndexed("ds-1"));

        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(List.of(chunk("c2", "gamma delta")));
        List<RetrievedChunk> results = service.search("gamma", "ds-1", 5);

        assertEquals(1, results.size());
        assertEquals("c2", results.get(0).chunkId());
        verify(chunkRepository, times(2)).findByDataSourceId("ds-1");
    }

    @Test
    void invalidationDuringBuildKeepsStaleIndexOut() {
        when(chunkRepository.findByDataSourceId("ds-1")).thenAnswer(invocation -> {
            service.invalidate("ds-1");
            return List.of(chunk("c1", "stale content"));
        });

        List<RetrievedChunk> results = service.search("stale", "ds-1", 5);

        assertEquals(1, results.size());
        assertFalse(service.isIndexed("ds-1"));
    }

    @Test
    void emptySourceYieldsNoHits() {
        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(List.of());
        assertTrue(service.search("anything", "ds-1", 5).isEmpty());
    }

    @Test
    void bigramModeMatchesChineseSubstrings() {
        ReflectionTestUtils.setField(analyzerProvider, "smartcnEnabled", false);
        analyzerProvider.init();
        assertEquals(LexicalAnalyzerProvider.Mode.BIGRAM, analyzerProvider.mode());
        when(chunkRepository.findByDataSourceId("ds-1")).thenReturn(List.of(
                chunk("c1", "上海分公司的销售额持续增长"),
                chunk("c2", "北京的天气很好")));

        List<RetrievedChunk> results = service.search("销售额", "ds-1", 5);

        assertEquals(1, results.size());
        assertEquals("c1", results.get(0).chunkId());
    }

    @Test
    void substringSearchTagsKeywordHits() {
        DocumentChunk hit = chunk("c9", "Contains the Revenue figure");
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class))).thenReturn(List.of(hit));

        List<RetrievedChunk> results = service.substringSearch(List.of("revenue", " "), null, 10);

        assertEquals(1, results.size());
        assertEquals(RetrievalSource.KEYWORD, results.get(0).source());
        assertEquals(0.99, results.get(0).similarity(), 1e-9);
    }

    @Test
    void substringSearchWithoutKeywordsSkipsQuery() {
        assertTrue(service.substringSearch(List.of(), "ds-1", 10).isEmpty());
        verify(mongoTemplate, never()).find(any(Query.class), eq(DocumentChunk.class));
    }

    private static DocumentChunk chunk(String id, String text) {
        DocumentChunk chunk = new DocumentChunk("ds-1", "notes.txt", id, 0, text, Map.of());
        chunk.setId(id);
        return chunk;
    }
}
