package com.jreinhal.zerag.vector;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.model.ChunkVector;
import com.jreinhal.zerag.model.DocumentChunk;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChunkVectorStoreTest {

    private MongoTemplate mongoTemplate;
    private EmbeddingService embeddingService;
    private ChunkVectorStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        embeddingService = mock(EmbeddingService.class);
        store = new ChunkVectorStore(mongoTemplate, embeddingService);
    }

    @Test
    void emptyScopeReturnsNoCandidates() {
        when(mongoTemplate.find(any(Query.class), eq(ChunkVector.class))).thenReturn(List.of());

        List<RetrievedChunk> results = store.search(new float[]{1f, 0f}, "ds-1", 5);

        assertTrue(results.isEmpty());
        verify(mongoTemplate, never()).find(any(Query.class), eq(DocumentChunk.class), anyString());
    }

    @Test
    void ranksByCosineAndScopesToDataSource() {
        ChunkVector close = vector("c1", List.of(1.0, 0.0));
        ChunkVector far = vector("c2", List.of(0.0, 1.0));
        ChunkVector mid = vector("c3", List.of(1.0, 1.0));
        when(mongoTemplate.find(any(Query.class), eq(ChunkVector.class))).thenReturn(List.of(far, close, mid));
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), eq("document_chunks")))
                .thenReturn(List.of(chunk("c1"), chunk("c3")));

        List<RetrievedChunk> results = store.search(new float[]{1f, 0f}, "ds-1", 2);

        assertEquals(2, results.size());
        assertEquals("c1", results.get(0).chunkId());
        assertEquals(1.0, results.get(0).similarity(), 1e-9);
        assertEquals("c3", results.get(1).chunkId());
        assertEquals(Math.sqrt(0.5), results.get(1).similarity(), 1e-9);
        assertEquals(RetrievalSource.VECTOR, results.get(0).source());

        ArgumentCaptor<Query> scope = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(scope.capture(), eq(ChunkVector.class));
        assertEquals("ds-1", scope.getValue().getQueryObject().get("dataSourceId"));
    }

    @Test
    void globalSearchHasNoScopeFilter() {
        when(mongoTemplate.find(any(Query.class), eq(ChunkVector.class))).thenReturn(List.of());

        store.search(new float[]{1f}, null, 3);

        ArgumentCaptor<Query> scope = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(scope.capture(), eq(ChunkVector.class));
        assertTrue(scope.getValue().getQueryObject().isEmpty());
    }

    @Test
    void negativeCosineIsClampedToZero() {
        double score = ChunkVectorStore.cosineSimilarity(new float[]{1f, 0f}, 1.0, List.of(-1.0, 0.0), 1.0);

        assertEquals(0.0, score, 1e-9);
    }

    @Test
    void dimensionMismatchScoresZero() {
        assertEquals(0.0, ChunkVectorStore.cosineSimilarity(new float[]{1f, 0f}, 1.0, List.of(1.0), 1.0), 1e-9);
    }

    @Test
    void vectorsWhoseChunkVanishedAreSkipped() {
        when(mongoTemplate.find(any(Query.class), eq(ChunkVector.class))).thenReturn(List.of(vector("gone", List.of(1.0))));
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), eq("document_chunks"))).thenReturn(List.of());

        assertTrue(store.search(new float[]{1f}, "ds-1", 5).isEmpty());
    }

    @Test
    void saveVectorsRejectsCountMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> store.saveVectors(List.of(chunk("c1")), List.of()));
    }

    @Test
    void searchTextEmbedsThroughService() {
        when(embeddingService.embedQuery("hello")).thenReturn(new float[]{1f});
        when(mongoTemplate.find(any(Query.class), eq(ChunkVector.class))).thenReturn(List.of());

        store.searchText("hello", "ds-1", 3);

        verify(embeddingService).embedQuery("hello");
    }

    private static ChunkVector vector(String chunkId, List<Double> embedding) {
        return new ChunkVector(chunkId, "ds-1", embedding, ChunkVectorStore.computeNorm(embedding));
    }

    private static DocumentChunk chunk(String id) {
        DocumentChunk chunk = new DocumentChunk("ds-1", "users", "1", 0, "text " + id, Map.of());
        chunk.setId(id);
        return chunk;
    }
}
