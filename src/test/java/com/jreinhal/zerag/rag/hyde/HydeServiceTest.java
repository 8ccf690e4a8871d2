package com.jreinhal.zerag.rag.hyde;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HydeServiceTest {

    private final GenerationService generationService = mock(GenerationService.class);
    private final ChunkVectorStore vectorStore = mock(ChunkVectorStore.class);
    private final HydeService hydeService = new HydeService(generationService, vectorStore);

    @Test
    void searchesWithHypotheticalPassageAndTagsHits() {
        when(generationService.hypotheticalPassage("q", "hint")).thenReturn("a record describing q");
        when(vectorStore.searchText("a record describing q", "ds-1", 6))
                .thenReturn(List.of(RetrievedChunk.vector("c1", "ds-1", "t", "1", "text", 0.7)));

        HydeService.HydeResult result = hydeService.retrieve("q", "hint", "ds-1", 6);

        assertTrue(result.applied());
        assertEquals(RetrievalSource.HYDE, result.chunks().get(0).source());
    }

    @Test
    void generationFailureYieldsNothing() {
        when(generationService.hypotheticalPassage("q", "hint")).thenThrow(new IllegalStateException("timeout"));

        HydeService.HydeResult result = hydeService.retrieve("q", "hint", "ds-1", 6);

        assertFalse(result.applied());
        assertTrue(result.chunks().isEmpty());
        verify(vectorStore, never()).searchText(anyString(), anyString(), anyInt());
    }
}
