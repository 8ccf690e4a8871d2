package com.jreinhal.zerag.rag.rerank;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.exception.RerankerException;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.generation.ScriptedChatModel;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrossEncoderRerankerTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void llmScoresReorderAndTruncate() {
        ScriptedChatModel model = new ScriptedChatModel(prompt -> {
            if (prompt.contains("budget table")) {
                return "0.9";
            }
            if (prompt.contains("lunch menu")) {
                return "Score: 0.1";
            }
            return "0.5";
        });
        CrossEncoderReranker reranker = newReranker(model, "llm");

        List<RetrievedChunk> result = reranker.rerank("2024 budget?", List.of(
                chunk("a", "lunch menu"), chunk("b", "budget table"), chunk("c", "misc notes")), 2);

        assertEquals(List.of("b", "c"), result.stream().map(RetrievedChunk::chunkId).toList());
        assertEquals(0.9, result.get(0).rerankScore(), 1e-9);
    }

    @Test
    void modelFailureSurfacesAsRerankerException() {
        ScriptedChatModel model = new ScriptedChatModel(prompt -> {
            throw new IllegalStateException("model down");
        });
        CrossEncoderReranker reranker = newReranker(model, "llm");

        assertThrows(RerankerException.class, () -> reranker.rerank("q", List.of(chunk("a", "x")), 1));
    }

    @Test
    void dedicatedModeWithoutEndpointFails() {
        CrossEncoderReranker reranker = newReranker(new ScriptedChatModel(prompt -> "0.5"), "dedicated");

        assertThrows(RerankerException.class, () -> reranker.rerank("q", List.of(chunk("a", "x")), 1));
    }

    @Test
    void poolSizeFollowsMultiplier() {
        CrossEncoderReranker reranker = newReranker(new ScriptedChatModel(prompt -> "0.5"), "llm");
        assertEquals(15, reranker.candidatePoolSize(5));

        ReflectionTestUtils.setField(reranker, "enabled", false);
        assertEquals(5, reranker.candidatePoolSize(5));
    }

    @Test
    void scoreParsing() {
        assertEquals(0.75, CrossEncoderReranker.parseScore("0.75"), 1e-9);
        assertEquals(1.0, CrossEncoderReranker.parseScore("1.0 - highly relevant"), 1e-9);
        assertEquals(0.5, CrossEncoderReranker.parseScore("no idea"), 1e-9);
        assertEquals(0.5, CrossEncoderReranker.parseScore(null), 1e-9);
    }

    private CrossEncoderReranker newReranker(ScriptedChatModel model, String mode) {
        GenerationService generation = new GenerationService(ChatClient.builder(model), new ObjectMapper());
        CrossEncoderReranker reranker = new CrossEncoderReranker(generation, executor);
        ReflectionTestUtils.setField(reranker, "mode", mode);
        ReflectionTestUtils.setField(reranker, "timeoutSeconds", 5);
        reranker.init();
        return reranker;
    }

    private static RetrievedChunk chunk(String id, String text) {
        return new RetrievedChunk(id, "ds-1", "t", id, text, 0.5, RetrievalSource.VECTOR, null, null);
    }
}
