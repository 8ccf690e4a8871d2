package com.jreinhal.zerag.rag.rerank;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.exception.RerankerException;
import com.jreinhal.zerag.generation.GenerationService;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Scores (question, passage) pairs jointly. Two backends: the chat model rating each pair
 * ({@code llm}, fanned out on the reranker pool) or a dedicated cross-encoder served over HTTP
 * ({@code dedicated}). Any failure is thrown as {@link RerankerException}; the caller keeps
 * its own order in that case.
 */
@Component
public class CrossEncoderReranker {

    private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);
    private static final Pattern SCORE_PATTERN = Pattern.compile("(1(?:\\.0+)?|0(?:\\.\\d+)?)");
    private static final int MAX_PASSAGE_CHARS = 1000;

    private final GenerationService generationService;
    private final ExecutorService executor;

    @Value("${zerag.reranker.enabled:true}")
    private boolean enabled = true;

    @Value("${zerag.reranker.candidate-multiplier:3}")
    private int candidateMultiplier = 3;

    @Value("${zerag.reranker.mode:llm}")
    private String mode = "llm";

    @Value("${zerag.reranker.endpoint:}")
    private String endpoint = "";

    @Value("${zerag.reranker.timeout-seconds:30}")
    private int timeoutSeconds = 30;

    @Value("${zerag.reranker.batch-size:5}")
    private int batchSize = 5;

    private RestTemplate restTemplate;

    public CrossEncoderReranker(GenerationService generationService,
                                @Qualifier("rerankExecutor") ExecutorService executor) {
        this.generationService = generationService;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(this.timeoutSeconds * 1000);
        factory.setReadTimeout(this.timeoutSeconds * 1000);
        this.restTemplate = new RestTemplate(factory);
        if (this.resolveMode() == Mode.DEDICATED && (this.endpoint == null || this.endpoint.isBlank())) {
            log.warn("Reranker mode 'dedicated' has no endpoint configured; every rerank will fail over to fusion order");
        }
        log.info("Cross-encoder reranker initialized (enabled={}, mode={}, multiplier={}, batchSize={})",
                this.enabled, this.resolveMode(), this.candidateMultiplier, this.batchSize);
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    /**
     * How many fused candidates to collect for a final {@code topK}.
     */
    public int candidatePoolSize(int topK) {
        return this.enabled ? topK * Math.max(1, this.candidateMultiplier) : topK;
    }

    /**
     * Attaches a rerank score to every candidate, sorts by it (stable on ties) and keeps
     * the first {@code topK}.
     */
    public List<RetrievedChunk> rerank(String question, List<RetrievedChunk> candidates, int topK) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        List<String> passages = candidates.stream().map(c -> truncate(c.text())).toList();
        List<Double> scores = this.resolveMode() == Mode.DEDICATED
                ? this.scoreWithEndpoint(question, passages)
                : this.scoreWithLlm(question, passages);
        if (scores.size() != candidates.size()) {
            throw new RerankerException("Reranker returned " + scores.size() + " scores for " + candidates.size() + " passages");
        }
        List<RetrievedChunk> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(candidates.get(i).withRerankScore(scores.get(i)));
        }
        List<RetrievedChunk> top = scored.stream()
                .sorted(Comparator.comparingDouble(RetrievedChunk::rerankScore).reversed())
                .limit(topK)
                .toList();
        if (log.isDebugEnabled()) {
            log.debug("Reranked {} candidates to {} in {}ms", candidates.size(), top.size(), System.currentTimeMillis() - start);
        }
        return top;
    }

    private List<Double> scoreWithLlm(String question, List<String> passages) {
        List<Double> scores = new ArrayList<>(passages.size());
        int size = Math.max(1, this.batchSize);
        for (int i = 0; i < passages.size(); i += size) {
            List<Future<Double>> futures = new ArrayList<>();
            try {
                for (String passage : passages.subList(i, Math.min(i + size, passages.size()))) {
                    futures.add(this.executor.submit(() -> this.scorePair(question, passage)));
                }
                for (Future<Double> future : futures) {
                    scores.add(future.get(this.timeoutSeconds, TimeUnit.SECONDS));
                }
            }
            catch (RejectedExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                throw new RerankerException("Reranker pool overloaded", e);
            }
            catch (TimeoutException e) {
                futures.forEach(f -> f.cancel(true));
                throw new RerankerException("Reranker scoring timed out after " + this.timeoutSeconds + "s", e);
            }
            catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                throw new RerankerException("Reranker scoring failed: " + e.getCause().getMessage(), e.getCause());
            }
            catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new RerankerException("Reranker interrupted", e);
            }
        }
        return scores;
    }

    private double scorePair(String question, String passage) {
        String prompt = String.format("Rate the relevance of this passage to the question on a scale of 0.0 to 1.0.%n%n"
                + "QUESTION: %s%n%nPASSAGE:%n%s%n%n"
                + "Respond with ONLY a number between 0.0 and 1.0, nothing else.%n"
                + "0.0 = completely irrelevant%n0.5 = somewhat relevant%n1.0 = highly relevant%n%nScore:", question, passage);
        return parseScore(this.generationService.generate(prompt));
    }

    private List<Double> scoreWithEndpoint(String question, List<String> passages) {
        if (this.endpoint == null || this.endpoint.isBlank()) {
            throw new RerankerException("No reranker endpoint configured");
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("query", question);
        request.put("documents", passages);
        JsonNode response;
        try {
            response = this.restTemplate.postForObject(this.endpoint, request, JsonNode.class);
        }
        catch (RestClientException e) {
            throw new RerankerException("Reranker endpoint call failed: " + e.getMessage(), e);
        }
        JsonNode scoresNode = response != null && response.isObject() ? response.get("scores") : response;
        if (scoresNode == null || !scoresNode.isArray()) {
            throw new RerankerException("Reranker endpoint returned no score list");
        }
        List<Double> scores = new ArrayList<>(scoresNode.size());
        for (JsonNode node : scoresNode) {
            if (!node.isNumber()) {
                throw new RerankerException("Reranker endpoint returned a non-numeric score");
            }
            scores.add(node.asDouble());
        }
        return scores;
    }

    /**
     * First number in [0, 1] found in the reply; 0.5 when there is none.
     */
    static double parseScore(String response) {
        if (response == null || response.isBlank()) {
            return 0.5;
        }
        Matcher matcher = SCORE_PATTERN.matcher(response.trim());
        if (matcher.find()) {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(matcher.group(1))));
        }
        return 0.5;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_PASSAGE_CHARS ? text.substring(0, MAX_PASSAGE_CHARS) + "..." : text;
    }

    private Mode resolveMode() {
        String value = this.mode != null ? this.mode.trim().toUpperCase(Locale.ROOT) : "";
        return "DEDICATED".equals(value) ? Mode.DEDICATED : Mode.LLM;
    }

    private enum Mode {
        LLM,
        DEDICATED
    }
}
