package com.jreinhal.zerag.service;

import com.jreinhal.zerag.cache.ResultCache;
import com.jreinhal.zerag.dto.AnswerEvent;
import com.jreinhal.zerag.dto.AnswerResult;
import com.jreinhal.zerag.dto.AskRequest;
import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.exception.DataSourceNotFoundException;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.QaRecord;
import com.jreinhal.zerag.rag.expansion.QueryExpander;
import com.jreinhal.zerag.rag.expansion.QueryExpansion;
import com.jreinhal.zerag.rag.fallback.StructuredQueryFallback;
import com.jreinhal.zerag.rag.fusion.RetrievalFusionService;
import com.jreinhal.zerag.reasoning.ReasoningStep.StepType;
import com.jreinhal.zerag.reasoning.ReasoningTrace;
import com.jreinhal.zerag.repository.DataSourceRepository;
import com.jreinhal.zerag.repository.QaRecordRepository;
import com.jreinhal.zerag.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Answers questions over the indexed data sources.
 *
 * <p>Pipeline: result cache, query expansion, fused retrieval (vector, HyDE, lexical, rerank),
 * structured-query fallback on weak database retrieval, then generation over the assembled
 * context. Every answered question leaves an audit {@link QaRecord}.</p>
 *
 * <p>Requests with conversation history never read or fill the result cache.</p>
 */
@Service
public class AnswerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnswerOrchestrator.class);

    static final String SYSTEM_PROMPT = """
            You are a knowledge assistant answering from the reference material supplied with each question.
            Rules:
            1. Answer only from the reference material. Do not invent facts, figures or names.
            2. If the material does not contain the answer, say that you could not find it.
            3. When citing, name the passage number, for example [passage 2].
            4. Keep the answer concise and answer in the language of the question.""";

    private final QueryExpander queryExpander;
    private final RetrievalFusionService fusionService;
    private final StructuredQueryFallback structuredFallback;
    private final GenerationService generationService;
    private final ContextBuilder contextBuilder;
    private final ResultCache resultCache;
    private final DataSourceRepository dataSourceRepository;
    private final QaRecordRepository qaRecordRepository;

    @Value("${zerag.conversation.max-turns:10}")
    private int maxHistoryTurns = 10;

    public AnswerOrchestrator(QueryExpander queryExpander, RetrievalFusionService fusionService,
                              StructuredQueryFallback structuredFallback, GenerationService generationService,
                              ContextBuilder contextBuilder, ResultCache resultCache,
                              DataSourceRepository dataSourceRepository, QaRecordRepository qaRecordRepository) {
        this.queryExpander = queryExpander;
        this.fusionService = fusionService;
        this.structuredFallback = structuredFallback;
        this.generationService = generationService;
        this.contextBuilder = contextBuilder;
        this.resultCache = resultCache;
        this.dataSourceRepository = dataSourceRepository;
        this.qaRecordRepository = qaRecordRepository;
    }

    @PostConstruct
    public void init() {
        log.info("Answer orchestrator initialized (historyTurns={})", this.maxHistoryTurns);
    }

    public AnswerResult ask(AskRequest request, String userId) {
        String question = requireQuestion(request);
        int topK = request.effectiveTopK();
        String cacheKey = request.hasHistory() ? null : this.resultCache.keyFor(question, request.dataSourceId(), topK);
        if (cacheKey != null) {
            Optional<AnswerResult> cached = this.resultCache.get(cacheKey);
            if (cached.isPresent()) {
                log.info("Result cache hit for {} on {}", LogSanitizer.querySummary(question), request.dataSourceId());
                this.record(userId, cached.get(), request, true);
                return cached.get();
            }
        }

        long start = System.currentTimeMillis();
        PreparedAnswer prepared = this.prepare(request, question, topK);
        String answer = prepared.trace().timed(StepType.GENERATION, "Generate answer",
                () -> this.generationService.complete(SYSTEM_PROMPT, prepared.messages()));
        AnswerResult result = prepared.toResult(question, answer);
        this.record(userId, result, request, false);
        this.resultCache.put(cacheKey, result);
        log.info("Answered {} on {} with {} passages in {}ms ({})", LogSanitizer.querySummary(question),
                request.dataSourceId(), result.chunks().size(), System.currentTimeMillis() - start,
                prepared.trace().getSummary());
        return result;
    }

    /**
     * Streams {@code retrieval_done}, the answer tokens, then {@code done}. Any failure becomes a
     * terminal {@code error} event. Cancelling the subscription cancels the model stream.
     */
    public Flux<AnswerEvent> askStream(AskRequest request, String userId) {
        return Mono.fromCallable(() -> {
                    String question = requireQuestion(request);
                    int topK = request.effectiveTopK();
                    String cacheKey = request.hasHistory()
                            ? null : this.resultCache.keyFor(question, request.dataSourceId(), topK);
                    Optional<AnswerResult> cached = this.resultCache.get(cacheKey);
                    if (cached.isPresent()) {
                        return new StreamPlan(question, cacheKey, null, cached.get());
                    }
                    return new StreamPlan(question, cacheKey, this.prepare(request, question, topK), null);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(plan -> plan.cached() != null
                        ? this.replayCached(plan.cached(), request, userId)
                        : this.streamAnswer(plan, request, userId))
                .onErrorResume(e -> {
                    log.error("Streaming answer failed on data source {}: {}", request.dataSourceId(), e.getMessage());
                    return Flux.just(AnswerEvent.error(errorMessage(e)));
                });
    }

    private Flux<AnswerEvent> streamAnswer(StreamPlan plan, AskRequest request, String userId) {
        PreparedAnswer prepared = plan.prepared();
        StringBuilder answer = new StringBuilder();
        long start = System.currentTimeMillis();
        Flux<AnswerEvent> tokens = this.generationService.completeStream(SYSTEM_PROMPT, prepared.messages())
                .filter(token -> token != null && !token.isEmpty())
                .doOnNext(answer::append)
                .map(AnswerEvent::token)
                .doOnCancel(() -> log.info("Answer stream cancelled by client for {}", LogSanitizer.querySummary(plan.question())));
        Mono<AnswerEvent> done = Mono.fromCallable(() -> {
            prepared.trace().addStep(StepType.GENERATION, "Generate answer (stream)", null, System.currentTimeMillis() - start);
            AnswerResult result = prepared.toResult(plan.question(), answer.toString());
            this.record(userId, result, request, false);
            this.resultCache.put(plan.cacheKey(), result);
            return AnswerEvent.done(result.answer());
        });
        return Flux.concat(
                Mono.just(AnswerEvent.retrievalDone(prepared.chunks(), prepared.trace().getStepsAsMaps())),
                tokens,
                done);
    }

    private Flux<AnswerEvent> replayCached(AnswerResult cached, AskRequest request, String userId) {
        return Flux.defer(() -> {
            this.record(userId, cached, request, true);
            return Flux.just(
                    AnswerEvent.retrievalDone(cached.chunks(), cached.trace()),
                    AnswerEvent.token(cached.answer()),
                    AnswerEvent.done(cached.answer()));
        });
    }

    private PreparedAnswer prepare(AskRequest request, String question, int topK) {
        DataSource source = null;
        if (request.dataSourceId() != null) {
            source = this.dataSourceRepository.findById(request.dataSourceId())
                    .orElseThrow(() -> new DataSourceNotFoundException(request.dataSourceId()));
        }
        ReasoningTrace trace = new ReasoningTrace(request.dataSourceId());

        QueryExpansion expansion;
        if (request.rewriteEnabled()) {
            long start = System.currentTimeMillis();
            expansion = this.queryExpander.expand(question);
            trace.addStep(StepType.QUERY_EXPANSION, "Query expansion", expansion.queries().size() + " variants",
                    System.currentTimeMillis() - start, Map.of("keywords", expansion.keywords()));
        }
        else {
            expansion = QueryExpansion.identity(question);
        }

        RetrievalFusionService.FusionResult fusion = this.fusionService.retrieve(question, expansion,
                request.dataSourceId(), topK, request.hydeEnabled(), trace);

        List<Map<String, Object>> fallbackRows = List.of();
        if (request.structuredFallbackEnabled()
                && this.structuredFallback.shouldTrigger(source, fusion.lexicalHitCount(), fusion.maxVectorSimilarity())) {
            long start = System.currentTimeMillis();
            fallbackRows = this.structuredFallback.run(question, source);
            trace.addStep(StepType.STRUCTURED_FALLBACK, "Structured query fallback", fallbackRows.size() + " rows",
                    System.currentTimeMillis() - start);
        }

        String context = this.contextBuilder.build(fusion.chunks(), fallbackRows);
        List<Message> messages = ConversationHistory.toMessages(request.safeHistory(), this.maxHistoryTurns);
        messages.add(new UserMessage("Reference material:\n" + context + "\n\nQuestion: " + question));
        return new PreparedAnswer(request.dataSourceId(), fusion.chunks(), !fallbackRows.isEmpty(), trace, messages);
    }

    private void record(String userId, AnswerResult result, AskRequest request, boolean cached) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("topK", request.effectiveTopK());
        settings.put("rewrite", request.rewriteEnabled());
        settings.put("hyde", request.hydeEnabled());
        settings.put("structuredFallback", request.structuredFallbackEnabled());
        settings.put("structuredFallbackUsed", result.structuredFallbackUsed());
        settings.put("cached", cached);
        QaRecord qaRecord = QaRecord.create(userId, result.question(), result.answer(), result.dataSourceId(),
                QaRecord.MODE_RAG, result.chunks().stream().map(RetrievedChunk::toAuditMap).toList(), result.trace(),
                settings);
        try {
            this.qaRecordRepository.save(qaRecord);
        }
        catch (RuntimeException e) {
            log.error("Could not store QA record for {} on {}: {}", LogSanitizer.querySummary(result.question()),
                    result.dataSourceId(), e.getMessage());
        }
    }

    static String requireQuestion(AskRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        return request.question().strip();
    }

    static String errorMessage(Throwable e) {
        if (e instanceof DataSourceNotFoundException || e instanceof IllegalArgumentException) {
            return e.getMessage();
        }
        return "Answer generation failed";
    }

    private record StreamPlan(String question, String cacheKey, PreparedAnswer prepared, AnswerResult cached) {
    }

    private record PreparedAnswer(String dataSourceId, List<RetrievedChunk> chunks, boolean structuredFallbackUsed,
                                  ReasoningTrace trace, List<Message> messages) {

        AnswerResult toResult(String question, String answer) {
            return new AnswerResult(question, answer, this.chunks, this.dataSourceId, this.trace.getStepsAsMaps(),
                    this.structuredFallbackUsed);
        }
    }
}
