package com.jreinhal.zerag.service;

import com.jreinhal.zerag.dto.AnswerEvent;
import com.jreinhal.zerag.dto.AnswerResult;
import com.jreinhal.zerag.dto.AskRequest;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.model.QaRecord;
import com.jreinhal.zerag.repository.QaRecordRepository;
import com.jreinhal.zerag.util.LogSanitizer;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Plain conversation with the model, no retrieval.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    static final String SYSTEM_PROMPT = """
            You are a friendly, knowledgeable assistant. Answer clearly and concisely, \
            in the language the user writes in. If you are unsure, say so.""";

    private final GenerationService generationService;
    private final QaRecordRepository qaRecordRepository;

    @Value("${zerag.chat.max-turns:20}")
    private int maxHistoryTurns = 20;

    public ChatService(GenerationService generationService, QaRecordRepository qaRecordRepository) {
        this.generationService = generationService;
        this.qaRecordRepository = qaRecordRepository;
    }

    public AnswerResult chat(AskRequest request, String userId) {
        String question = AnswerOrchestrator.requireQuestion(request);
        String answer = this.generationService.complete(SYSTEM_PROMPT, this.messages(request, question));
        this.record(userId, question, answer);
        return new AnswerResult(question, answer, List.of(), null, List.of(), false);
    }

    /**
     * Same event sequence as retrieval answers; {@code retrieval_done} carries nothing.
     */
    public Flux<AnswerEvent> chatStream(AskRequest request, String userId) {
        return Flux.defer(() -> {
                    String question = AnswerOrchestrator.requireQuestion(request);
                    StringBuilder answer = new StringBuilder();
                    Flux<AnswerEvent> tokens = this.generationService.completeStream(SYSTEM_PROMPT, this.messages(request, question))
                            .filter(token -> token != null && !token.isEmpty())
                            .doOnNext(answer::append)
                            .map(AnswerEvent::token);
                    Mono<AnswerEvent> done = Mono.fromCallable(() -> {
                        this.record(userId, question, answer.toString());
                        return AnswerEvent.done(answer.toString());
                    });
                    return Flux.concat(Mono.just(AnswerEvent.retrievalDone(List.of(), List.of())), tokens, done);
                })
                .onErrorResume(e -> {
                    log.error("Streaming chat failed: {}", e.getMessage());
                    return Flux.just(AnswerEvent.error(AnswerOrchestrator.errorMessage(e)));
                });
    }

    private List<Message> messages(AskRequest request, String question) {
        List<Message> messages = ConversationHistory.toMessages(request.safeHistory(), this.maxHistoryTurns);
        messages.add(new UserMessage(question));
        return messages;
    }

    private void record(String userId, String question, String answer) {
        try {
            this.qaRecordRepository.save(QaRecord.create(userId, question, answer, null, QaRecord.MODE_CHAT, List.of(),
                    List.of(), Map.of()));
        }
        catch (RuntimeException e) {
            log.error("Could not store chat record for {}: {}", LogSanitizer.querySummary(question), e.getMessage());
        }
    }
}
