package com.jreinhal.zerag.controller;

import com.jreinhal.zerag.dto.AnswerEvent;
import com.jreinhal.zerag.dto.AnswerResult;
import com.jreinhal.zerag.dto.AskRequest;
import com.jreinhal.zerag.model.QaRecord;
import com.jreinhal.zerag.service.AnswerOrchestrator;
import com.jreinhal.zerag.service.ChatService;
import com.jreinhal.zerag.service.QaHistoryService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Question answering, plain chat and the QA history. The caller is identified by the
 * {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/qa")
public class QaController {

    private static final Logger log = LoggerFactory.getLogger(QaController.class);
    static final String USER_HEADER = "X-User-Id";

    private final AnswerOrchestrator answerOrchestrator;
    private final ChatService chatService;
    private final QaHistoryService historyService;

    @Value("${zerag.stream.timeout-ms:300000}")
    private long streamTimeoutMs = 300_000L;

    public QaController(AnswerOrchestrator answerOrchestrator, ChatService chatService, QaHistoryService historyService) {
        this.answerOrchestrator = answerOrchestrator;
        this.chatService = chatService;
        this.historyService = historyService;
    }

    @PostMapping("/ask")
    public AnswerResult ask(@RequestBody AskRequest request, @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return this.answerOrchestrator.ask(request, userId);
    }

    @PostMapping(value = "/ask/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter askStream(@RequestBody AskRequest request,
                                @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return this.toEmitter(this.answerOrchestrator.askStream(request, userId));
    }

    @PostMapping("/chat")
    public AnswerResult chat(@RequestBody AskRequest request, @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return this.chatService.chat(request, userId);
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chatStream(@RequestBody AskRequest request,
                                 @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return this.toEmitter(this.chatService.chatStream(request, userId));
    }

    @GetMapping("/history")
    public List<QaRecord> history(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                  @RequestParam(defaultValue = "20") int limit) {
        return this.historyService.listHistory(userId, limit);
    }

    @GetMapping("/history/{id}")
    public ResponseEntity<QaRecord> historyEntry(@PathVariable String id) {
        return this.historyService.getHistory(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/history/{id}")
    public ResponseEntity<Void> deleteHistory(@PathVariable String id,
                                              @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return this.historyService.deleteHistory(id, userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Relays events as SSE. The upstream subscription is disposed when the client goes away, the
     * emitter times out or fails; a failed send cancels the upstream as well.
     */
    SseEmitter toEmitter(Flux<AnswerEvent> events) {
        SseEmitter emitter = new SseEmitter(this.streamTimeoutMs);
        Disposable subscription = events.subscribe(
                event -> {
                    try {
                        emitter.send(SseEmitter.event().name(event.type()).data(event, MediaType.APPLICATION_JSON));
                    }
                    catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                },
                error -> {
                    log.debug("SSE stream ended with error: {}", error.getMessage());
                    emitter.completeWithError(error);
                },
                emitter::complete);
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(() -> {
            log.info("SSE stream timed out after {}ms", this.streamTimeoutMs);
            subscription.dispose();
        });
        emitter.onError(error -> subscription.dispose());
        return emitter;
    }
}
