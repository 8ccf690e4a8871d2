package com.jreinhal.zerag.service;

import com.jreinhal.zerag.dto.AnswerEvent;
import com.jreinhal.zerag.dto.AnswerResult;
import com.jreinhal.zerag.dto.AskRequest;
import com.jreinhal.zerag.dto.ConversationTurn;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.model.QaRecord;
import com.jreinhal.zerag.repository.QaRecordRepository;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatServiceTest {

    private final GenerationService generationService = mock(GenerationService.class);
    private final QaRecordRepository qaRecordRepository = mock(QaRecordRepository.class);
    private final ChatService chatService = new ChatService(generationService, qaRecordRepository);

    @Test
    void historyIsTrimmedToRecentTurns() {
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(new ConversationTurn(i % 2 == 0 ? "user" : "assistant", "turn " + i));
        }
        when(generationService.complete(anyString(), anyList())).thenReturn("hello");

        AnswerResult result = chatService.chat(new AskRequest("hi", null, null, null, null, null, history), "u1");

        assertEquals("hello", result.answer());
        assertTrue(result.chunks().isEmpty());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(generationService).complete(eq(ChatService.SYSTEM_PROMPT), messages.capture());
        assertEquals(21, messages.getValue().size());
        assertEquals("turn 10", messages.getValue().get(0).getText());
        assertEquals(MessageType.USER, messages.getValue().get(20).getMessageType());

        ArgumentCaptor<QaRecord> record = ArgumentCaptor.forClass(QaRecord.class);
        verify(qaRecordRepository).save(record.capture());
        assertEquals(QaRecord.MODE_CHAT, record.getValue().getMode());
        assertNull(record.getValue().getDataSourceId());
    }

    @Test
    void streamStartsWithEmptyRetrieval() {
        when(generationService.completeStream(anyString(), anyList())).thenReturn(Flux.just("Hel", "lo"));

        StepVerifier.create(chatService.chatStream(new AskRequest("hi", null, null, null, null, null, null), "u1"))
                .expectNext(AnswerEvent.retrievalDone(List.of(), List.of()))
                .expectNext(AnswerEvent.token("Hel"), AnswerEvent.token("lo"))
                .expectNext(AnswerEvent.done("Hello"))
                .verifyComplete();
        verify(qaRecordRepository).save(any(QaRecord.class));
    }

    @Test
    void blankQuestionStreamsError() {
        StepVerifier.create(chatService.chatStream(new AskRequest(" ", null, null, null, null, null, null), "u1"))
                .expectNext(AnswerEvent.error("Question must not be empty"))
                .verifyComplete();
    }
}
