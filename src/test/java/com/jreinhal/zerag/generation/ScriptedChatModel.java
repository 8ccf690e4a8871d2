package com.jreinhal.zerag.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Chat model stub that answers from a function of the prompt text and streams a fixed token list.
 */
public class ScriptedChatModel implements ChatModel {

    private final Function<String, String> responder;
    private final List<String> streamTokens;
    public final List<Prompt> prompts = new ArrayList<>();

    public ScriptedChatModel(Function<String, String> responder) {
        this(responder, List.of());
    }

    public ScriptedChatModel(Function<String, String> responder, List<String> streamTokens) {
        this.responder = responder;
        this.streamTokens = streamTokens;
    }

    @Override
    public synchronized ChatResponse call(Prompt prompt) {
        this.prompts.add(prompt);
        return new ChatResponse(List.of(new Generation(new AssistantMessage(this.responder.apply(prompt.getContents())))));
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        synchronized (this) {
            this.prompts.add(prompt);
        }
        return Flux.fromIterable(this.streamTokens)
                .map(token -> new ChatResponse(List.of(new Generation(new AssistantMessage(token)))));
    }
}
