package com.jreinhal.zerag.service;

import com.jreinhal.zerag.dto.ConversationTurn;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

/**
 * Turns client-supplied history into chat messages. Only user and assistant turns with content
 * survive, and only the most recent {@code maxTurns} of them.
 */
final class ConversationHistory {

    private ConversationHistory() {
    }

    static List<Message> toMessages(List<ConversationTurn> history, int maxTurns) {
        if (history == null || history.isEmpty() || maxTurns <= 0) {
            return new ArrayList<>();
        }
        List<ConversationTurn> usable = history.stream().filter(ConversationTurn::isUsable).toList();
        List<ConversationTurn> recent = usable.subList(Math.max(0, usable.size() - maxTurns), usable.size());
        List<Message> messages = new ArrayList<>(recent.size() + 1);
        for (ConversationTurn turn : recent) {
            messages.add("user".equals(turn.role()) ? new UserMessage(turn.content()) : new AssistantMessage(turn.content()));
        }
        return messages;
    }
}
