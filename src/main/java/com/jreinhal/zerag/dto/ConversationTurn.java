package com.jreinhal.zerag.dto;

public record ConversationTurn(String role, String content) {

    public boolean isUsable() {
        return content != null && !content.isBlank()
                && ("user".equals(role) || "assistant".equals(role));
    }
}
