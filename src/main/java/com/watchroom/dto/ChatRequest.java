package com.watchroom.dto;

import com.watchroom.model.ChatKind;

/**
 * Payload of "chat:message".
 */
public class ChatRequest {

    private String content;
    private ChatKind type = ChatKind.TEXT;

    public ChatRequest() {}

    public ChatRequest(String content, ChatKind type) {
        this.content = content;
        this.type = type;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public ChatKind getType() {
        return type;
    }

    public void setType(ChatKind type) {
        this.type = type;
    }
}
