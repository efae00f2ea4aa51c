package com.example.messenger.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatEventType {
    CONVERSATION_CREATED("conversation.created"),
    CONVERSATION_UPDATED("conversation.updated"),
    CONVERSATION_OPENED("conversation.opened"),
    CONVERSATION_RESOLVED("conversation.resolved"),
    CONVERSATION_CLOSED("conversation.closed"),
    CONVERSATION_STATUS_CHANGED("conversation.status_changed"),
    CONVERSATION_TRANSFERRED("conversation.transferred"),
    ASSIGNEE_CHANGED("assignee.changed"),
    MESSAGE_CREATED("message.created"),
    MESSAGE_UPDATED("message.updated"),
    FIRST_REPLY_CREATED("first_reply.created"),
    CONTACT_CREATED("contact.created"),
    AGENT_STATUS_CHANGED("agent.status_changed");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
