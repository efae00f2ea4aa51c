package com.example.messenger.event;

import com.example.messenger.domain.Message;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ChatEventPayloads {

    private ChatEventPayloads() {
    }

    public static Map<String, Object> messageCreated(Message message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", message.getConversationId());
        payload.put("message_id", message.getId());
        payload.put("direction", message.getDirection().wireValue());
        payload.put("sender_agent_id", message.getSenderAgentId());
        payload.put("sender_contact_id", message.getSenderContactId());
        return payload;
    }
}
