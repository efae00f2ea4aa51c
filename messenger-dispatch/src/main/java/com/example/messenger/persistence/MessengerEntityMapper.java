package com.example.messenger.persistence;

import com.example.messenger.domain.AgentProfile;
import com.example.messenger.domain.AgentStatus;
import com.example.messenger.domain.Contact;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Inbox;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.RoutingRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class MessengerEntityMapper {

    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Inbox toInbox(InboxEntity entity) {
        return Inbox.builder()
                .id(entity.getId())
                .name(entity.getName())
                .widgetToken(entity.getWidgetToken())
                .branchId(entity.getBranchId())
                .active(entity.isActive())
                .autoReplyEnabled(entity.isAutoReplyEnabled())
                .autoReplyBody(entity.getAutoReplyBody())
                .allowedDomains(readList(entity.getAllowedDomains()))
                .build();
    }

    public RoutingRule toRoutingRule(RoutingRuleEntity entity) {
        return RoutingRule.builder()
                .id(entity.getId())
                .inboxId(entity.getInboxId())
                .branchId(entity.getBranchId())
                .name(entity.getName())
                .priority(entity.getPriority())
                .fallback(entity.isFallback())
                .active(entity.isActive())
                .regionIds(entity.getRegionIds() != null ? Set.copyOf(entity.getRegionIds()) : Set.of())
                .build();
    }

    public AgentProfile toAgentProfile(AgentProfileEntity entity) {
        return AgentProfile.builder()
                .agentId(entity.getAgentId())
                .branchId(entity.getBranchId())
                .active(entity.isActive())
                .status(entity.getStatus() != null ? entity.getStatus() : AgentStatus.OFFLINE)
                .build();
    }

    public Contact toContact(ContactEntity entity) {
        return Contact.builder()
                .id(entity.getId())
                .externalId(entity.getExternalId())
                .name(entity.getName())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ContactEntity toEntity(Contact contact) {
        ContactEntity entity = new ContactEntity();
        entity.setId(contact.getId());
        entity.setExternalId(contact.getExternalId());
        entity.setName(contact.getName());
        entity.setCreatedAt(contact.getCreatedAt());
        return entity;
    }

    public Conversation toConversation(ConversationEntity entity) {
        return Conversation.builder()
                .id(entity.getId())
                .inboxId(entity.getInboxId())
                .contactId(entity.getContactId())
                .branchId(entity.getBranchId())
                .status(entity.getStatus() != null ? entity.getStatus() : ConversationStatus.OPEN)
                .assigneeId(entity.getAssigneeId())
                .assignedAt(entity.getAssignedAt())
                .assigneeOpenedAt(entity.getAssigneeOpenedAt())
                .waitingSince(entity.getWaitingSince())
                .firstReplyAt(entity.getFirstReplyAt())
                .lastActivityAt(entity.getLastActivityAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ConversationEntity toNewEntity(Conversation conversation) {
        ConversationEntity entity = new ConversationEntity();
        entity.setInboxId(conversation.getInboxId());
        entity.setContactId(conversation.getContactId());
        entity.setBranchId(conversation.getBranchId());
        entity.setStatus(conversation.getStatus() != null ? conversation.getStatus() : ConversationStatus.OPEN);
        entity.setAssigneeId(conversation.getAssigneeId());
        entity.setAssignedAt(conversation.getAssignedAt());
        entity.setAssigneeOpenedAt(conversation.getAssigneeOpenedAt());
        entity.setWaitingSince(conversation.getWaitingSince());
        entity.setFirstReplyAt(conversation.getFirstReplyAt());
        entity.setLastActivityAt(conversation.getLastActivityAt());
        entity.setCreatedAt(conversation.getCreatedAt());
        if (entity.getStatus().isActive()) {
            entity.setActiveContactKey(activeContactKey(conversation.getInboxId(), conversation.getContactId()));
        }
        return entity;
    }

    public static String activeContactKey(long inboxId, String contactId) {
        return inboxId + ":" + contactId;
    }

    public Message toMessage(MessageEntity entity) {
        return Message.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .direction(entity.getDirection())
                .body(entity.getBody())
                .senderContactId(entity.getSenderContactId())
                .senderAgentId(entity.getSenderAgentId())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public MessageEntity toNewEntity(Message message) {
        MessageEntity entity = new MessageEntity();
        entity.setConversationId(message.getConversationId());
        entity.setDirection(message.getDirection());
        entity.setBody(message.getBody());
        entity.setSenderContactId(message.getSenderContactId());
        entity.setSenderAgentId(message.getSenderAgentId());
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    private List<String> readList(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        try {
            List<String> result = objectMapper.readValue(json, LIST_TYPE);
            return CollectionUtils.isEmpty(result) ? Collections.emptyList() : List.copyOf(result);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed allowed domain list: {}", e.getOriginalMessage());
            return Collections.emptyList();
        }
    }
}
