package com.example.messenger.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.event.ChatEvent;
import com.example.messenger.event.ChatEventListener;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.service.ConversationRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class AgentConsoleGateway {

    static final String ASSIGNEE_CHANGED_EVENT = "assignee:changed";
    static final String MESSAGE_CREATED_EVENT = "message:created";
    static final String AGENT_STATUS_EVENT = "agent:status";
    static final String TRANSFERRED_EVENT = "conversation:transferred";
    static final String ERROR_EVENT = "system:error";

    private static final String PARAM_AGENT_ID = "agentId";
    private static final String CLIENT_AGENT_KEY = "agentId";

    private final SocketIOServer socketIOServer;
    private final EventBus eventBus;
    private final ConversationRepository conversationRepository;

    private final ChatEventListener assigneeListener = this::onAssigneeChanged;
    private final ChatEventListener messageListener = this::onMessageCreated;
    private final ChatEventListener statusListener = this::onAgentStatusChanged;
    private final ChatEventListener transferListener = this::onConversationTransferred;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        eventBus.subscribe(ChatEventType.ASSIGNEE_CHANGED, assigneeListener, false);
        eventBus.subscribe(ChatEventType.MESSAGE_CREATED, messageListener, false);
        eventBus.subscribe(ChatEventType.AGENT_STATUS_CHANGED, statusListener, false);
        eventBus.subscribe(ChatEventType.CONVERSATION_TRANSFERRED, transferListener, false);
    }

    void handleConnect(SocketIOClient client) {
        String agentParam = client.getHandshakeData().getSingleUrlParam(PARAM_AGENT_ID);
        Long agentId = parseAgentId(agentParam);
        if (agentId == null) {
            log.info("Rejected console connection {} without a valid agentId", client.getSessionId());
            client.sendEvent(ERROR_EVENT, Map.of("message", "agentId is required"));
            client.disconnect();
            return;
        }
        client.set(CLIENT_AGENT_KEY, agentId);
        client.joinRoom(agentRoom(agentId));
        log.info("Agent {} console connected on session {}", agentId, client.getSessionId());
    }

    private void handleDisconnect(SocketIOClient client) {
        Long agentId = client.get(CLIENT_AGENT_KEY);
        if (agentId != null) {
            log.info("Agent {} console disconnected from session {}", agentId, client.getSessionId());
        }
    }

    void onAssigneeChanged(ChatEvent event) {
        Long assigneeId = event.longValue("assignee_id");
        Long previousId = event.longValue("previous_assignee_id");
        if (assigneeId != null) {
            sendToAgent(assigneeId, ASSIGNEE_CHANGED_EVENT, event.getPayload());
        }
        if (previousId != null && !previousId.equals(assigneeId)) {
            sendToAgent(previousId, ASSIGNEE_CHANGED_EVENT, event.getPayload());
        }
    }

    void onMessageCreated(ChatEvent event) {
        // Visitor messages only; agents see their own replies locally.
        if (!MessageDirection.IN.wireValue().equals(event.stringValue("direction"))) {
            return;
        }
        Long conversationId = event.longValue("conversation_id");
        if (conversationId == null) {
            return;
        }
        conversationRepository.findById(conversationId)
                .filter(conversation -> conversation.getAssigneeId() != null)
                .ifPresent(conversation ->
                        sendToAgent(conversation.getAssigneeId(), MESSAGE_CREATED_EVENT, event.getPayload()));
    }

    void onAgentStatusChanged(ChatEvent event) {
        socketIOServer.getBroadcastOperations().sendEvent(AGENT_STATUS_EVENT, event.getPayload());
    }

    void onConversationTransferred(ChatEvent event) {
        Long previousId = event.longValue("previous_assignee_id");
        if (previousId != null) {
            sendToAgent(previousId, TRANSFERRED_EVENT, event.getPayload());
        }
    }

    private void sendToAgent(long agentId, String eventName, Object payload) {
        socketIOServer.getRoomOperations(agentRoom(agentId)).sendEvent(eventName, payload);
    }

    static String agentRoom(long agentId) {
        return "agent:" + agentId;
    }

    private Long parseAgentId(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        eventBus.unsubscribe(ChatEventType.ASSIGNEE_CHANGED, assigneeListener, false);
        eventBus.unsubscribe(ChatEventType.MESSAGE_CREATED, messageListener, false);
        eventBus.unsubscribe(ChatEventType.AGENT_STATUS_CHANGED, statusListener, false);
        eventBus.unsubscribe(ChatEventType.CONVERSATION_TRANSFERRED, transferListener, false);
    }
}
