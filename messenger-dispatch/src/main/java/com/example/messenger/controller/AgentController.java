package com.example.messenger.controller;

import com.example.messenger.domain.AgentStatus;
import com.example.messenger.domain.Message;
import com.example.messenger.dto.AgentMessageResponse;
import com.example.messenger.dto.AgentPresencePayload;
import com.example.messenger.dto.AgentReplyRequest;
import com.example.messenger.dto.AgentStatusRequest;
import com.example.messenger.dto.AssignConversationRequest;
import com.example.messenger.dto.ConversationPayload;
import com.example.messenger.dto.TransferConversationRequest;
import com.example.messenger.service.AgentConversationService;
import com.example.messenger.service.BranchTransferService;
import com.example.messenger.service.ConversationRepository;
import com.example.messenger.service.PresenceTracker;
import com.example.messenger.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AgentController {

    private final PresenceTracker presenceTracker;
    private final AgentConversationService conversationService;
    private final BranchTransferService transferService;
    private final ConversationRepository conversationRepository;

    public AgentController(
            PresenceTracker presenceTracker,
            AgentConversationService conversationService,
            BranchTransferService transferService,
            ConversationRepository conversationRepository) {
        this.presenceTracker = presenceTracker;
        this.conversationService = conversationService;
        this.transferService = transferService;
        this.conversationRepository = conversationRepository;
    }

    @PutMapping("/agents/{agentId}/status")
    public ResponseEntity<AgentPresencePayload> updateStatus(
            @PathVariable long agentId, @Valid @RequestBody AgentStatusRequest request) {
        presenceTracker.setStatus(agentId, request.getStatus());
        return ResponseEntity.ok(AgentPresencePayload.builder()
                .agentId(agentId)
                .status(request.getStatus())
                .build());
    }

    @GetMapping("/agents/online")
    public ResponseEntity<List<AgentPresencePayload>> onlineAgents(
            @RequestParam(name = "branch_id", required = false) Long branchId) {
        Map<Long, AgentStatus> available = presenceTracker.availableAgents(branchId);
        List<AgentPresencePayload> agents = available.entrySet().stream()
                .filter(entry -> entry.getValue() == AgentStatus.ONLINE)
                .map(entry -> AgentPresencePayload.builder()
                        .agentId(entry.getKey())
                        .status(entry.getValue())
                        .build())
                .toList();
        return ResponseEntity.ok(agents);
    }

    @PostMapping("/agent/conversations/{conversationId}/open")
    public ResponseEntity<ConversationPayload> open(
            @PathVariable long conversationId, @RequestHeader("X-Agent-Id") long agentId) {
        return ResponseEntity.ok(ConversationPayload.from(conversationService.open(conversationId, agentId)));
    }

    @PostMapping("/agent/conversations/{conversationId}/messages")
    public ResponseEntity<AgentMessageResponse> reply(
            @PathVariable long conversationId,
            @RequestHeader("X-Agent-Id") long agentId,
            @Valid @RequestBody AgentReplyRequest request) {
        Message message = conversationService.reply(conversationId, agentId, request.getBody(), request.getDirection());
        return ResponseEntity.status(HttpStatus.CREATED).body(AgentMessageResponse.from(message));
    }

    @PostMapping("/agent/conversations/{conversationId}/resolve")
    public ResponseEntity<ConversationPayload> resolve(
            @PathVariable long conversationId, @RequestHeader("X-Agent-Id") long agentId) {
        conversationService.resolve(conversationId);
        return ResponseEntity.ok(current(conversationId));
    }

    @PostMapping("/agent/conversations/{conversationId}/close")
    public ResponseEntity<ConversationPayload> close(
            @PathVariable long conversationId, @RequestHeader("X-Agent-Id") long agentId) {
        conversationService.close(conversationId);
        return ResponseEntity.ok(current(conversationId));
    }

    @PostMapping("/agent/conversations/{conversationId}/assign")
    public ResponseEntity<ConversationPayload> assign(
            @PathVariable long conversationId,
            @RequestHeader("X-Agent-Id") long agentId,
            @Valid @RequestBody AssignConversationRequest request) {
        return ResponseEntity.ok(ConversationPayload.from(
                conversationService.assign(conversationId, request.getAgentId())));
    }

    @PostMapping("/agent/conversations/{conversationId}/transfer")
    public ResponseEntity<ConversationPayload> transfer(
            @PathVariable long conversationId,
            @RequestHeader("X-Agent-Id") long agentId,
            @Valid @RequestBody TransferConversationRequest request) {
        return ResponseEntity.ok(ConversationPayload.from(
                transferService.transfer(conversationId, request.getBranchId(), agentId)));
    }

    private ConversationPayload current(long conversationId) {
        return conversationRepository.findById(conversationId)
                .map(ConversationPayload::from)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
    }
}
