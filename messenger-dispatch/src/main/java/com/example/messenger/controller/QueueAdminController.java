package com.example.messenger.controller;

import com.example.messenger.dto.QueueMembersRequest;
import com.example.messenger.dto.QueueSnapshotResponse;
import com.example.messenger.service.RoundRobinQueueService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/inboxes/{inboxId}/queue")
public class QueueAdminController {

    private final RoundRobinQueueService queueService;

    public QueueAdminController(RoundRobinQueueService queueService) {
        this.queueService = queueService;
    }

    @GetMapping
    public ResponseEntity<QueueSnapshotResponse> snapshot(@PathVariable long inboxId) {
        return ResponseEntity.ok(snapshotOf(inboxId));
    }

    @PutMapping
    public ResponseEntity<QueueSnapshotResponse> reset(
            @PathVariable long inboxId, @Valid @RequestBody QueueMembersRequest request) {
        queueService.reset(inboxId, request.getMemberIds());
        return ResponseEntity.ok(snapshotOf(inboxId));
    }

    @PostMapping("/agents/{agentId}")
    public ResponseEntity<QueueSnapshotResponse> addAgent(@PathVariable long inboxId, @PathVariable long agentId) {
        queueService.add(inboxId, agentId);
        return ResponseEntity.ok(snapshotOf(inboxId));
    }

    @DeleteMapping("/agents/{agentId}")
    public ResponseEntity<QueueSnapshotResponse> removeAgent(@PathVariable long inboxId, @PathVariable long agentId) {
        queueService.remove(inboxId, agentId);
        return ResponseEntity.ok(snapshotOf(inboxId));
    }

    private QueueSnapshotResponse snapshotOf(long inboxId) {
        return QueueSnapshotResponse.builder()
                .inboxId(inboxId)
                .memberIds(queueService.snapshot(inboxId))
                .build();
    }
}
