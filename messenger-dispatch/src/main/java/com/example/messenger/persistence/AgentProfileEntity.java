package com.example.messenger.persistence;

import com.example.messenger.domain.AgentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "messenger_agent_profiles")
public class AgentProfileEntity {

    @Id
    @Column(name = "agent_id", nullable = false, updatable = false)
    private Long agentId;

    @Column(name = "branch_id")
    private Long branchId;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AgentStatus status;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;
}
