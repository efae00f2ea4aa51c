package com.example.messenger.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "messenger_routing_rules",
        indexes = @Index(name = "idx_messenger_routing_rules_inbox", columnList = "inbox_id, active, priority"))
public class RoutingRuleEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "inbox_id", nullable = false)
    private Long inboxId;

    @Column(name = "branch_id", nullable = false)
    private Long branchId;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "priority", nullable = false)
    private int priority = 100;

    @Column(name = "fallback", nullable = false)
    private boolean fallback;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "messenger_routing_rule_regions", joinColumns = @JoinColumn(name = "rule_id"))
    @Column(name = "region_id", nullable = false)
    private Set<Long> regionIds = new HashSet<>();
}
