package com.example.messenger.domain;

import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sends conversations of a branch-less inbox to a branch, based on the visitor's region. Lower
 * priority values win. A fallback rule applies when no rule matches the region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRule {

    private long id;
    private long inboxId;
    private long branchId;
    private String name;
    private int priority;
    private boolean fallback;
    private boolean active;

    @Builder.Default
    private Set<Long> regionIds = Set.of();

    public boolean covers(Long regionId) {
        return regionId != null && regionIds.contains(regionId);
    }
}
