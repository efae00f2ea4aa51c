package com.example.messenger.persistence;

import com.example.messenger.domain.AgentStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AgentProfileJpaRepository extends JpaRepository<AgentProfileEntity, Long> {

    List<AgentProfileEntity> findByActiveTrue();

    List<AgentProfileEntity> findByActiveTrueAndBranchId(Long branchId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AgentProfileEntity a set a.status = :status, a.statusChangedAt = :now where a.agentId = :agentId")
    int updateStatus(@Param("agentId") long agentId, @Param("status") AgentStatus status, @Param("now") Instant now);
}
