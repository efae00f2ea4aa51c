package com.example.messenger.persistence;

import com.example.messenger.domain.ConversationStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Assignment and lifecycle changes are issued as conditional bulk updates; the affected row count
 * tells the caller whether its precondition still held.
 */
public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, Long> {

    Optional<ConversationEntity> findFirstByInboxIdAndContactIdAndStatusInOrderByIdDesc(
            Long inboxId, String contactId, Collection<ConversationStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.assigneeId = :assigneeId, c.assignedAt = :now, "
            + "c.assigneeOpenedAt = null, c.waitingSince = null, c.version = c.version + 1 "
            + "where c.id = :id and c.assigneeId is null and c.status in (:active)")
    int assignIfUnassigned(
            @Param("id") long id,
            @Param("assigneeId") long assigneeId,
            @Param("now") Instant now,
            @Param("active") Collection<ConversationStatus> activeStatuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.assigneeId = :assigneeId, c.assignedAt = :now, "
            + "c.assigneeOpenedAt = null, c.waitingSince = null, c.version = c.version + 1 "
            + "where c.id = :id and c.assigneeId = :expected and c.assigneeOpenedAt is null "
            + "and c.status in (:active)")
    int reassignIfUnopened(
            @Param("id") long id,
            @Param("expected") long expectedAssigneeId,
            @Param("assigneeId") long assigneeId,
            @Param("now") Instant now,
            @Param("active") Collection<ConversationStatus> activeStatuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.assigneeOpenedAt = :now, c.version = c.version + 1 "
            + "where c.id = :id and c.assigneeId = :agentId and c.assigneeOpenedAt is null")
    int markOpened(@Param("id") long id, @Param("agentId") long agentId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.firstReplyAt = :now, c.version = c.version + 1 "
            + "where c.id = :id and c.firstReplyAt is null")
    int markFirstReply(@Param("id") long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.lastActivityAt = :now where c.id = :id")
    int touchActivity(@Param("id") long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.status = :status, c.lastActivityAt = :now, c.version = c.version + 1 "
            + "where c.id = :id and c.status <> :status")
    int updateStatus(@Param("id") long id, @Param("status") ConversationStatus status, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.status = :status, c.lastActivityAt = :now, "
            + "c.activeContactKey = null, c.version = c.version + 1 "
            + "where c.id = :id and c.status <> :status")
    int finish(@Param("id") long id, @Param("status") ConversationStatus status, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.branchId = :branchId, c.assigneeId = null, c.assignedAt = null, "
            + "c.assigneeOpenedAt = null, c.waitingSince = :now, c.lastActivityAt = :now, c.version = c.version + 1 "
            + "where c.id = :id and c.status in (:active)")
    int moveToBranch(
            @Param("id") long id,
            @Param("branchId") long branchId,
            @Param("now") Instant now,
            @Param("active") Collection<ConversationStatus> activeStatuses);

    @Query("select c from ConversationEntity c "
            + "where c.status in (:statuses) "
            + "and c.assigneeId is not null "
            + "and c.assigneeOpenedAt is null "
            + "and coalesce(c.assignedAt, c.createdAt) <= :cutoff "
            + "order by coalesce(c.assignedAt, c.createdAt) asc, c.id asc")
    List<ConversationEntity> findEscalationCandidates(
            @Param("statuses") Collection<ConversationStatus> statuses,
            @Param("cutoff") Instant cutoff,
            Pageable pageable);

    @Query("select c from ConversationEntity c "
            + "where c.status = :status "
            + "and coalesce(c.lastActivityAt, c.createdAt) < :cutoff "
            + "order by c.id asc")
    List<ConversationEntity> findInactiveWithStatus(
            @Param("status") ConversationStatus status,
            @Param("cutoff") Instant cutoff,
            Pageable pageable);
}
