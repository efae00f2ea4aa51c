package com.example.messenger.persistence;

import com.example.messenger.domain.MessageDirection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    List<MessageEntity> findByConversationIdAndDirectionAndIdGreaterThanOrderByIdAsc(
            Long conversationId, MessageDirection direction, Long id, Pageable pageable);

    List<MessageEntity> findByConversationIdAndDirectionOrderByIdDesc(
            Long conversationId, MessageDirection direction, Pageable pageable);

    Optional<MessageEntity> findFirstByConversationIdAndDirectionOrderByIdDesc(
            Long conversationId, MessageDirection direction);
}
