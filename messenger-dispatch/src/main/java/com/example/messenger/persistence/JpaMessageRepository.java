package com.example.messenger.persistence;

import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.service.MessageRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaMessageRepository implements MessageRepository {

    private final MessageJpaRepository messageJpaRepository;
    private final MessengerEntityMapper mapper;

    @Override
    @Transactional
    public Message save(Message message) {
        return mapper.toMessage(messageJpaRepository.saveAndFlush(mapper.toNewEntity(message)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findById(long messageId) {
        return messageJpaRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findOutboundAfter(long conversationId, Long sinceId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        long cursor = sinceId != null ? sinceId : 0L;
        return messageJpaRepository
                .findByConversationIdAndDirectionAndIdGreaterThanOrderByIdAsc(
                        conversationId, MessageDirection.OUT, cursor, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findLatestOutbound(long conversationId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<Message> latest = new ArrayList<>(messageJpaRepository
                .findByConversationIdAndDirectionOrderByIdDesc(conversationId, MessageDirection.OUT, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMessage)
                .toList());
        Collections.reverse(latest);
        return latest;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> findLatestOutboundId(long conversationId) {
        return messageJpaRepository
                .findFirstByConversationIdAndDirectionOrderByIdDesc(conversationId, MessageDirection.OUT)
                .map(MessageEntity::getId);
    }
}
