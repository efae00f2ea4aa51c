package com.example.messenger.service;

import com.example.messenger.domain.Message;
import java.util.List;
import java.util.Optional;

public interface MessageRepository {

    Message save(Message message);

    Optional<Message> findById(long messageId);

    List<Message> findOutboundAfter(long conversationId, Long sinceId, int limit);

    List<Message> findLatestOutbound(long conversationId, int limit);

    Optional<Long> findLatestOutboundId(long conversationId);
}
