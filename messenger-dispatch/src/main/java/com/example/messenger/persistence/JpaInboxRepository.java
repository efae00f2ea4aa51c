package com.example.messenger.persistence;

import com.example.messenger.domain.Inbox;
import com.example.messenger.service.InboxRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaInboxRepository implements InboxRepository {

    private final InboxJpaRepository inboxJpaRepository;
    private final MessengerEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Inbox> findById(long inboxId) {
        return inboxJpaRepository.findById(inboxId).map(mapper::toInbox);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Inbox> findByWidgetToken(String widgetToken) {
        if (!StringUtils.hasText(widgetToken)) {
            return Optional.empty();
        }
        return inboxJpaRepository.findByWidgetToken(widgetToken).map(mapper::toInbox);
    }
}
