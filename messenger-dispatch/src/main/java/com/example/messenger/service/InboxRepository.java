package com.example.messenger.service;

import com.example.messenger.domain.Inbox;
import java.util.Optional;

public interface InboxRepository {

    Optional<Inbox> findById(long inboxId);

    Optional<Inbox> findByWidgetToken(String widgetToken);
}
