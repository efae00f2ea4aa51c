package com.example.messenger.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InboxJpaRepository extends JpaRepository<InboxEntity, Long> {

    Optional<InboxEntity> findByWidgetToken(String widgetToken);
}
