package com.example.messenger.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "messenger_inboxes")
public class InboxEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "widget_token", nullable = false, unique = true, length = 128)
    private String widgetToken;

    @Column(name = "branch_id")
    private Long branchId;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "auto_reply_enabled", nullable = false)
    private boolean autoReplyEnabled;

    @Column(name = "auto_reply_body", columnDefinition = "text")
    private String autoReplyBody;

    @Column(name = "allowed_domains", columnDefinition = "text")
    private String allowedDomains;
}
