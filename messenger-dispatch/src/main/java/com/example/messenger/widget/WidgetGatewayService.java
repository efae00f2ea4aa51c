package com.example.messenger.widget;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.domain.CaptchaChallenge;
import com.example.messenger.domain.Contact;
import com.example.messenger.domain.Conversation;
import com.example.messenger.domain.ConversationStatus;
import com.example.messenger.domain.Inbox;
import com.example.messenger.domain.Message;
import com.example.messenger.domain.MessageDirection;
import com.example.messenger.domain.WidgetSession;
import com.example.messenger.dto.WidgetBootstrapResponse;
import com.example.messenger.dto.WidgetMessagePayload;
import com.example.messenger.dto.WidgetSendResponse;
import com.example.messenger.event.ChatEventPayloads;
import com.example.messenger.event.ChatEventType;
import com.example.messenger.event.EventBus;
import com.example.messenger.service.BranchRouter;
import com.example.messenger.service.ContactRepository;
import com.example.messenger.service.ConversationRepository;
import com.example.messenger.service.InboxRepository;
import com.example.messenger.service.MessageRepository;
import com.example.messenger.service.PresenceTracker;
import com.example.messenger.service.exception.CaptchaRequiredException;
import com.example.messenger.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@Service
@RequiredArgsConstructor
public class WidgetGatewayService {

    private final InboxRepository inboxRepository;
    private final ContactRepository contactRepository;
    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final WidgetSessionStore sessionStore;
    private final WidgetThrottleService throttleService;
    private final CaptchaService captchaService;
    private final OriginAllowlist originAllowlist;
    private final WidgetStreamRegistry streamRegistry;
    private final BranchRouter branchRouter;
    private final PresenceTracker presenceTracker;
    private final EventBus eventBus;
    private final MessengerProperties messengerProperties;
    private final Clock clock;

    public WidgetBootstrapResponse bootstrap(
            String widgetToken, String contactExternalId, String name, WidgetRequestContext context) {
        return bootstrap(widgetToken, contactExternalId, name, null, context);
    }

    public WidgetBootstrapResponse bootstrap(
            String widgetToken, String contactExternalId, String name, Long regionId, WidgetRequestContext context) {
        Inbox inbox = requireInbox(widgetToken, context);
        if (!throttleService.allowBootstrap(context.getClientIp(), widgetToken)) {
            throw throttled();
        }
        if (!StringUtils.hasText(contactExternalId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "contact_external_id is required", "validation_error");
        }
        captchaService.recordActivity(context.getClientIp());

        Contact contact = resolveContact(contactExternalId.trim(), name);
        Conversation conversation = resolveConversation(inbox, contact, regionId);
        WidgetSession session = resolveSession(inbox, conversation, contact);

        WidgetBootstrapResponse.WidgetBootstrapResponseBuilder response = WidgetBootstrapResponse.builder()
                .widgetSessionToken(session.getToken())
                .conversationId(conversation.getId())
                .operatorsOnline(presenceTracker.hasOnlineAgents(conversation.getBranchId()))
                .initialMessages(toPayloads(messageRepository.findLatestOutbound(
                        conversation.getId(), messengerProperties.getWidget().getInitialMessages())));
        if (captchaService.isRequired(context.getClientIp()) && !captchaService.isPassed(session.getToken())) {
            CaptchaChallenge challenge = captchaService.issue();
            response.captchaRequired(true)
                    .captchaToken(challenge.getToken())
                    .captchaQuestion(challenge.getQuestion());
        }
        return response.build();
    }

    public WidgetSendResponse send(
            String widgetToken,
            String sessionToken,
            String body,
            String captchaToken,
            String captchaAnswer,
            WidgetRequestContext context) {
        Inbox inbox = requireInbox(widgetToken, context);
        WidgetSession session = requireSession(inbox, sessionToken);
        if (!throttleService.allowSend(context.getClientIp(), sessionToken)) {
            throw throttled();
        }
        if (!StringUtils.hasText(body)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message body must not be empty", "empty_body");
        }
        if (body.length() > Message.MAX_BODY_LENGTH) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message body is too long", "body_too_long");
        }
        captchaService.recordActivity(context.getClientIp());
        if (captchaService.isRequired(context.getClientIp()) && !captchaService.isPassed(sessionToken)) {
            if (!captchaService.verify(captchaToken, captchaAnswer)) {
                CaptchaChallenge challenge = captchaService.issue();
                throw new CaptchaRequiredException(challenge.getToken(), challenge.getQuestion());
            }
            captchaService.markPassed(sessionToken);
        }

        Conversation conversation = conversationRepository.findById(session.getConversationId())
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found"));
        if (conversation.getStatus() == ConversationStatus.CLOSED) {
            throw new ServiceException(HttpStatus.CONFLICT, "Conversation is closed", "conversation_closed");
        }

        Instant now = clock.instant();
        Message message = messageRepository.save(Message.builder()
                .conversationId(conversation.getId())
                .direction(MessageDirection.IN)
                .body(body)
                .senderContactId(session.getContactId())
                .createdAt(now)
                .build());
        conversationRepository.touchActivity(conversation.getId(), now);
        eventBus.dispatch(ChatEventType.MESSAGE_CREATED, now, ChatEventPayloads.messageCreated(message), true);

        return WidgetSendResponse.builder()
                .id(message.getId())
                .createdAt(message.getCreatedAt())
                .build();
    }

    public List<WidgetMessagePayload> poll(
            String widgetToken, String sessionToken, Long sinceId, WidgetRequestContext context) {
        Inbox inbox = requireInbox(widgetToken, context);
        WidgetSession session = requireSession(inbox, sessionToken);
        if (!throttleService.allowPoll(sessionToken)) {
            throw throttled();
        }
        return toPayloads(messageRepository.findOutboundAfter(
                session.getConversationId(), sinceId, messengerProperties.getWidget().getPollLimit()));
    }

    public SseEmitter stream(String widgetToken, String sessionToken, Long sinceId, WidgetRequestContext context) {
        Inbox inbox = requireInbox(widgetToken, context);
        WidgetSession session = requireSession(inbox, sessionToken);
        return streamRegistry.open(session.getConversationId(), sinceId);
    }

    private Inbox requireInbox(String widgetToken, WidgetRequestContext context) {
        Inbox inbox = Optional.ofNullable(widgetToken)
                .filter(StringUtils::hasText)
                .flatMap(inboxRepository::findByWidgetToken)
                .filter(Inbox::isActive)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Unknown widget token", "invalid_widget_token"));
        if (!originAllowlist.isAllowed(inbox.getAllowedDomains(), context.getOriginHost())) {
            log.info("Rejected widget request for inbox {} from origin '{}'", inbox.getId(), context.getOriginHost());
            throw new ServiceException(HttpStatus.FORBIDDEN, "Widget domain is not allowed", "origin_not_allowed");
        }
        return inbox;
    }

    private WidgetSession requireSession(Inbox inbox, String sessionToken) {
        WidgetSession session = sessionStore.find(sessionToken)
                .orElseThrow(() -> new ServiceException(HttpStatus.UNAUTHORIZED, "Invalid or expired widget session", "invalid_session"));
        if (session.getInboxId() != inbox.getId()) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Session belongs to another inbox", "session_inbox_mismatch");
        }
        return session;
    }

    private Contact resolveContact(String externalId, String name) {
        Optional<Contact> existing = contactRepository.findByExternalId(externalId);
        if (existing.isPresent()) {
            Contact contact = existing.get();
            if (StringUtils.hasText(name) && !StringUtils.hasText(contact.getName())) {
                contactRepository.updateName(contact.getId(), name.trim());
                contact.setName(name.trim());
            }
            return contact;
        }
        Instant now = clock.instant();
        Contact contact;
        try {
            contact = contactRepository.create(Contact.builder()
                    .id(UUID.randomUUID().toString())
                    .externalId(externalId)
                    .name(StringUtils.hasText(name) ? name.trim() : null)
                    .createdAt(now)
                    .build());
        } catch (DataIntegrityViolationException ex) {
            log.debug("Contact {} was created concurrently, reusing it", externalId);
            return contactRepository.findByExternalId(externalId).orElseThrow(() -> ex);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contact_id", contact.getId());
        eventBus.dispatch(ChatEventType.CONTACT_CREATED, now, payload, true);
        return contact;
    }

    private Conversation resolveConversation(Inbox inbox, Contact contact, Long regionId) {
        Optional<Conversation> active = conversationRepository.findActiveForContact(inbox.getId(), contact.getId());
        if (active.isPresent()) {
            return active.get();
        }
        Long branchId = branchRouter.resolveBranch(inbox, regionId).orElse(null);
        Instant now = clock.instant();
        Conversation conversation;
        try {
            conversation = conversationRepository.create(Conversation.builder()
                    .inboxId(inbox.getId())
                    .contactId(contact.getId())
                    .branchId(branchId)
                    .status(ConversationStatus.OPEN)
                    .waitingSince(now)
                    .lastActivityAt(now)
                    .createdAt(now)
                    .build());
        } catch (DataIntegrityViolationException ex) {
            log.debug("Conversation of contact {} in inbox {} was started concurrently", contact.getId(), inbox.getId());
            return conversationRepository.findActiveForContact(inbox.getId(), contact.getId()).orElseThrow(() -> ex);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", conversation.getId());
        payload.put("inbox_id", inbox.getId());
        payload.put("contact_id", contact.getId());
        payload.put("branch_id", branchId);
        eventBus.dispatch(ChatEventType.CONVERSATION_CREATED, now, payload, true);
        log.info("Started conversation {} in inbox {} for contact {}", conversation.getId(), inbox.getId(), contact.getId());
        return conversation;
    }

    private WidgetSession resolveSession(Inbox inbox, Conversation conversation, Contact contact) {
        Optional<WidgetSession> existing = sessionStore.findForContact(inbox.getId(), contact.getId());
        if (existing.isPresent()) {
            if (existing.get().getConversationId() == conversation.getId()) {
                return existing.get();
            }
            sessionStore.delete(existing.get());
        }
        return sessionStore.create(inbox.getId(), conversation.getId(), contact.getId());
    }

    private List<WidgetMessagePayload> toPayloads(List<Message> messages) {
        return messages.stream().map(WidgetMessagePayload::from).toList();
    }

    private ServiceException throttled() {
        return new ServiceException(HttpStatus.TOO_MANY_REQUESTS, "Too many widget requests", "throttled");
    }
}
