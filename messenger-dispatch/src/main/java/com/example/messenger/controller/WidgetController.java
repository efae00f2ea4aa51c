package com.example.messenger.controller;

import com.example.messenger.dto.WidgetBootstrapRequest;
import com.example.messenger.dto.WidgetBootstrapResponse;
import com.example.messenger.dto.WidgetPollResponse;
import com.example.messenger.dto.WidgetSendRequest;
import com.example.messenger.dto.WidgetSendResponse;
import com.example.messenger.widget.ClientIpResolver;
import com.example.messenger.widget.OriginAllowlist;
import com.example.messenger.widget.WidgetGatewayService;
import com.example.messenger.widget.WidgetRequestContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/widget")
public class WidgetController {

    private final WidgetGatewayService gatewayService;
    private final ClientIpResolver clientIpResolver;
    private final OriginAllowlist originAllowlist;

    public WidgetController(
            WidgetGatewayService gatewayService,
            ClientIpResolver clientIpResolver,
            OriginAllowlist originAllowlist) {
        this.gatewayService = gatewayService;
        this.clientIpResolver = clientIpResolver;
        this.originAllowlist = originAllowlist;
    }

    @PostMapping("/bootstrap")
    public ResponseEntity<WidgetBootstrapResponse> bootstrap(
            @Valid @RequestBody WidgetBootstrapRequest request, HttpServletRequest httpRequest) {
        WidgetBootstrapResponse response = gatewayService.bootstrap(
                request.getWidgetToken(),
                request.getContactExternalId(),
                request.getName(),
                request.getRegionId(),
                context(httpRequest));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/send")
    public ResponseEntity<WidgetSendResponse> send(
            @Valid @RequestBody WidgetSendRequest request, HttpServletRequest httpRequest) {
        WidgetSendResponse response = gatewayService.send(
                request.getWidgetToken(),
                request.getWidgetSessionToken(),
                request.getBody(),
                request.getCaptchaToken(),
                request.getCaptchaAnswer(),
                context(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/poll")
    public ResponseEntity<WidgetPollResponse> poll(
            @RequestParam("widget_token") String widgetToken,
            @RequestParam("widget_session_token") String sessionToken,
            @RequestParam(name = "since_id", required = false) Long sinceId,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(WidgetPollResponse.builder()
                .messages(gatewayService.poll(widgetToken, sessionToken, sinceId, context(httpRequest)))
                .build());
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestParam("widget_token") String widgetToken,
            @RequestParam("widget_session_token") String sessionToken,
            @RequestParam(name = "since_id", required = false) Long sinceId,
            @RequestHeader(name = "Last-Event-ID", required = false) String lastEventId,
            HttpServletRequest httpRequest) {
        Long resumeFrom = sinceId != null ? sinceId : parseEventId(lastEventId);
        return gatewayService.stream(widgetToken, sessionToken, resumeFrom, context(httpRequest));
    }

    private WidgetRequestContext context(HttpServletRequest request) {
        return new WidgetRequestContext(clientIpResolver.resolve(request), originAllowlist.resolveOriginHost(request));
    }

    private Long parseEventId(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(lastEventId.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
