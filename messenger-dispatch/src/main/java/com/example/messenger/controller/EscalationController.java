package com.example.messenger.controller;

import com.example.messenger.config.MessengerProperties;
import com.example.messenger.service.EscalationReport;
import com.example.messenger.service.EscalationRequest;
import com.example.messenger.service.EscalationScanner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/escalation")
public class EscalationController {

    private final EscalationScanner escalationScanner;
    private final MessengerProperties messengerProperties;

    public EscalationController(EscalationScanner escalationScanner, MessengerProperties messengerProperties) {
        this.escalationScanner = escalationScanner;
        this.messengerProperties = messengerProperties;
    }

    @PostMapping("/run")
    public ResponseEntity<EscalationReport> run(
            @RequestParam(name = "timeout_seconds", required = false) Long timeoutSeconds,
            @RequestParam(name = "dry_run", defaultValue = "false") boolean dryRun) {
        if (timeoutSeconds != null && timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeout_seconds must not be negative");
        }
        EscalationRequest request = EscalationRequest.builder()
                .timeoutSeconds(timeoutSeconds)
                .dryRun(dryRun)
                .limit(messengerProperties.getEscalation().getBatchSize())
                .build();
        return ResponseEntity.ok(escalationScanner.scan(request));
    }
}
