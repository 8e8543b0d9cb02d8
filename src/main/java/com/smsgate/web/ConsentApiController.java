package com.smsgate.web;

import com.smsgate.consent.ConsentEngine;
import com.smsgate.consent.ConsentRecord;
import com.smsgate.consent.ConsentRecordInput;
import com.smsgate.consent.ConsentService;
import com.smsgate.consent.ConsentSource;
import com.smsgate.consent.ConsentStatus;
import com.smsgate.consent.ConsentType;
import com.smsgate.consent.ConsentValidationResult;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ConsentApiController {

    private final ConsentEngine consentEngine;
    private final ConsentService consentService;

    public ConsentApiController(ConsentEngine consentEngine, ConsentService consentService) {
        this.consentEngine = consentEngine;
        this.consentService = consentService;
    }

    @PostMapping("/consents/validate")
    public ConsentValidationResult validate(@RequestBody ConsentRecordInput input) {
        return consentEngine.validateRecord(input);
    }

    @PostMapping("/tenants/{tenantId}/consents/transitions")
    public ConsentView transition(@PathVariable String tenantId,
                                  @RequestBody ConsentTransitionRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("Target consent status is required");
        }
        ConsentRecord record = consentService.transition(tenantId, request.phoneNumber(),
                request.type() != null ? request.type() : ConsentType.MARKETING,
                request.status(),
                request.source() != null ? request.source() : ConsentSource.UNKNOWN,
                request.context());
        return view(record);
    }

    @GetMapping("/tenants/{tenantId}/consents")
    public List<ConsentView> find(@PathVariable String tenantId, @RequestParam String phone) {
        return consentService.find(tenantId, phone).stream().map(this::view).toList();
    }

    private ConsentView view(ConsentRecord r) {
        return new ConsentView(r.getId(), r.getPhoneNumber(), r.getStatus(), r.getType(), r.getSource(),
                r.getOptInDate(), r.getOptOutDate(), r.getVersion(), r.getAuditTrail().size(),
                consentEngine.isExpired(r.getOptInDate(), r.getMetadata()));
    }

    public record ConsentTransitionRequest(String phoneNumber, ConsentType type, ConsentStatus status,
                                           ConsentSource source, String context) {}

    public record ConsentView(UUID id, String phoneNumber, ConsentStatus status, ConsentType type,
                              ConsentSource source, Instant optInDate, Instant optOutDate,
                              int version, int auditEntries, boolean expired) {}
}
