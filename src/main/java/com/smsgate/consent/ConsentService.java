package com.smsgate.consent;

import com.smsgate.audit.AuditService;
import com.smsgate.phone.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class ConsentService {

    private static final Logger log = LoggerFactory.getLogger(ConsentService.class);

    private final ConsentRepository consentRepository;
    private final ConsentEngine consentEngine;
    private final PhoneNumbers phoneNumbers;
    private final AuditService auditService;
    private final Clock clock;

    public ConsentService(ConsentRepository consentRepository,
                          ConsentEngine consentEngine,
                          PhoneNumbers phoneNumbers,
                          AuditService auditService,
                          Clock clock) {
        this.consentRepository = consentRepository;
        this.consentEngine = consentEngine;
        this.phoneNumbers = phoneNumbers;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ConsentRecord> find(String tenantId, String phone) {
        return consentRepository.findByTenantIdAndPhoneNumber(tenantId, normalize(phone));
    }

    /**
     * Moves the tenant's consent for {@code phone} and {@code type} to {@code to}, creating an
     * UNKNOWN record first if none exists. Concurrent writers are serialized by the optimistic lock.
     */
    @Transactional
    public ConsentRecord transition(String tenantId, String phone, ConsentType type,
                                    ConsentStatus to, ConsentSource source, String context) {
        String normalized = normalize(phone);
        ConsentRecord record = consentRepository
                .findByTenantIdAndPhoneNumberAndType(tenantId, normalized, type)
                .orElseGet(() -> new ConsentRecord(tenantId, normalized, type));

        ConsentStatus from = record.getStatus();
        if (!consentEngine.isValidTransition(from, to)) {
            throw new InvalidConsentTransitionException(from, to);
        }

        Instant now = clock.instant();
        if (record.getId() == null) {
            record.setCreatedAt(now);
        }
        switch (to) {
            case OPTED_IN -> {
                record.setOptInDate(now);
                record.setOptOutDate(null);
            }
            case OPTED_OUT -> record.setOptOutDate(now);
            case PENDING -> {
                record.setOptInDate(null);
                record.setOptOutDate(null);
            }
            case UNKNOWN -> throw new InvalidConsentTransitionException(from, to);
        }
        record.setStatus(to);
        record.setSource(source);
        record.setVersion(record.getVersion() + 1);
        record.getAuditTrail().add(consentEngine.createAuditEntry(from + "->" + to, source, context));
        record.setUpdatedAt(now);

        ConsentRecord saved = consentRepository.save(record);
        log.info("Consent changed tenant={} phone={} type={} {} -> {} version={}",
                tenantId, normalized, type, from, to, saved.getVersion());
        auditService.logConsentChange(tenantId, String.valueOf(saved.getId()), from.name(), to.name(),
                source != null ? source.name() : null);
        return saved;
    }

    private String normalize(String phone) {
        return phoneNumbers.normalize(phone)
                .orElseThrow(() -> new IllegalArgumentException("Phone number format is invalid"));
    }
}
