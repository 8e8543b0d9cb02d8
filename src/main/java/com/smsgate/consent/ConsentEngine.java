package com.smsgate.consent;

import com.smsgate.config.SmsGateProperties;
import com.smsgate.phone.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Consent rules: the status state machine, record validation, expiry and send allowance.
 * Holds no state beyond configuration and performs no I/O.
 */
@Component
public class ConsentEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsentEngine.class);

    public static final String EXPIRY_DATE_KEY = "expiryDate";

    private static final Map<ConsentStatus, Set<ConsentStatus>> TRANSITIONS = buildTransitions();

    private final PhoneNumbers phoneNumbers;
    private final Clock clock;
    private final int validityMonths;

    public ConsentEngine(PhoneNumbers phoneNumbers, Clock clock, SmsGateProperties properties) {
        this.phoneNumbers = phoneNumbers;
        this.clock = clock;
        this.validityMonths = properties.getConsent().getValidityMonths();
    }

    public boolean isValidTransition(ConsentStatus from, ConsentStatus to) {
        if (from == null || to == null) return false;
        return TRANSITIONS.get(from).contains(to);
    }

    public Set<ConsentStatus> allowedTransitions(ConsentStatus from) {
        return TRANSITIONS.get(from);
    }

    public ConsentValidationResult validateRecord(ConsentRecordInput record) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Instant now = clock.instant();

        if (isBlank(record.phoneNumber())) {
            errors.add("Phone number is required");
        } else if (!phoneNumbers.isValid(record.phoneNumber())) {
            errors.add("Phone number format is invalid");
        }

        ConsentStatus status = null;
        if (isBlank(record.status())) {
            errors.add("Consent status is required");
        } else {
            status = parse(ConsentStatus.class, record.status());
            if (status == null) errors.add("Invalid consent status");
        }

        ConsentSource source = null;
        if (isBlank(record.source())) {
            errors.add("Consent source is required");
        } else {
            source = parse(ConsentSource.class, record.source());
            if (source == null) errors.add("Invalid consent source");
        }

        ConsentType type = null;
        if (!isBlank(record.type())) {
            type = parse(ConsentType.class, record.type());
            if (type == null) errors.add("Invalid consent type");
        }
        if (!isBlank(record.verificationMethod())
                && parse(VerificationMethod.class, record.verificationMethod()) == null) {
            errors.add("Invalid verification method");
        }
        if (!isBlank(record.legalBasis()) && parse(LegalBasis.class, record.legalBasis()) == null) {
            errors.add("Invalid legal basis");
        }

        if (!datesConsistent(record, now)) {
            errors.add("Consent dates are inconsistent");
        }
        if (status != null && !statusMatchesDates(status, record.optInDate(), record.optOutDate())) {
            errors.add("Consent status " + status + " is inconsistent with provided dates");
        }
        if (record.contactId() != null && record.contactId().isBlank()) {
            errors.add("Contact ID must be a non-empty string");
        }

        if (status == ConsentStatus.OPTED_IN && type == ConsentType.MARKETING) {
            if (isBlank(record.verificationMethod())) {
                warnings.add("Verification method recommended for opted-in marketing consent");
            }
            if (record.optInDate() == null) {
                warnings.add("Opt-in date required for marketing consent");
            }
        }
        if (source == ConsentSource.UNKNOWN) {
            warnings.add("Consent source should be specified for better compliance");
        }

        return ConsentValidationResult.of(errors, warnings);
    }

    /**
     * An explicit {@code expiryDate} in metadata (ISO instant or ISO date) wins over the
     * default validity window counted from the opt-in date. No opt-in date means not expired.
     */
    public boolean isExpired(Instant optInDate, Map<String, String> metadata) {
        if (optInDate == null) return false;

        Instant now = clock.instant();
        Instant explicitExpiry = metadata != null ? parseExpiry(metadata.get(EXPIRY_DATE_KEY)) : null;
        if (explicitExpiry != null) {
            return explicitExpiry.isBefore(now);
        }
        Instant validUntil = optInDate.atZone(ZoneOffset.UTC).plusMonths(validityMonths).toInstant();
        return validUntil.isBefore(now);
    }

    public boolean isExpired(Instant optInDate) {
        return isExpired(optInDate, null);
    }

    /**
     * Uses the date-only expiry check. Callers holding metadata should also call
     * {@link #isExpired(Instant, Map)}.
     */
    public boolean allowsMarketing(ConsentStatus status, ConsentType type, Instant optInDate) {
        return status == ConsentStatus.OPTED_IN
                && (type == ConsentType.MARKETING || type == ConsentType.ALL)
                && !isExpired(optInDate);
    }

    public boolean allowsTransactional(ConsentStatus status, ConsentType type) {
        return status == ConsentStatus.OPTED_IN
                && (type == ConsentType.TRANSACTIONAL || type == ConsentType.ALL);
    }

    public ConsentAuditEntry createAuditEntry(String action, ConsentSource source, String context) {
        return new ConsentAuditEntry(action, source, context, clock.instant());
    }

    private boolean datesConsistent(ConsentRecordInput record, Instant now) {
        Instant optIn = record.optInDate();
        Instant optOut = record.optOutDate();
        if (optIn != null && optOut != null && !optOut.isAfter(optIn)) return false;
        if (record.createdAt() != null && record.updatedAt() != null
                && record.updatedAt().isBefore(record.createdAt())) return false;
        if (optIn != null && optIn.isAfter(now)) return false;
        return optOut == null || !optOut.isAfter(now);
    }

    private boolean statusMatchesDates(ConsentStatus status, Instant optIn, Instant optOut) {
        return switch (status) {
            case OPTED_IN -> optIn != null && (optOut == null || !optOut.isAfter(optIn));
            case OPTED_OUT -> optOut != null && (optIn == null || !optOut.isBefore(optIn));
            case PENDING -> optIn == null && optOut == null;
            case UNKNOWN -> true;
        };
    }

    private Instant parseExpiry(String value) {
        if (isBlank(value)) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                log.warn("Ignoring unparseable consent expiryDate '{}'", value);
                return null;
            }
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Map<ConsentStatus, Set<ConsentStatus>> buildTransitions() {
        EnumMap<ConsentStatus, Set<ConsentStatus>> table = new EnumMap<>(ConsentStatus.class);
        table.put(ConsentStatus.UNKNOWN, Collections.unmodifiableSet(
                EnumSet.of(ConsentStatus.PENDING, ConsentStatus.OPTED_IN, ConsentStatus.OPTED_OUT)));
        table.put(ConsentStatus.PENDING, Collections.unmodifiableSet(
                EnumSet.of(ConsentStatus.OPTED_IN, ConsentStatus.OPTED_OUT)));
        table.put(ConsentStatus.OPTED_IN, Collections.unmodifiableSet(EnumSet.of(ConsentStatus.OPTED_OUT)));
        table.put(ConsentStatus.OPTED_OUT, Collections.unmodifiableSet(EnumSet.of(ConsentStatus.OPTED_IN)));
        return Collections.unmodifiableMap(table);
    }
}
