package com.smsgate.consent;

import java.time.Instant;
import java.util.Map;

/**
 * Unvalidated consent record as submitted by a caller. Enum-valued fields are raw strings
 * so that bad values surface as validation errors rather than binding failures.
 */
public record ConsentRecordInput(
        String phoneNumber,
        String status,
        String source,
        String type,
        String verificationMethod,
        String legalBasis,
        Instant optInDate,
        Instant optOutDate,
        Instant createdAt,
        Instant updatedAt,
        Map<String, String> metadata,
        String contactId
) {}
