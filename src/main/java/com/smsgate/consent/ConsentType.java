package com.smsgate.consent;

public enum ConsentType {
    MARKETING,
    TRANSACTIONAL,
    INFORMATIONAL,
    EMERGENCY,
    SERVICE,
    ALL
}
