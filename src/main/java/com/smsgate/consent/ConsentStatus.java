package com.smsgate.consent;

public enum ConsentStatus {
    UNKNOWN,
    PENDING,
    OPTED_IN,
    OPTED_OUT
}
