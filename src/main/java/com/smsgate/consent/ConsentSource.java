package com.smsgate.consent;

public enum ConsentSource {
    WEB_FORM,
    SMS_KEYWORD,
    API,
    PHONE_CALL,
    EMAIL,
    MOBILE_APP,
    INTEGRATION,
    MANUAL,
    UNKNOWN
}
