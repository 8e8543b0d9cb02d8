package com.smsgate.consent;

public enum VerificationMethod {
    EMAIL_DOUBLE_OPTIN,
    SMS_KEYWORD_CONFIRMATION,
    PHONE_VERIFICATION,
    MANUAL_VERIFICATION,
    API_VERIFICATION,
    NONE
}
