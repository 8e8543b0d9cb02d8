package com.smsgate.message;

public enum MessageDirection {
    OUTBOUND,
    INBOUND
}
