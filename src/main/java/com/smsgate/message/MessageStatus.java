package com.smsgate.message;

public enum MessageStatus {
    QUEUED,
    SENDING,
    SENT,
    DELIVERED,
    FAILED,
    UNDELIVERED,
    CANCELED
}
