package com.smsgate.message;

/**
 * Delivery channel of a message. Rate limits are tracked separately per type.
 */
public enum MessageType {
    SMS,
    MMS;

    public String lowerName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
