package com.smsgate.message;

/**
 * Legal category of an outbound message; decides which consent gates apply.
 */
public enum MessageCategory {
    MARKETING,
    TRANSACTIONAL
}
