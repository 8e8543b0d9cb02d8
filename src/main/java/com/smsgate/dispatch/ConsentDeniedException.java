package com.smsgate.dispatch;

import com.smsgate.message.MessageCategory;

public class ConsentDeniedException extends RuntimeException {

    private final MessageCategory category;

    public ConsentDeniedException(MessageCategory category, String reason) {
        super(reason);
        this.category = category;
    }

    public MessageCategory getCategory() { return category; }
}
