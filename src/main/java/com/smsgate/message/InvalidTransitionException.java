package com.smsgate.message;

public class InvalidTransitionException extends RuntimeException {

    private final MessageStatus from;
    private final MessageStatus to;

    public InvalidTransitionException(MessageStatus from, MessageStatus to) {
        super("Invalid message status transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public MessageStatus getFrom() { return from; }
    public MessageStatus getTo() { return to; }
}
