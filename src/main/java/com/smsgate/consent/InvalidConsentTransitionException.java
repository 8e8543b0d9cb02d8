package com.smsgate.consent;

public class InvalidConsentTransitionException extends RuntimeException {

    private final ConsentStatus from;
    private final ConsentStatus to;

    public InvalidConsentTransitionException(ConsentStatus from, ConsentStatus to) {
        super("Invalid consent transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public ConsentStatus getFrom() { return from; }
    public ConsentStatus getTo() { return to; }
}
