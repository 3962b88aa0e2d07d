package com.watchroom.model;

/**
 * Voice signaling messages and the payload field each one carries.
 */
public enum SignalType {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("candidate");

    private final String payloadField;

    SignalType(String payloadField) {
        this.payloadField = payloadField;
    }

    public String getPayloadField() {
        return payloadField;
    }
}
