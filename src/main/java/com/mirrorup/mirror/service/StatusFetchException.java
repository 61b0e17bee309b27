package com.mirrorup.mirror.service;

public class StatusFetchException extends MirrorUpException {
    private final String reasonCode;

    public StatusFetchException(String message, String reasonCode) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
