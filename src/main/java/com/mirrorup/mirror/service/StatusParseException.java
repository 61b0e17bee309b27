package com.mirrorup.mirror.service;

public class StatusParseException extends MirrorUpException {
    public StatusParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
