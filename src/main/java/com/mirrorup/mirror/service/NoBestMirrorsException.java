package com.mirrorup.mirror.service;

public class NoBestMirrorsException extends MirrorUpException {
    public NoBestMirrorsException(String message) {
        super(message);
    }
}
