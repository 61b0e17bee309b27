package com.mirrorup.mirror.service;

public class NoCandidatesException extends MirrorUpException {
    public NoCandidatesException(String message) {
        super(message);
    }
}
