package com.mirrorup.mirror.service;

import java.nio.file.Path;

public class OutputFileExistsException extends MirrorUpException {
    public OutputFileExistsException(Path path) {
        super("`" + path + "` already exists");
    }
}
