package com.fiberfit.service;

import java.nio.file.Path;

public class UnsupportedImageException extends Exception {

    private final Path file;

    public UnsupportedImageException(Path file, String message) {
        super(file.getFileName() + ": " + message);
        this.file = file;
    }

    public UnsupportedImageException(Path file, String message, Throwable cause) {
        super(file.getFileName() + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
