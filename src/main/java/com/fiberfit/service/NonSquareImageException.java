package com.fiberfit.service;

import java.nio.file.Path;

public class NonSquareImageException extends Exception {

    private final Path file;

    public NonSquareImageException(Path file, int width, int height) {
        super(String.format("%s: image must be square, got %dx%d", file.getFileName(), width, height));
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
