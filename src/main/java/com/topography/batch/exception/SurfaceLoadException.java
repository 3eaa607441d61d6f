package com.topography.batch.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 测量文件无法读取或格式错误
 */
public class SurfaceLoadException extends IOException {

    private final Path file;

    public SurfaceLoadException(Path file, String message) {
        super("Cannot load surface from " + file + ": " + message);
        this.file = file;
    }

    public SurfaceLoadException(Path file, String message, Throwable cause) {
        super("Cannot load surface from " + file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() { return file; }
}
