package com.topography.batch.exception;

import java.nio.file.Path;

/**
 * 元数据表读取或结果表导出失败
 */
public class TableStorageException extends RuntimeException {

    private final Path path;

    public TableStorageException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public TableStorageException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
