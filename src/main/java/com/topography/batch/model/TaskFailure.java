package com.topography.batch.model;

import java.nio.file.Path;

/**
 * 在SKIP_AND_REPORT策略下被跳过的文件及其失败原因
 */
public class TaskFailure {
    private final Path file;
    private final Throwable cause;

    public TaskFailure(Path file, Throwable cause) {
        this.file = file;
        this.cause = cause;
    }

    public Path getFile() { return file; }
    public Throwable getCause() { return cause; }

    public String getMessage() {
        return cause != null ? cause.getMessage() : null;
    }

    @Override
    public String toString() {
        return "TaskFailure{file=" + file + ", cause=" + cause + "}";
    }
}
