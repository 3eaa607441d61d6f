package com.topography.batch.exception;

import java.nio.file.Path;

/**
 * 单个文件的任务失败，在快速失败策略下终止整个批处理。
 * 原始异常（加载错误、配置错误等）通过getCause()获取。
 */
public class BatchExecutionException extends RuntimeException {

    private final Path file;

    public BatchExecutionException(Path file, Throwable cause) {
        super("Processing of '" + (file != null ? file.getFileName() : null) + "' failed: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.file = file;
    }

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.file = null;
    }

    /** 失败的文件；中断等非文件级失败时为null */
    public Path getFile() { return file; }
}
