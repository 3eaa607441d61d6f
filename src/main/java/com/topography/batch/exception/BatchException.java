package com.topography.batch.exception;

/**
 * 批处理使用错误或配置错误。
 * 在任何文件被读取之前抛出（未登记任何调用、元数据缺少file列、调用参数非法），
 * 或在单个文件处理时发现对所有文件都成立的配置缺陷（多值参数缺少返回标签）。
 */
public class BatchException extends RuntimeException {

    public BatchException(String message) {
        super(message);
    }

    public BatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
