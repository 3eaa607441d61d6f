package com.topography.batch.exception;

/**
 * 访问了不存在的能力。
 * 批处理对象上的未知标识与表面对象上缺失的能力抛出同一类异常。
 */
public class UnknownFunctionException extends BatchException {

    private final String owner;
    private final String identifier;

    public UnknownFunctionException(String owner, String identifier) {
        super("'" + owner + "' object has no attribute '" + identifier + "'");
        this.owner = owner;
        this.identifier = identifier;
    }

    public String getOwner() { return owner; }
    public String getIdentifier() { return identifier; }
}
