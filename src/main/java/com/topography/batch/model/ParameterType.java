package com.topography.batch.model;

/**
 * 调用参数的取值类型
 */
public enum ParameterType {
    NUMBER,
    STRING,
    /** 取值限定在enumValues中的字符串 */
    ENUM,
    BOOLEAN
}
