package com.topography.batch.model;

/**
 * 表面能力的类别
 */
public enum FunctionKind {
    /** 原地修改表面数据，返回值被忽略 */
    OPERATION,
    /** 计算并返回一个或多个参数值 */
    PARAMETER
}
