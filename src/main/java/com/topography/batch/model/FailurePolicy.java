package com.topography.batch.model;

/**
 * 单个文件任务失败时的处理策略
 */
public enum FailurePolicy {
    /** 第一个失败终止整个批处理，不返回部分结果 */
    FAIL_FAST,
    /** 记录失败并跳过该文件，输出行数相应减少 */
    SKIP_AND_REPORT
}
