package com.topography.batch.core;

/**
 * 批处理进度回调。
 * advance在每个任务完成（成功或被跳过）后调用一次，总是在分发线程上调用。
 */
public interface ProgressListener {

    /**
     * 分发开始
     *
     * @param total       任务总数
     * @param description 进度描述，如 "Processing on 8 cores"
     */
    void start(int total, String description);

    /** 一个任务完成 */
    void advance();

    /** 分发结束（包括异常终止） */
    void finish();
}
