package com.topography.batch.core;

import com.topography.batch.model.DispatchResult;

import java.util.List;

/**
 * 任务分发器接口：将每个文件的处理任务分发到工作线程池或在调用线程上顺序执行。
 *
 * 分发调用阻塞直到全部任务完成，或在快速失败策略下第一个任务失败。
 * 不提供超时和取消：某个任务挂起会使整个批处理停滞。
 */
public interface TaskExecutor {

    /**
     * 执行全部任务并收集结果。
     *
     * 并行模式下结果按完成顺序收集，与提交顺序无关；
     * 顺序模式下在调用线程上按列表顺序执行。
     *
     * @param tasks    每个文件一个任务
     * @param parallel true使用工作线程池，false顺序执行
     * @return 成功任务的记录及被跳过任务的失败信息
     * @throws com.topography.batch.exception.BatchExecutionException 快速失败策略下任一任务失败
     * @throws com.topography.batch.exception.BatchException          任务中发现配置错误（任何策略下都致命）
     */
    DispatchResult dispatch(List<SurfaceTask> tasks, boolean parallel);
}
