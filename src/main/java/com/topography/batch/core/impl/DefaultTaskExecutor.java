package com.topography.batch.core.impl;

import com.topography.batch.core.ProgressListener;
import com.topography.batch.core.SurfaceTask;
import com.topography.batch.core.TaskExecutor;
import com.topography.batch.exception.BatchException;
import com.topography.batch.exception.BatchExecutionException;
import com.topography.batch.model.DispatchResult;
import com.topography.batch.model.FailurePolicy;
import com.topography.batch.model.TaskFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 任务分发器默认实现。
 * 每次并行分发创建一个工作窃取线程池，分发结束即关闭；
 * 通过ExecutorCompletionService按完成顺序收集结果。
 */
public class DefaultTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskExecutor.class);

    /** 工作线程数，默认等于可用CPU核数 */
    private final int parallelism;

    private final FailurePolicy failurePolicy;

    private final ProgressListener progressListener;

    /** 执行统计 */
    private final AtomicInteger totalExecuted = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    public DefaultTaskExecutor() {
        this(Runtime.getRuntime().availableProcessors(), FailurePolicy.FAIL_FAST, new LoggingProgressListener());
    }

    public DefaultTaskExecutor(int parallelism, FailurePolicy failurePolicy, ProgressListener progressListener) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.failurePolicy = failurePolicy != null ? failurePolicy : FailurePolicy.FAIL_FAST;
        this.progressListener = progressListener != null ? progressListener : new LoggingProgressListener();

        log.debug("TaskExecutor initialized. Parallelism: {}, FailurePolicy: {}", parallelism, this.failurePolicy);
    }

    @Override
    public DispatchResult dispatch(List<SurfaceTask> tasks, boolean parallel) {
        List<Map<String, Object>> records = new ArrayList<>(tasks.size());
        List<TaskFailure> failures = new ArrayList<>();
        if (parallel) {
            dispatchParallel(tasks, records, failures);
        } else {
            dispatchSequential(tasks, records, failures);
        }
        if (!failures.isEmpty()) {
            log.warn("{} of {} files were skipped due to failures.", failures.size(), tasks.size());
        }
        return new DispatchResult(records, failures);
    }

    private void dispatchSequential(List<SurfaceTask> tasks,
                                    List<Map<String, Object>> records,
                                    List<TaskFailure> failures) {
        progressListener.start(tasks.size(), "Processing");
        try {
            for (SurfaceTask task : tasks) {
                try {
                    records.add(task.call());
                    totalExecuted.incrementAndGet();
                } catch (Exception e) {
                    handleFailure(task.getFile(), e, failures);
                }
                progressListener.advance();
            }
        } finally {
            progressListener.finish();
        }
    }

    private void dispatchParallel(List<SurfaceTask> tasks,
                                  List<Map<String, Object>> records,
                                  List<TaskFailure> failures) {
        ForkJoinPool workerPool = new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in worker thread {}: {}",
                        t.getName(), e.getMessage(), e),
                true  // asyncMode=true，任务之间互不等待
        );
        CompletionService<Map<String, Object>> completionService = new ExecutorCompletionService<>(workerPool);
        Map<Future<Map<String, Object>>, SurfaceTask> submitted = new HashMap<>();

        progressListener.start(tasks.size(), "Processing on " + parallelism + " cores");
        try {
            for (SurfaceTask task : tasks) {
                submitted.put(completionService.submit(task), task);
            }
            // 按完成顺序收集
            for (int i = 0; i < tasks.size(); i++) {
                Future<Map<String, Object>> future = completionService.take();
                SurfaceTask task = submitted.get(future);
                try {
                    records.add(future.get());
                    totalExecuted.incrementAndGet();
                } catch (ExecutionException e) {
                    try {
                        handleFailure(task.getFile(), e.getCause(), failures);
                    } catch (RuntimeException fatal) {
                        submitted.keySet().forEach(f -> f.cancel(true));
                        throw fatal;
                    }
                }
                progressListener.advance();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submitted.keySet().forEach(f -> f.cancel(true));
            throw new BatchExecutionException("Batch dispatch was interrupted", e);
        } finally {
            workerPool.shutdownNow();
            progressListener.finish();
        }
    }

    /**
     * 配置错误对所有文件都成立，任何策略下都终止批处理；
     * 其他失败按失败策略处理。
     */
    private void handleFailure(Path file, Throwable cause, List<TaskFailure> failures) {
        totalFailed.incrementAndGet();
        if (cause instanceof BatchException) {
            log.error("Configuration error while processing '{}': {}", file, cause.getMessage());
            throw (BatchException) cause;
        }
        if (failurePolicy == FailurePolicy.FAIL_FAST) {
            log.error("Processing of '{}' failed, aborting batch: {}", file, cause.getMessage(), cause);
            throw new BatchExecutionException(file, cause);
        }
        log.warn("Skipping '{}': {}", file, cause.getMessage());
        failures.add(new TaskFailure(file, cause));
    }

    public int getParallelism() { return parallelism; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }

    /** 获取执行统计 */
    public int getTotalExecuted() { return totalExecuted.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
}
