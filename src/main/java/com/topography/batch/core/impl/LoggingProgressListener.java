package com.topography.batch.core.impl;

import com.topography.batch.core.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 以日志形式输出批处理进度，大约每完成10%输出一行
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final AtomicInteger completed = new AtomicInteger(0);
    private volatile int total;
    private volatile int step = 1;
    private volatile String description = "Processing";
    private volatile long startTime;

    @Override
    public void start(int total, String description) {
        this.total = total;
        this.description = description;
        this.step = Math.max(1, total / 10);
        this.startTime = System.currentTimeMillis();
        completed.set(0);
        log.info("{}: {} files", description, total);
    }

    @Override
    public void advance() {
        int done = completed.incrementAndGet();
        if (done % step == 0 || done == total) {
            log.info("{}: {}/{}", description, done, total);
        }
    }

    @Override
    public void finish() {
        log.info("{}: finished {}/{} in {}ms", description, completed.get(), total,
                System.currentTimeMillis() - startTime);
    }

    public int getCompleted() {
        return completed.get();
    }
}
