package com.topography.batch.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次分发的结果：每个成功文件一条记录，以及被跳过文件的失败信息
 */
public class DispatchResult {
    private final List<Map<String, Object>> records;
    private final List<TaskFailure> failures;

    public DispatchResult(List<Map<String, Object>> records, List<TaskFailure> failures) {
        this.records = Collections.unmodifiableList(records);
        this.failures = Collections.unmodifiableList(failures);
    }

    /** 按完成顺序排列（顺序模式下即文件列表顺序） */
    public List<Map<String, Object>> getRecords() { return records; }
    public List<TaskFailure> getFailures() { return failures; }
}
