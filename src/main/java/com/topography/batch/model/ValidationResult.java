package com.topography.batch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次已登记调用的参数验证结果。
 * 错误会阻止批处理执行，警告只记录日志。
 */
public class ValidationResult {
    private final String functionId;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public ValidationResult(String functionId) {
        this.functionId = functionId;
    }

    public static ValidationResult failure(String functionId, String error) {
        ValidationResult result = new ValidationResult(functionId);
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public String getFunctionId() { return functionId; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    /** 形如 "filter: error1; error2" 的单行摘要 */
    public String summary() {
        return functionId + ": " + String.join("; ", errors);
    }
}
