package com.topography.batch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表面能力的元数据，描述标识、类别、参数定义和多值返回标签
 */
public class FunctionMetadata {
    private String functionId;
    private String name;
    private String description;
    private FunctionKind kind;
    /**
     * 多值参数各返回位置的标签，按返回顺序排列。
     * 为null表示该能力只返回单个标量。
     */
    private List<String> returnLabels;
    /** 调用参数定义列表，顺序即位置参数顺序 */
    private List<ParameterDefinition> parameterDefinitions;
    private final List<ArgumentConstraint> constraints = new ArrayList<>();

    public FunctionMetadata() {}

    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public FunctionKind getKind() { return kind; }
    public void setKind(FunctionKind kind) { this.kind = kind; }
    public List<String> getReturnLabels() { return returnLabels; }
    public void setReturnLabels(List<String> returnLabels) { this.returnLabels = returnLabels; }

    public List<ParameterDefinition> getParameterDefinitions() {
        return parameterDefinitions != null ? parameterDefinitions : Collections.emptyList();
    }

    public void setParameterDefinitions(List<ParameterDefinition> parameterDefinitions) {
        this.parameterDefinitions = parameterDefinitions;
    }

    public List<ArgumentConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public void addConstraint(ArgumentConstraint constraint) {
        constraints.add(constraint);
    }

    public boolean isParameter() {
        return kind == FunctionKind.PARAMETER;
    }
}
