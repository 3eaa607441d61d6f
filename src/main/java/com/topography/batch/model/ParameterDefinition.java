package com.topography.batch.model;

import java.util.Collections;
import java.util.List;

/**
 * 表面能力的调用参数定义。
 * 定义顺序即位置参数的顺序。
 *
 * <pre>
 * ParameterDefinition.of("threshold", ParameterType.NUMBER)
 *         .withDefault(0.5)
 *         .withRange(0.0, 49.99);
 * </pre>
 */
public class ParameterDefinition {

    private final String name;
    private final ParameterType type;
    private String description;
    private boolean required;
    /** 允许显式传入null（例如带通滤波的第二截止波长） */
    private boolean nullable;
    private Object defaultValue;
    /** 数值型参数的取值范围 */
    private Double minValue;
    private Double maxValue;
    /** 枚举型参数的可选值列表 */
    private List<String> enumValues = Collections.emptyList();

    private ParameterDefinition(String name, ParameterType type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' must declare a type");
        }
        this.name = name;
        this.type = type;
    }

    public static ParameterDefinition of(String name, ParameterType type) {
        return new ParameterDefinition(name, type);
    }

    public ParameterDefinition describedAs(String description) {
        this.description = description;
        return this;
    }

    /** 必选参数没有默认值，调用时必须提供 */
    public ParameterDefinition required() {
        this.required = true;
        return this;
    }

    public ParameterDefinition nullable() {
        this.nullable = true;
        return this;
    }

    public ParameterDefinition withDefault(Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    /**
     * @param min 下限，null表示不限
     * @param max 上限，null表示不限
     */
    public ParameterDefinition withRange(Double min, Double max) {
        this.minValue = min;
        this.maxValue = max;
        return this;
    }

    public ParameterDefinition withValues(List<String> enumValues) {
        this.enumValues = Collections.unmodifiableList(enumValues);
        return this;
    }

    public String getName() { return name; }
    public ParameterType getType() { return type; }
    public String getDescription() { return description; }
    public boolean isRequired() { return required; }
    public boolean isNullable() { return nullable; }
    public Object getDefaultValue() { return defaultValue; }
    public Double getMinValue() { return minValue; }
    public Double getMaxValue() { return maxValue; }
    public List<String> getEnumValues() { return enumValues; }

    @Override
    public String toString() {
        return name + ":" + type + (required ? "" : "=" + defaultValue);
    }
}
