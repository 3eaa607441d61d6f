package com.topography.batch.core;

import com.topography.batch.model.ParameterDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次调用绑定后的参数集合。
 *
 * 位置参数按参数定义的顺序绑定，关键字参数按名称绑定，
 * 未提供的可选参数取定义中的默认值。
 */
public final class FunctionArguments {

    private final Map<String, Object> values;

    private FunctionArguments(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * 将位置参数和关键字参数绑定到参数定义。
     *
     * @throws IllegalArgumentException 位置参数过多、关键字参数未定义、
     *                                  同一参数重复赋值或必选参数缺失
     */
    public static FunctionArguments bind(String functionId,
                                         List<ParameterDefinition> definitions,
                                         List<Object> args,
                                         Map<String, Object> kwargs) {
        List<Object> positional = args != null ? args : Collections.emptyList();
        Map<String, Object> named = kwargs != null ? kwargs : Collections.emptyMap();

        if (positional.size() > definitions.size()) {
            throw new IllegalArgumentException(functionId + "() takes at most " + definitions.size()
                    + " positional arguments but " + positional.size() + " were given");
        }

        Map<String, Object> bound = new LinkedHashMap<>();
        for (int i = 0; i < positional.size(); i++) {
            bound.put(definitions.get(i).getName(), positional.get(i));
        }

        for (Map.Entry<String, Object> entry : named.entrySet()) {
            String name = entry.getKey();
            if (definitions.stream().noneMatch(def -> def.getName().equals(name))) {
                throw new IllegalArgumentException(functionId + "() got an unexpected keyword argument '"
                        + name + "'");
            }
            if (bound.containsKey(name)) {
                throw new IllegalArgumentException(functionId + "() got multiple values for argument '"
                        + name + "'");
            }
            bound.put(name, entry.getValue());
        }

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ParameterDefinition def : definitions) {
            if (bound.containsKey(def.getName())) {
                resolved.put(def.getName(), bound.get(def.getName()));
            } else if (def.isRequired()) {
                throw new IllegalArgumentException(functionId + "() missing required argument '"
                        + def.getName() + "'");
            } else {
                resolved.put(def.getName(), def.getDefaultValue());
            }
        }
        return new FunctionArguments(resolved);
    }

    /** 绑定结果，参数名到值，按定义顺序 */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * 获取指定名称的参数，支持数值类型转换。
     *
     * @param name         参数名称
     * @param defaultValue 参数为null时的返回值，同时用于推断返回类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String name, T defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue != null && value instanceof Number) {
            Class<?> targetType = defaultValue.getClass();
            Number number = (Number) value;
            if (targetType == Double.class) {
                return (T) Double.valueOf(number.doubleValue());
            }
            if (targetType == Integer.class) {
                return (T) Integer.valueOf(number.intValue());
            }
            if (targetType == Long.class) {
                return (T) Long.valueOf(number.longValue());
            }
        }
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            throw new IllegalArgumentException("Argument '" + name + "' expects "
                    + defaultValue.getClass().getSimpleName() + ", got: " + value.getClass().getSimpleName());
        }
        return (T) value;
    }

    public double getDouble(String name) {
        Object value = values.get(name);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Argument '" + name + "' expects a number, got: " + value);
        }
        return ((Number) value).doubleValue();
    }

    /** 可为null的数值参数 */
    public Double getOptionalDouble(String name) {
        Object value = values.get(name);
        return value == null ? null : getDouble(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Argument '" + name + "' expects a string, got: " + value);
        }
        return (String) value;
    }

    public boolean getBoolean(String name) {
        return get(name, Boolean.FALSE);
    }
}
