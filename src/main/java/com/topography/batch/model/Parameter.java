package com.topography.batch.model;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.exception.BatchException;
import com.topography.batch.surface.Surface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从表面数据计算参数的延迟调用。
 *
 * 计算结果转换为列名到值的映射：
 * <pre>
 * Parameter sa = new Parameter("Sa");
 * sa.calculateFrom(surface, functions);       // {Sa=0.42}
 *
 * // 能力元数据登记了返回标签 ("mean", "std")
 * Parameter stats = new Parameter("height_statistics");
 * stats.calculateFrom(surface, functions);    // {height_statistics_mean=1.2, height_statistics_std=0.3}
 * </pre>
 */
public final class Parameter extends DeferredCall {

    public Parameter(String identifier) {
        this(identifier, null, null);
    }

    public Parameter(String identifier, List<Object> args, Map<String, Object> kwargs) {
        super(identifier, args, kwargs);
    }

    /**
     * 计算参数值。
     *
     * @return 标量结果为 {identifier: value}；多值结果为 {identifier_label: value}，按返回顺序
     * @throws BatchException 多值结果没有登记返回标签，或标签数与返回值个数不一致
     */
    public Map<String, Object> calculateFrom(Surface surface, FunctionManager functionManager) {
        SurfaceFunction function = resolve(functionManager);
        Object result = function.invoke(surface, getArgs(), getKwargs());

        List<Object> values = asList(result);
        if (values == null) {
            Map<String, Object> scalar = new LinkedHashMap<>();
            scalar.put(getIdentifier(), result);
            return scalar;
        }

        List<String> labels = function.getMetadata().getReturnLabels();
        if (labels == null) {
            throw new BatchException("No return labels registered for Surface." + getIdentifier() + ".");
        }
        if (labels.size() != values.size()) {
            throw new BatchException("Number of registered return labels (" + labels.size()
                    + ") does not match number of returned values (" + values.size()
                    + ") for Surface." + getIdentifier() + ".");
        }
        Map<String, Object> labelled = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            labelled.put(getIdentifier() + "_" + labels.get(i), values.get(i));
        }
        return labelled;
    }

    /** 类列表结果转为List；标量返回null */
    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object result) {
        if (result instanceof double[]) {
            List<Object> list = new ArrayList<>();
            for (double v : (double[]) result) list.add(v);
            return list;
        }
        if (result instanceof int[]) {
            List<Object> list = new ArrayList<>();
            for (int v : (int[]) result) list.add(v);
            return list;
        }
        if (result instanceof Object[]) {
            return Arrays.asList((Object[]) result);
        }
        if (result instanceof List) {
            return Collections.unmodifiableList((List<Object>) result);
        }
        return null;
    }
}
