package com.topography.batch.model;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.surface.Surface;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对表面数据原地执行的操作。
 * 无论调用方传入什么，inplace总是被强制为true，执行时不会产生新的表面对象。
 */
public final class Operation extends DeferredCall {

    public static final String INPLACE = "inplace";

    public Operation(String identifier) {
        this(identifier, null, null);
    }

    public Operation(String identifier, List<Object> args, Map<String, Object> kwargs) {
        super(identifier, args, forceInplace(kwargs));
    }

    /**
     * 在表面上执行本操作，返回值被丢弃
     */
    public void executeOn(Surface surface, FunctionManager functionManager) {
        resolve(functionManager).invoke(surface, getArgs(), getKwargs());
    }

    private static Map<String, Object> forceInplace(Map<String, Object> kwargs) {
        Map<String, Object> forced = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);
        forced.put(INPLACE, Boolean.TRUE);
        return forced;
    }
}
