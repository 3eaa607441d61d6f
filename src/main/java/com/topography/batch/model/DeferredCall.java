package com.topography.batch.model;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.exception.UnknownFunctionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 延迟调用：表面能力标识 + 位置参数 + 关键字参数。
 * 创建后不可变，可被多个工作线程同时读取。
 */
public abstract class DeferredCall {

    private final String identifier;
    private final List<Object> args;
    private final Map<String, Object> kwargs;

    protected DeferredCall(String identifier, List<Object> args, Map<String, Object> kwargs) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        this.identifier = identifier;
        // 参数值允许为null，不能使用List.copyOf/Map.copyOf
        this.args = args == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public String getIdentifier() { return identifier; }
    public List<Object> getArgs() { return args; }
    public Map<String, Object> getKwargs() { return kwargs; }

    /** 在能力表中查找本调用对应的能力，缺失时与访问不存在的属性报同一类错误 */
    protected SurfaceFunction resolve(FunctionManager functionManager) {
        SurfaceFunction function = functionManager.getFunction(identifier);
        if (function == null) {
            throw new UnknownFunctionException("Surface", identifier);
        }
        return function;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeferredCall that = (DeferredCall) o;
        return identifier.equals(that.identifier) && args.equals(that.args) && kwargs.equals(that.kwargs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), identifier, args, kwargs);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + identifier + ", args=" + args + ", kwargs=" + kwargs + "}";
    }
}
