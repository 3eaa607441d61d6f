package com.topography.batch.operators;

import com.topography.batch.core.FunctionArguments;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.model.ArgumentConstraint;
import com.topography.batch.model.FunctionKind;
import com.topography.batch.model.FunctionMetadata;
import com.topography.batch.model.ParameterDefinition;
import com.topography.batch.surface.Surface;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 将表面对象的一个方法包装为能力表条目。
 * 调用时先按元数据中的参数定义绑定参数，再交给invoker执行。
 */
public class MethodFunction implements SurfaceFunction {

    /**
     * 以绑定后的参数调用表面方法
     */
    @FunctionalInterface
    public interface Invoker {
        Object invoke(Surface surface, FunctionArguments arguments);
    }

    private final FunctionMetadata metadata;
    private final Invoker invoker;

    public MethodFunction(FunctionMetadata metadata, Invoker invoker) {
        if (metadata == null || metadata.getFunctionId() == null || metadata.getKind() == null) {
            throw new IllegalArgumentException("Function metadata must define id and kind");
        }
        this.metadata = metadata;
        this.invoker = invoker;
    }

    public static MethodFunction operation(String functionId, String description, Invoker invoker,
                                           ParameterDefinition... definitions) {
        return new MethodFunction(metadata(functionId, description, FunctionKind.OPERATION, null, definitions),
                invoker);
    }

    public static MethodFunction parameter(String functionId, String description, Invoker invoker,
                                           ParameterDefinition... definitions) {
        return new MethodFunction(metadata(functionId, description, FunctionKind.PARAMETER, null, definitions),
                invoker);
    }

    /** 多值参数，returnLabels按返回值顺序排列 */
    public static MethodFunction labelledParameter(String functionId, String description, List<String> returnLabels,
                                                   Invoker invoker, ParameterDefinition... definitions) {
        return new MethodFunction(
                metadata(functionId, description, FunctionKind.PARAMETER, returnLabels, definitions), invoker);
    }

    /** 追加一个跨参数约束，在执行前的参数校验中检查 */
    public MethodFunction withConstraint(ArgumentConstraint constraint) {
        metadata.addConstraint(constraint);
        return this;
    }

    @Override
    public Object invoke(Surface surface, List<Object> args, Map<String, Object> kwargs) {
        FunctionArguments arguments = FunctionArguments.bind(
                metadata.getFunctionId(), metadata.getParameterDefinitions(), args, kwargs);
        return invoker.invoke(surface, arguments);
    }

    @Override
    public FunctionMetadata getMetadata() {
        return metadata;
    }

    private static FunctionMetadata metadata(String functionId, String description, FunctionKind kind,
                                             List<String> returnLabels, ParameterDefinition... definitions) {
        FunctionMetadata meta = new FunctionMetadata();
        meta.setFunctionId(functionId);
        meta.setName(functionId);
        meta.setDescription(description);
        meta.setKind(kind);
        meta.setReturnLabels(returnLabels);
        meta.setParameterDefinitions(Arrays.asList(definitions));
        return meta;
    }
}
