package com.topography.batch.core.impl;

import com.topography.batch.core.FunctionArguments;
import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.model.ArgumentConstraint;
import com.topography.batch.model.FunctionMetadata;
import com.topography.batch.model.ParameterDefinition;
import com.topography.batch.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 能力管理器默认实现。
 * 使用ConcurrentHashMap存储能力表，另行记录注册顺序，
 * 使批量登记参数时的列顺序稳定。
 */
public class DefaultFunctionManager implements FunctionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultFunctionManager.class);

    /** 能力表：functionId -> SurfaceFunction实例 */
    private final ConcurrentHashMap<String, SurfaceFunction> functionRegistry = new ConcurrentHashMap<>();

    /** 注册顺序 */
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();

    @Override
    public boolean registerFunction(String functionId, SurfaceFunction function) {
        if (functionId == null || functionId.isBlank()) {
            log.error("Cannot register function with null or blank id");
            return false;
        }
        if (function == null || function.getMetadata() == null || function.getMetadata().getKind() == null) {
            log.error("Cannot register function '{}' without metadata and kind", functionId);
            return false;
        }

        SurfaceFunction existing = functionRegistry.putIfAbsent(functionId, function);
        if (existing != null) {
            log.warn("Function '{}' is already registered, registration rejected.", functionId);
            return false;
        }
        registrationOrder.add(functionId);

        log.debug("Function '{}' registered as {}", functionId, function.getMetadata().getKind());
        return true;
    }

    @Override
    public SurfaceFunction getFunction(String functionId) {
        return functionId == null ? null : functionRegistry.get(functionId);
    }

    @Override
    public List<SurfaceFunction> getAllFunctions() {
        List<SurfaceFunction> functions = new ArrayList<>();
        for (String id : registrationOrder) {
            functions.add(functionRegistry.get(id));
        }
        return functions;
    }

    @Override
    public List<String> getAvailableParameters() {
        List<String> parameters = new ArrayList<>();
        for (String id : registrationOrder) {
            if (functionRegistry.get(id).getMetadata().isParameter()) {
                parameters.add(id);
            }
        }
        return parameters;
    }

    @Override
    public boolean isParameter(String functionId) {
        SurfaceFunction function = getFunction(functionId);
        return function != null && function.getMetadata().isParameter();
    }

    @Override
    public ValidationResult validateFunction(String functionId, List<Object> args, Map<String, Object> kwargs) {
        ValidationResult result = new ValidationResult(functionId);

        // 检查能力是否存在
        SurfaceFunction function = getFunction(functionId);
        if (function == null) {
            result.addError("Function '" + functionId + "' is not registered.");
            return result;
        }

        FunctionMetadata metadata = function.getMetadata();
        List<ParameterDefinition> definitions = metadata.getParameterDefinitions();

        // 位置/关键字绑定：个数、名称、必选参数
        Map<String, Object> bound;
        try {
            bound = FunctionArguments.bind(functionId, definitions, args, kwargs).asMap();
        } catch (IllegalArgumentException e) {
            result.addError(e.getMessage());
            return result;
        }

        for (ParameterDefinition def : definitions) {
            String paramName = def.getName();
            Object value = bound.get(paramName);

            if (value == null) {
                if (!def.isNullable()) {
                    result.addError("Parameter '" + paramName + "' must not be null.");
                }
                continue;
            }

            // 类型检查与范围校验
            switch (def.getType()) {
                case NUMBER:
                    if (!(value instanceof Number)) {
                        result.addError("Parameter '" + paramName
                                + "' expects NUMBER type, got: " + value.getClass().getSimpleName());
                    } else {
                        double numVal = ((Number) value).doubleValue();
                        if (def.getMinValue() != null && numVal < def.getMinValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " is below minimum " + def.getMinValue());
                        }
                        if (def.getMaxValue() != null && numVal > def.getMaxValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " exceeds maximum " + def.getMaxValue());
                        }
                    }
                    break;

                case STRING:
                    if (!(value instanceof String)) {
                        result.addError("Parameter '" + paramName
                                + "' expects STRING type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                case ENUM:
                    if (!(value instanceof String)) {
                        result.addError("Parameter '" + paramName
                                + "' expects ENUM (String) type, got: " + value.getClass().getSimpleName());
                    } else if (!def.getEnumValues().contains((String) value)) {
                        result.addError("Parameter '" + paramName + "' value '"
                                + value + "' is not in allowed values: " + def.getEnumValues());
                    }
                    break;

                case BOOLEAN:
                    if (!(value instanceof Boolean)) {
                        result.addError("Parameter '" + paramName
                                + "' expects BOOLEAN type, got: " + value.getClass().getSimpleName());
                    }
                    break;
            }
        }

        // 单个参数都合法时再检查跨参数约束
        if (result.isValid()) {
            for (ArgumentConstraint constraint : metadata.getConstraints()) {
                String error = constraint.check(bound);
                if (error != null) {
                    result.addError(error);
                }
            }
        }

        return result;
    }
}
