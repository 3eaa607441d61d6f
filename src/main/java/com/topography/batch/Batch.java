package com.topography.batch;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceLoader;
import com.topography.batch.core.SurfaceTask;
import com.topography.batch.core.TaskExecutor;
import com.topography.batch.core.impl.DefaultFunctionManager;
import com.topography.batch.core.impl.DefaultTaskExecutor;
import com.topography.batch.exception.BatchException;
import com.topography.batch.exception.UnknownFunctionException;
import com.topography.batch.model.DeferredCall;
import com.topography.batch.model.DispatchResult;
import com.topography.batch.model.Operation;
import com.topography.batch.model.Parameter;
import com.topography.batch.model.ResultTable;
import com.topography.batch.model.TaskFailure;
import com.topography.batch.model.ValidationResult;
import com.topography.batch.operators.SurfaceFunctions;
import com.topography.batch.storage.TableStorages;
import com.topography.batch.surface.SdfSurfaceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 表面形貌批处理控制器。
 *
 * 先登记一组操作和参数，再对每个文件依次执行：加载 → 按登记顺序执行操作 → 计算参数，
 * 最后把每个文件一行的结果组装成表，可选地与外部元数据按 file 列内连接并写出。
 *
 * <pre>
 * ResultTable table = new Batch(files, Paths.get("metadata.csv"))
 *         .level()
 *         .filter("lowpass", 80)
 *         .parameter("Sa")
 *         .parameter("Smc", 5.0)
 *         .execute(true, Paths.get("results.xlsx"));
 * </pre>
 *
 * 登记方法返回当前实例，便于链式调用。实例本身不是线程安全的，
 * 应在单个线程中完成登记和执行。
 */
public class Batch {

    private static final Logger log = LoggerFactory.getLogger(Batch.class);

    private final List<Path> filepaths;
    private final ResultTable additionalData;
    private final FunctionManager functionManager;
    private final SurfaceLoader loader;
    private final TaskExecutor executor;

    private final List<Operation> operations = new ArrayList<>();
    private final List<Parameter> parameters = new ArrayList<>();
    private List<TaskFailure> failures = Collections.emptyList();

    public Batch(List<Path> filepaths) {
        this(filepaths, (ResultTable) null);
    }

    /**
     * @param additionalData 元数据表文件（.csv/.xlsx/.db/.sqlite），必须包含 file 列
     */
    public Batch(List<Path> filepaths, Path additionalData) {
        this(filepaths, additionalData == null ? null : TableStorages.forPath(additionalData).read(additionalData));
    }

    public Batch(List<Path> filepaths, ResultTable additionalData) {
        this(filepaths, additionalData, defaultFunctionManager(), new SdfSurfaceLoader(), new DefaultTaskExecutor());
    }

    public Batch(List<Path> filepaths,
                 ResultTable additionalData,
                 FunctionManager functionManager,
                 SurfaceLoader loader,
                 TaskExecutor executor) {
        if (filepaths == null) {
            throw new IllegalArgumentException("File paths must not be null");
        }
        if (additionalData != null && !additionalData.hasColumn(ResultTable.FILE_COLUMN)) {
            throw new BatchException("Additional data must contain a '" + ResultTable.FILE_COLUMN + "' column.");
        }
        this.filepaths = Collections.unmodifiableList(new ArrayList<>(filepaths));
        this.additionalData = additionalData;
        this.functionManager = functionManager;
        this.loader = loader;
        this.executor = executor;
    }

    private static FunctionManager defaultFunctionManager() {
        FunctionManager manager = new DefaultFunctionManager();
        SurfaceFunctions.registerBuiltins(manager);
        return manager;
    }

    // ==================== 操作登记 ====================

    public Batch zero() {
        return addOperation("zero");
    }

    public Batch center() {
        return addOperation("center");
    }

    public Batch level() {
        return addOperation("level");
    }

    public Batch threshold() {
        return addOperation("threshold");
    }

    /**
     * @param threshold 材料比曲线每端剔除的百分比
     */
    public Batch threshold(double threshold) {
        return addOperation("threshold", threshold);
    }

    public Batch removeOutliers() {
        return addOperation("remove_outliers");
    }

    /**
     * @param n      离散度倍数
     * @param method mean（均值与标准差）或 median（中位数与MAD）
     */
    public Batch removeOutliers(double n, String method) {
        return addOperation("remove_outliers", n, method);
    }

    public Batch fillNonmeasured() {
        return addOperation("fill_nonmeasured");
    }

    public Batch fillNonmeasured(String method) {
        return addOperation("fill_nonmeasured", method);
    }

    public Batch filter(String filterType, double cutoff) {
        return addOperation("filter", filterType, cutoff);
    }

    /**
     * @param cutoff2 带通滤波的第二截止波长，其他滤波类型为null
     */
    public Batch filter(String filterType, double cutoff, Double cutoff2) {
        return addOperation("filter", filterType, cutoff, cutoff2);
    }

    public Batch rotate(double angle) {
        return addOperation("rotate", angle);
    }

    public Batch align() {
        return addOperation("align");
    }

    public Batch align(String axis) {
        return addOperation("align", axis);
    }

    public Batch zoom(double factor) {
        return addOperation("zoom", factor);
    }

    /**
     * 按标识符登记能力表中的任意操作，供配置驱动的批处理使用。
     *
     * @throws UnknownFunctionException 标识符不是已注册的操作
     */
    public Batch operation(String identifier, List<Object> args, Map<String, Object> kwargs) {
        if (functionManager.getFunction(identifier) == null || functionManager.isParameter(identifier)) {
            throw new UnknownFunctionException("Batch", identifier);
        }
        operations.add(new Operation(identifier, args, kwargs));
        return this;
    }

    private Batch addOperation(String identifier, Object... args) {
        operations.add(new Operation(identifier, Arrays.asList(args), null));
        return this;
    }

    // ==================== 参数登记 ====================

    /**
     * 登记能力表中公开的任意参数。
     *
     * @throws UnknownFunctionException 标识符不是已公开的参数（未知或是一个操作）
     */
    public Batch parameter(String identifier, Object... args) {
        return parameter(identifier, Arrays.asList(args), null);
    }

    public Batch parameter(String identifier, List<Object> args, Map<String, Object> kwargs) {
        return parameter(new Parameter(identifier, args, kwargs));
    }

    public Batch parameter(Parameter parameter) {
        if (!functionManager.isParameter(parameter.getIdentifier())) {
            throw new UnknownFunctionException("Batch", parameter.getIdentifier());
        }
        parameters.add(parameter);
        return this;
    }

    /**
     * 以默认参数登记全部公开参数，每个一次
     */
    public Batch roughnessParameters() {
        for (String identifier : functionManager.getAvailableParameters()) {
            parameters.add(new Parameter(identifier));
        }
        return this;
    }

    /**
     * 批量登记参数。
     *
     * @param entries 元素为参数标识符（使用默认参数）或完整的 {@link Parameter}
     * @throws UnknownFunctionException 标识符不是已公开的参数
     * @throws IllegalArgumentException 元素类型不受支持
     */
    public Batch roughnessParameters(List<?> entries) {
        List<Parameter> resolved = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            Parameter parameter;
            if (entry instanceof String) {
                parameter = new Parameter((String) entry);
            } else if (entry instanceof Parameter) {
                parameter = (Parameter) entry;
            } else {
                throw new IllegalArgumentException("Parameters must be given as identifier or Parameter, got: "
                        + (entry == null ? "null" : entry.getClass().getName()));
            }
            if (!functionManager.isParameter(parameter.getIdentifier())) {
                throw new UnknownFunctionException("Batch", parameter.getIdentifier());
            }
            resolved.add(parameter);
        }
        parameters.addAll(resolved);
        return this;
    }

    // ==================== 执行 ====================

    public ResultTable execute() {
        return execute(true, null);
    }

    public ResultTable execute(boolean parallel) {
        return execute(parallel, null);
    }

    /**
     * 执行批处理。
     *
     * @param parallel 是否在多个工作线程上并行处理文件
     * @param saveTo   结果输出路径，按扩展名选择格式并覆盖已有文件；为null时不写出
     * @return 每个文件一行的结果表，有元数据时为内连接后的表
     * @throws BatchException 未登记任何操作和参数，或登记的调用参数不合法；均在读取任何文件之前抛出
     */
    public ResultTable execute(boolean parallel, Path saveTo) {
        if (operations.isEmpty() && parameters.isEmpty()) {
            throw new BatchException("No operations or parameters defined.");
        }
        validate(operations);
        validate(parameters);

        List<Operation> ops = Collections.unmodifiableList(new ArrayList<>(operations));
        List<Parameter> params = Collections.unmodifiableList(new ArrayList<>(parameters));
        List<SurfaceTask> tasks = new ArrayList<>(filepaths.size());
        for (Path file : filepaths) {
            tasks.add(new SurfaceTask(file, loader, functionManager, ops, params));
        }

        log.info("Executing batch: {} files, {} operations, {} parameters, parallel={}",
                tasks.size(), ops.size(), params.size(), parallel);
        DispatchResult dispatched = executor.dispatch(tasks, parallel);
        failures = dispatched.getFailures();

        ResultTable table = ResultTable.fromRecords(dispatched.getRecords());
        if (additionalData != null) {
            if (table.isEmpty()) {
                table = new ResultTable(Collections.singletonList(ResultTable.FILE_COLUMN), table.getRows());
            }
            table = additionalData.innerJoin(table, ResultTable.FILE_COLUMN);
            log.info("Joined results with additional data: {} rows", table.size());
        }

        if (saveTo != null) {
            TableStorages.forPath(saveTo).write(table, saveTo);
        }
        return table;
    }

    private void validate(List<? extends DeferredCall> calls) {
        for (DeferredCall call : calls) {
            if (functionManager.getFunction(call.getIdentifier()) == null) {
                throw new UnknownFunctionException("Surface", call.getIdentifier());
            }
            ValidationResult result = functionManager.validateFunction(
                    call.getIdentifier(), call.getArgs(), call.getKwargs());
            if (!result.isValid()) {
                throw new BatchException("Invalid arguments for " + result.summary());
            }
            result.getWarnings().forEach(w -> log.warn("{}: {}", call.getIdentifier(), w));
        }
    }

    public List<Path> getFilepaths() {
        return filepaths;
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public ResultTable getAdditionalData() {
        return additionalData;
    }

    /** 最近一次执行中被跳过的文件，仅在SKIP_AND_REPORT策略下可能非空 */
    public List<TaskFailure> getFailures() {
        return failures;
    }
}
