package com.topography.batch.core;

import com.topography.batch.exception.SurfaceLoadException;
import com.topography.batch.model.Operation;
import com.topography.batch.model.Parameter;
import com.topography.batch.model.ResultTable;
import com.topography.batch.surface.Surface;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 单个文件的处理任务，批处理并行分发的最小单元。
 *
 * 执行流程：加载表面 → 按登记顺序执行全部操作 → 在最终表面上按登记顺序计算全部参数
 * → 合并为一条以file开头的扁平记录。
 *
 * 任务之间没有共享的可变状态：每个任务加载自己的表面对象，
 * 操作和参数列表只读。
 */
public class SurfaceTask implements Callable<Map<String, Object>> {

    private final Path file;
    private final SurfaceLoader loader;
    private final FunctionManager functionManager;
    private final List<Operation> operations;
    private final List<Parameter> parameters;

    public SurfaceTask(Path file,
                       SurfaceLoader loader,
                       FunctionManager functionManager,
                       List<Operation> operations,
                       List<Parameter> parameters) {
        this.file = file;
        this.loader = loader;
        this.functionManager = functionManager;
        this.operations = operations;
        this.parameters = parameters;
    }

    /**
     * @return 结果记录：file为不含目录的文件名，其余为各参数的结果列
     * @throws SurfaceLoadException 文件不可读或格式错误，原样传播给分发器
     */
    @Override
    public Map<String, Object> call() throws SurfaceLoadException {
        Surface surface = loader.load(file);
        for (Operation operation : operations) {
            operation.executeOn(surface, functionManager);
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(ResultTable.FILE_COLUMN, file.getFileName().toString());
        for (Parameter parameter : parameters) {
            record.putAll(parameter.calculateFrom(surface, functionManager));
        }
        return record;
    }

    public Path getFile() {
        return file;
    }
}
