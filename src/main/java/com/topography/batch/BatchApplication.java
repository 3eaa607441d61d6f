package com.topography.batch;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.impl.DefaultFunctionManager;
import com.topography.batch.core.impl.DefaultTaskExecutor;
import com.topography.batch.core.impl.LoggingProgressListener;
import com.topography.batch.model.ResultTable;
import com.topography.batch.model.TaskFailure;
import com.topography.batch.operators.SurfaceFunctions;
import com.topography.batch.storage.TableStorages;
import com.topography.batch.surface.SdfSurfaceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 命令行入口：按配置文件执行一次批处理。
 *
 * 用法：java -jar surface-batch.jar [配置文件路径]
 */
public class BatchApplication {

    private static final Logger log = LoggerFactory.getLogger(BatchApplication.class);

    /** 参数配置为此值时登记全部公开参数 */
    public static final String ALL_PARAMETERS = "*";

    public ResultTable run(AppConfig config) throws IOException {
        log.info("=== Surface Batch Processing ===");
        log.info("Starting with config: {}", config);

        List<Path> files = collectFiles(Paths.get(config.getInputDir()), config.getInputPattern());
        log.info("Found {} files matching '{}' in {}", files.size(), config.getInputPattern(), config.getInputDir());

        FunctionManager functionManager = new DefaultFunctionManager();
        SurfaceFunctions.registerBuiltins(functionManager);

        DefaultTaskExecutor executor = new DefaultTaskExecutor(
                config.getWorkerParallelism(),
                config.getFailurePolicy(),
                new LoggingProgressListener()
        );

        ResultTable metadata = null;
        if (config.getMetadataPath() != null) {
            Path metadataPath = Paths.get(config.getMetadataPath());
            metadata = TableStorages.forPath(metadataPath).read(metadataPath);
        }

        Batch batch = new Batch(files, metadata, functionManager, new SdfSurfaceLoader(), executor);
        configure(batch, config);

        Path output = config.getOutputPath() == null ? null : Paths.get(config.getOutputPath());
        ResultTable result = batch.execute(config.isParallel(), output);

        for (TaskFailure failure : batch.getFailures()) {
            log.warn("Skipped {}: {}", failure.getFile(), failure.getMessage());
        }
        log.info("=== Batch finished: {} rows, {} columns ===", result.size(), result.getColumns().size());
        return result;
    }

    /**
     * 按配置登记操作和参数
     */
    static void configure(Batch batch, AppConfig config) {
        for (CallExpression call : CallExpression.parseList(config.getOperations())) {
            batch.operation(call.getIdentifier(), call.getArgs(), call.getKwargs());
        }
        String parameters = config.getParameters() == null ? "" : config.getParameters().trim();
        if (ALL_PARAMETERS.equals(parameters)) {
            batch.roughnessParameters();
        } else {
            for (CallExpression call : CallExpression.parseList(parameters)) {
                batch.parameter(call.getIdentifier(), call.getArgs(), call.getKwargs());
            }
        }
    }

    /**
     * 列出目录下与glob模式匹配的普通文件，按文件名排序
     */
    static List<Path> collectFiles(Path dir, String pattern) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        Collections.sort(files);
        return files;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) throws IOException {
        String configPath = (args.length > 0) ? args[0] : "config/batch.properties";

        AppConfig config = AppConfig.load(configPath);
        new BatchApplication().run(config);
    }
}
