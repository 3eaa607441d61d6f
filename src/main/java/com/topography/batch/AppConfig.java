package com.topography.batch;

import com.topography.batch.model.FailurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的批处理参数，读取失败时使用默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    // ---- 输入 ----
    private String inputDir = ".";
    private String inputPattern = "*.sdf";
    private String metadataPath;

    // ---- 处理 ----
    private String operations = "";
    private String parameters = "*";

    // ---- 输出 ----
    private String outputPath;

    // ---- 执行 ----
    private boolean parallel = true;
    private int workerParallelism = Runtime.getRuntime().availableProcessors();
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();
        try (InputStream in = new FileInputStream(configPath)) {
            Properties props = new Properties();
            props.load(in);
            config.apply(props);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return config;
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.apply(props);
        return config;
    }

    /**
     * 先解析全部取值，全部成功后再赋值；任一取值非法时配置保持不变
     */
    private void apply(Properties props) {
        boolean parsedParallel = Boolean.parseBoolean(props.getProperty("batch.parallel", "true").trim());
        int parsedParallelism = Integer.parseInt(props.getProperty("worker.parallelism",
                String.valueOf(Runtime.getRuntime().availableProcessors())).trim());
        FailurePolicy parsedPolicy = FailurePolicy.valueOf(
                props.getProperty("batch.failure.policy", "FAIL_FAST").trim());

        inputDir = props.getProperty("batch.input.dir", ".");
        inputPattern = props.getProperty("batch.input.pattern", "*.sdf");
        metadataPath = blankToNull(props.getProperty("batch.metadata.path"));
        operations = props.getProperty("batch.operations", "");
        parameters = props.getProperty("batch.parameters", "*");
        outputPath = blankToNull(props.getProperty("batch.output.path"));
        parallel = parsedParallel;
        workerParallelism = parsedParallelism;
        failurePolicy = parsedPolicy;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    // ---- Getters ----
    public String getInputDir() { return inputDir; }
    public String getInputPattern() { return inputPattern; }
    public String getMetadataPath() { return metadataPath; }
    public String getOperations() { return operations; }
    public String getParameters() { return parameters; }
    public String getOutputPath() { return outputPath; }
    public boolean isParallel() { return parallel; }
    public int getWorkerParallelism() { return workerParallelism; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }

    @Override
    public String toString() {
        return "AppConfig{input='" + inputDir + "/" + inputPattern + "'"
                + ", operations='" + operations + "'"
                + ", parameters='" + parameters + "'"
                + ", metadata='" + metadataPath + "'"
                + ", output='" + outputPath + "'"
                + ", parallel=" + parallel
                + ", parallelism=" + workerParallelism
                + ", failurePolicy=" + failurePolicy + "}";
    }
}
