package com.topography.batch.surface;

import com.topography.batch.core.SurfaceLoader;
import com.topography.batch.exception.SurfaceLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ISO 25178-71 SDF 文本格式（aBCR-1.0）加载器。
 *
 * 文件结构：
 * <pre>
 * aBCR-1.0
 * NumPoints   = 4        (每行点数，x方向)
 * NumProfiles = 3        (行数，y方向)
 * Xscale      = 1.0E-6   (m)
 * Yscale      = 1.0E-6   (m)
 * Zscale      = 1.0E-6   (m)
 * ...
 * *
 * 数据值，按行排列，空白分隔；BAD或NaN表示未测量点
 * *
 * 可选的尾部信息
 * </pre>
 * 二进制格式（bCR-1.0）和压缩数据不支持。
 */
public class SdfSurfaceLoader implements SurfaceLoader {

    private static final Logger log = LoggerFactory.getLogger(SdfSurfaceLoader.class);

    static final String ASCII_SIGNATURE = "aBCR-1.0";
    static final String BINARY_SIGNATURE = "bCR-1.0";

    /** 文件中的长度单位为m，表面对象使用µm */
    private static final double METERS_TO_MICROMETERS = 1e6;

    /** 单个数组可分配的最大元素数 */
    static final long MAX_POINTS = Integer.MAX_VALUE - 8;

    @Override
    public Surface load(Path file) throws SurfaceLoadException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new SurfaceLoadException(file, "file is not readable", e);
        }
        if (lines.isEmpty()) {
            throw new SurfaceLoadException(file, "file is empty");
        }

        String signature = lines.get(0).trim();
        if (BINARY_SIGNATURE.equals(signature)) {
            throw new SurfaceLoadException(file, "binary SDF files are not supported");
        }
        if (!ASCII_SIGNATURE.equals(signature)) {
            throw new SurfaceLoadException(file, "unknown signature '" + signature + "'");
        }

        // 头部：key = value，以单独一行'*'结束
        Map<String, String> header = new LinkedHashMap<>();
        int index = 1;
        for (; index < lines.size(); index++) {
            String line = lines.get(index).trim();
            if ("*".equals(line)) break;
            if (line.isEmpty()) continue;
            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new SurfaceLoadException(file, "malformed header line " + (index + 1) + ": '" + line + "'");
            }
            header.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
        }
        if (index >= lines.size()) {
            throw new SurfaceLoadException(file, "header is not terminated by '*'");
        }

        int numPoints = intField(file, header, "NumPoints");
        int numProfiles = intField(file, header, "NumProfiles");
        double xScale = doubleField(file, header, "Xscale");
        double yScale = doubleField(file, header, "Yscale");
        double zScale = doubleField(file, header, "Zscale");
        String compression = header.getOrDefault("Compression", "0");
        if (!"0".equals(compression)) {
            throw new SurfaceLoadException(file, "compressed data is not supported (Compression = " + compression + ")");
        }

        long total = (long) numPoints * numProfiles;
        if (total > MAX_POINTS) {
            throw new SurfaceLoadException(file, "NumPoints x NumProfiles = " + total
                    + " exceeds the supported maximum of " + MAX_POINTS);
        }
        double[] values = new double[(int) total];
        int count = 0;
        for (index++; index < lines.size(); index++) {
            String line = lines.get(index).trim();
            if (line.startsWith("*")) break;
            if (line.isEmpty()) continue;
            for (String token : line.split("\\s+")) {
                if (count >= values.length) {
                    throw new SurfaceLoadException(file, "more data values than NumPoints x NumProfiles = "
                            + values.length);
                }
                values[count++] = parseValue(file, token);
            }
        }
        if (count != values.length) {
            throw new SurfaceLoadException(file, "expected " + values.length + " data values, found " + count);
        }

        double[][] data = new double[numProfiles][numPoints];
        double zFactor = zScale * METERS_TO_MICROMETERS;
        for (int r = 0; r < numProfiles; r++) {
            for (int c = 0; c < numPoints; c++) {
                data[r][c] = values[r * numPoints + c] * zFactor;
            }
        }

        log.debug("Loaded surface {} ({} x {} points)", file.getFileName(), numPoints, numProfiles);
        return new Surface(data, xScale * METERS_TO_MICROMETERS, yScale * METERS_TO_MICROMETERS);
    }

    private static int intField(Path file, Map<String, String> header, String key) throws SurfaceLoadException {
        String value = requireField(file, header, key);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new SurfaceLoadException(file, key + " must be positive, got: " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new SurfaceLoadException(file, key + " is not an integer: '" + value + "'", e);
        }
    }

    private static double doubleField(Path file, Map<String, String> header, String key) throws SurfaceLoadException {
        String value = requireField(file, header, key);
        try {
            double parsed = Double.parseDouble(value);
            if (!(parsed > 0)) {
                throw new SurfaceLoadException(file, key + " must be positive, got: " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new SurfaceLoadException(file, key + " is not a number: '" + value + "'", e);
        }
    }

    private static String requireField(Path file, Map<String, String> header, String key) throws SurfaceLoadException {
        String value = header.get(key);
        if (value == null || value.isEmpty()) {
            throw new SurfaceLoadException(file, "missing header field " + key);
        }
        return value;
    }

    private static double parseValue(Path file, String token) throws SurfaceLoadException {
        if ("BAD".equalsIgnoreCase(token) || "NaN".equalsIgnoreCase(token)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new SurfaceLoadException(file, "invalid data value '" + token + "'", e);
        }
    }
}
