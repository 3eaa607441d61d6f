package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 按文件扩展名选择表格读写实现
 */
public final class TableStorages {

    private TableStorages() {}

    public static TableStorage forPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvTableStorage();
        }
        if (name.endsWith(".xlsx")) {
            return new XlsxTableStorage();
        }
        if (name.endsWith(".db") || name.endsWith(".sqlite")) {
            return new SQLiteTableStorage();
        }
        throw new TableStorageException(path, "Unsupported table format, expected .csv, .xlsx, .db or .sqlite");
    }

    /**
     * 检查读入的表头：列名不能为空，也不能重复
     */
    static void checkHeader(Path path, List<String> header) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (name == null || name.isBlank()) {
                throw new TableStorageException(path, "Header column " + (i + 1) + " has no name");
            }
            if (!seen.add(name)) {
                throw new TableStorageException(path, "Duplicate header column '" + name + "'");
            }
        }
    }
}
