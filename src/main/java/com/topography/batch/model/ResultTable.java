package com.topography.batch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 批处理结果表：有序的列 + 行（列名到值的映射）。
 * 行中缺失的列视为空单元格（null）。创建后不可变。
 */
public class ResultTable {

    /** 文件名列，结果记录与外部元数据的连接键 */
    public static final String FILE_COLUMN = "file";

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public ResultTable(List<String> columns, List<Map<String, Object>> rows) {
        Set<String> unique = new LinkedHashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String column : columns) {
                normalized.put(column, row.get(column));
            }
            copied.add(Collections.unmodifiableMap(normalized));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    /**
     * 由每个文件的结果记录构建表。
     * 列顺序为各列在记录中首次出现的顺序，缺失的键成为空单元格。
     */
    public static ResultTable fromRecords(List<Map<String, Object>> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            columns.addAll(record.keySet());
        }
        return new ResultTable(new ArrayList<>(columns), records);
    }

    public List<String> getColumns() { return columns; }
    public List<Map<String, Object>> getRows() { return rows; }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Object getValue(int row, String column) {
        return rows.get(row).get(column);
    }

    public List<Object> getColumn(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /** 按键列查找第一行，找不到返回null */
    public Map<String, Object> findRow(String column, Object value) {
        for (Map<String, Object> row : rows) {
            if (keyOf(row.get(column)) != null && keyOf(row.get(column)).equals(keyOf(value))) {
                return row;
            }
        }
        return null;
    }

    /**
     * 内连接：只保留两表中键值都存在的行。
     *
     * 行顺序沿用本表（左表），同一键在右表有多行时逐一组合；
     * 列顺序为左表列在前、右表非键列在后；两表同名的非键列分别加后缀 _x / _y。
     * 键值按字符串比较，数值读入的文件名也能正确匹配。
     *
     * @param right 右表
     * @param key   两表共有的键列
     */
    public ResultTable innerJoin(ResultTable right, String key) {
        if (!hasColumn(key) || !right.hasColumn(key)) {
            throw new IllegalArgumentException("Both tables must contain key column '" + key + "'");
        }

        Map<String, String> leftNames = new LinkedHashMap<>();
        for (String column : columns) {
            boolean clash = !column.equals(key) && right.hasColumn(column);
            leftNames.put(column, clash ? column + "_x" : column);
        }
        Map<String, String> rightNames = new LinkedHashMap<>();
        for (String column : right.columns) {
            if (column.equals(key)) continue;
            rightNames.put(column, hasColumn(column) ? column + "_y" : column);
        }

        Map<String, List<Map<String, Object>>> rightIndex = new HashMap<>();
        for (Map<String, Object> row : right.rows) {
            String k = keyOf(row.get(key));
            if (k != null) {
                rightIndex.computeIfAbsent(k, ignored -> new ArrayList<>()).add(row);
            }
        }

        List<String> joinedColumns = new ArrayList<>(leftNames.values());
        joinedColumns.addAll(rightNames.values());
        List<Map<String, Object>> joinedRows = new ArrayList<>();
        for (Map<String, Object> leftRow : rows) {
            List<Map<String, Object>> matches = rightIndex.get(keyOf(leftRow.get(key)));
            if (matches == null) continue;
            for (Map<String, Object> rightRow : matches) {
                Map<String, Object> joined = new LinkedHashMap<>();
                leftNames.forEach((column, name) -> joined.put(name, leftRow.get(column)));
                rightNames.forEach((column, name) -> joined.put(name, rightRow.get(column)));
                joinedRows.add(joined);
            }
        }
        return new ResultTable(joinedColumns, joinedRows);
    }

    private static String keyOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public String toString() {
        return "ResultTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
