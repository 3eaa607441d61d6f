package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;
import com.topography.batch.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于SQLite的表格读写。
 *
 * 写出时重建数据库文件，结果写入 results 表；列全部为数值时建为REAL，否则为TEXT。
 * 读取时优先读 metadata 表，不存在则读库中第一张表。整数统一转为Double。
 */
public class SQLiteTableStorage implements TableStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTableStorage.class);

    public static final String RESULTS_TABLE = "results";
    public static final String METADATA_TABLE = "metadata";

    @Override
    public ResultTable read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new TableStorageException(path, "Database file does not exist");
        }
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path)) {
            String table = tableExists(conn, METADATA_TABLE) ? METADATA_TABLE : firstTable(conn);
            if (table == null) {
                throw new TableStorageException(path, "Database contains no tables");
            }

            List<String> columns = new ArrayList<>();
            List<Map<String, Object>> rows = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT * FROM " + quote(table))) {
                ResultSetMetaData meta = rs.getMetaData();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnName(i));
                }
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.put(columns.get(i - 1), normalize(rs.getObject(i)));
                    }
                    rows.add(row);
                }
            }
            log.debug("Read {} rows from table '{}' in {}", rows.size(), table, path);
            return new ResultTable(columns, rows);

        } catch (SQLException e) {
            throw new TableStorageException(path, "Failed to read SQLite database", e);
        }
    }

    @Override
    public void write(ResultTable table, Path path) {
        try {
            CsvTableStorage.createParentDirectories(path);
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new TableStorageException(path, "Failed to prepare SQLite database file", e);
        }

        List<String> columns = table.getColumns();
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute(createTableSql(table));
            }

            if (!columns.isEmpty()) {
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(insertSql(columns))) {
                    for (Map<String, Object> row : table.getRows()) {
                        for (int i = 0; i < columns.size(); i++) {
                            bind(stmt, i + 1, row.get(columns.get(i)));
                        }
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            }
        } catch (SQLException e) {
            log.error("Failed to write results to {}: {}", path, e.getMessage(), e);
            throw new TableStorageException(path, "Failed to write SQLite database", e);
        }
        log.info("Wrote {} rows to table '{}' in {}", table.size(), RESULTS_TABLE, path);
    }

    private static String createTableSql(ResultTable table) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(quote(RESULTS_TABLE)).append(" (");
        List<String> columns = table.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(quote(columns.get(i))).append(isNumericColumn(table, columns.get(i)) ? " REAL" : " TEXT");
        }
        return sql.append(")").toString();
    }

    private static String insertSql(List<String> columns) {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(RESULTS_TABLE)).append(" (");
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
                placeholders.append(", ");
            }
            sql.append(quote(columns.get(i)));
            placeholders.append('?');
        }
        return sql.append(") VALUES (").append(placeholders).append(")").toString();
    }

    /** 所有非空值均为数值的列 */
    private static boolean isNumericColumn(ResultTable table, String column) {
        boolean any = false;
        for (Object value : table.getColumn(column)) {
            if (value == null) continue;
            if (!(value instanceof Number)) return false;
            any = true;
        }
        return any;
    }

    private static void bind(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.NULL);
        } else if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                stmt.setNull(index, Types.REAL);
            } else {
                stmt.setDouble(index, d);
            }
        } else {
            stmt.setString(index, String.valueOf(value));
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type='table' AND name=?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String firstTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name NOT LIKE 'sqlite_%' ORDER BY rowid")) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
