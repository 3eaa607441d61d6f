package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;
import com.topography.batch.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV表格读写（RFC 4180：逗号分隔，双引号包围含特殊字符的字段，字段内双引号写作两个）
 */
public class CsvTableStorage implements TableStorage {

    private static final Logger log = LoggerFactory.getLogger(CsvTableStorage.class);

    @Override
    public ResultTable read(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TableStorageException(path, "Failed to read CSV file", e);
        }
        // 去掉BOM
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }

        List<List<String>> records = parse(path, content);
        if (records.isEmpty()) {
            throw new TableStorageException(path, "CSV file has no header row");
        }
        List<String> header = records.get(0);
        TableStorages.checkHeader(path, header);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (record.size() == 1 && record.get(0).isEmpty()) continue;
            if (record.size() > header.size()) {
                throw new TableStorageException(path, "Row " + (i + 1) + " has more fields than the header");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                row.put(header.get(c), c < record.size() ? CellValues.parse(record.get(c)) : null);
            }
            rows.add(row);
        }
        log.debug("Read {} rows from {}", rows.size(), path);
        return new ResultTable(header, rows);
    }

    @Override
    public void write(ResultTable table, Path path) {
        try {
            createParentDirectories(path);
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writeRecord(writer, table.getColumns());
                for (Map<String, Object> row : table.getRows()) {
                    List<String> fields = new ArrayList<>();
                    for (String column : table.getColumns()) {
                        fields.add(CellValues.format(row.get(column)));
                    }
                    writeRecord(writer, fields);
                }
            }
        } catch (IOException e) {
            throw new TableStorageException(path, "Failed to write CSV file", e);
        }
        log.info("Wrote {} rows to {}", table.size(), path);
    }

    private static void writeRecord(BufferedWriter writer, List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) writer.write(',');
            writer.write(quote(fields.get(i)));
        }
        writer.write("\r\n");
    }

    private static String quote(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }

    private static List<List<String>> parse(Path path, String content) {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < content.length()) {
            char ch = content.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                record.add(field.toString());
                field.setLength(0);
            } else if (ch == '\r' || ch == '\n') {
                if (ch == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                }
                record.add(field.toString());
                field.setLength(0);
                records.add(record);
                record = new ArrayList<>();
            } else {
                field.append(ch);
            }
            i++;
        }
        if (quoted) {
            throw new TableStorageException(path, "Unterminated quoted field in CSV file");
        }
        if (field.length() > 0 || !record.isEmpty()) {
            record.add(field.toString());
            records.add(record);
        }
        return records;
    }

    static void createParentDirectories(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
