package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;
import com.topography.batch.model.ResultTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableStorageTest {

    @TempDir
    Path dir;

    private final CsvTableStorage storage = new CsvTableStorage();

    private static ResultTable table() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("file", "a, first.sdf");
        a.put("Sa", 0.5);
        a.put("note", "say \"hi\"");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("file", "b.sdf");
        b.put("Sa", null);
        b.put("note", "multi\nline");
        return ResultTable.fromRecords(Arrays.asList(a, b));
    }

    @Test
    @DisplayName("quoted fields survive a write and read")
    void writeThenRead() {
        Path file = dir.resolve("out/results.csv");

        storage.write(table(), file);
        ResultTable read = storage.read(file);

        assertEquals(List.of("file", "Sa", "note"), read.getColumns());
        assertEquals("a, first.sdf", read.getValue(0, "file"));
        assertEquals(0.5, read.getValue(0, "Sa"));
        assertEquals("say \"hi\"", read.getValue(0, "note"));
        assertNull(read.getValue(1, "Sa"));
        assertEquals("multi\nline", read.getValue(1, "note"));
    }

    @Test
    @DisplayName("numeric cells are read as Double and text stays text")
    void cellTypes() throws Exception {
        Path file = dir.resolve("meta.csv");
        Files.write(file, "file,thickness,batch\na.sdf,12,B-7\nb.sdf,-0.5,NaN\n".getBytes(StandardCharsets.UTF_8));

        ResultTable read = storage.read(file);

        assertEquals(12.0, read.getValue(0, "thickness"));
        assertEquals(-0.5, read.getValue(1, "thickness"));
        assertEquals("B-7", read.getValue(0, "batch"));
        assertEquals("NaN", read.getValue(1, "batch"));
    }

    @Test
    @DisplayName("existing file is overwritten")
    void overwrite() throws Exception {
        Path file = dir.resolve("results.csv");
        Files.write(file, "old,content\n1,2\n3,4\n5,6\n".getBytes(StandardCharsets.UTF_8));

        storage.write(table(), file);

        assertEquals(2, storage.read(file).size());
    }

    @Test
    @DisplayName("missing file and unterminated quotes raise TableStorageException")
    void readErrors() throws Exception {
        assertThrows(TableStorageException.class, () -> storage.read(dir.resolve("absent.csv")));

        Path broken = dir.resolve("broken.csv");
        Files.write(broken, "file\n\"a.sdf\n".getBytes(StandardCharsets.UTF_8));
        assertThrows(TableStorageException.class, () -> storage.read(broken));
    }

    @Test
    @DisplayName("blank or repeated header names raise TableStorageException")
    void invalidHeader() throws Exception {
        Path blank = dir.resolve("blank.csv");
        Files.write(blank, "file,,thickness\na.sdf,1,2\n".getBytes(StandardCharsets.UTF_8));
        Path repeated = dir.resolve("repeated.csv");
        Files.write(repeated, "file,thickness,thickness\na.sdf,1,2\n".getBytes(StandardCharsets.UTF_8));

        TableStorageException e = assertThrows(TableStorageException.class, () -> storage.read(blank));
        assertEquals(blank, e.getPath());
        e = assertThrows(TableStorageException.class, () -> storage.read(repeated));
        assertTrue(e.getMessage().contains("Duplicate header column 'thickness'"));
    }
}
