package com.topography.batch.surface;

import com.topography.batch.exception.SurfaceLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SdfSurfaceLoaderTest {

    @TempDir
    Path dir;

    private final SdfSurfaceLoader loader = new SdfSurfaceLoader();

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.ISO_8859_1));
        return file;
    }

    private static String header(int points, int profiles) {
        return "aBCR-1.0\n"
                + "ManufacID   = test\n"
                + "NumPoints   = " + points + "\n"
                + "NumProfiles = " + profiles + "\n"
                + "Xscale      = 2.0E-6\n"
                + "Yscale      = 3.0E-6\n"
                + "Zscale      = 1.0E-6\n"
                + "Zresolution = -1\n"
                + "Compression = 0\n"
                + "DataType    = 7\n"
                + "*\n";
    }

    @Test
    @DisplayName("ASCII file is loaded in micrometres")
    void loadAscii() throws Exception {
        Path file = write("a.sdf", header(3, 2) + "1 2 3\n4 BAD 6\n*\n");

        Surface s = loader.load(file);

        assertEquals(3, s.getWidth());
        assertEquals(2, s.getHeight());
        assertEquals(2.0, s.getStepX(), 1e-9);
        assertEquals(3.0, s.getStepY(), 1e-9);
        assertEquals(6.0, s.get(1, 2), 1e-9);
        assertTrue(Double.isNaN(s.get(1, 1)));
    }

    @Test
    @DisplayName("values may be spread over any number of lines")
    void valuesAcrossLines() throws Exception {
        Path file = write("b.sdf", header(2, 2) + "1\n2\n3 4");

        assertEquals(4.0, loader.load(file).get(1, 1), 1e-9);
    }

    @Test
    @DisplayName("missing file raises SurfaceLoadException")
    void missingFile() {
        Path file = dir.resolve("absent.sdf");

        SurfaceLoadException e = assertThrows(SurfaceLoadException.class, () -> loader.load(file));
        assertEquals(file, e.getFile());
    }

    @Test
    @DisplayName("grid larger than an array can hold is rejected before allocation")
    void oversizedGrid() throws Exception {
        Path file = write("huge.sdf", header(50000, 50000) + "1 2 3\n*\n");

        SurfaceLoadException e = assertThrows(SurfaceLoadException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("2500000000"));
    }

    @Test
    @DisplayName("grid whose point count wraps to zero in int arithmetic is rejected")
    void gridWrappingToZero() throws Exception {
        Path file = write("wrap.sdf", header(65536, 65536) + "1\n*\n");

        SurfaceLoadException e = assertThrows(SurfaceLoadException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("4294967296"));
    }

    @Test
    @DisplayName("wrong number of values is rejected")
    void wrongValueCount() throws Exception {
        Path file = write("c.sdf", header(2, 2) + "1 2 3\n*\n");

        assertThrows(SurfaceLoadException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("binary and unknown signatures are rejected")
    void signatures() throws Exception {
        Path binary = write("d.sdf", "bCR-1.0\n");
        Path unknown = write("e.sdf", "hello\n");

        SurfaceLoadException e = assertThrows(SurfaceLoadException.class, () -> loader.load(binary));
        assertTrue(e.getMessage().contains("binary"));
        assertThrows(SurfaceLoadException.class, () -> loader.load(unknown));
    }

    @Test
    @DisplayName("missing header field is rejected")
    void missingHeaderField() throws Exception {
        Path file = write("f.sdf", "aBCR-1.0\nNumPoints = 1\nNumProfiles = 1\n*\n1\n");

        SurfaceLoadException e = assertThrows(SurfaceLoadException.class, () -> loader.load(file));
        assertTrue(e.getMessage().contains("Xscale"));
    }

    @Test
    @DisplayName("compressed data is rejected")
    void compressed() throws Exception {
        Path file = write("g.sdf", header(1, 1).replace("Compression = 0", "Compression = 1") + "1\n");

        assertThrows(SurfaceLoadException.class, () -> loader.load(file));
    }
}
