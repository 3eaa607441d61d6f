package com.topography.batch.surface;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurfaceTest {

    private static final double EPS = 1e-9;

    private static Surface plane(int ny, int nx, double b0, double bx, double by) {
        double[][] d = new double[ny][nx];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                d[r][c] = b0 + bx * c + by * r;
            }
        }
        return new Surface(d, 1.0, 1.0);
    }

    private static Surface constant(int ny, int nx, double value) {
        return plane(ny, nx, value, 0, 0);
    }

    @Test
    @DisplayName("ragged data and non-positive steps are rejected")
    void invalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new Surface(new double[][] {{1, 2}, {3}}, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> new Surface(new double[][] {{1}}, 0.0, 1.0));
    }

    @Test
    @DisplayName("inplace=false leaves the original untouched")
    void copySemantics() {
        Surface original = plane(3, 3, 5, 1, 0);

        Surface zeroed = original.zero(false);

        assertNotSame(original, zeroed);
        assertEquals(5.0, original.get(0, 0), EPS);
        assertEquals(0.0, zeroed.get(0, 0), EPS);
        assertSame(original, original.zero(true));
        assertEquals(0.0, original.get(0, 0), EPS);
    }

    @Test
    @DisplayName("center shifts the mean height to zero")
    void center() {
        Surface s = plane(4, 4, 3, 1, 2).center(true);

        assertEquals(0.0, s.heightStatistics()[0], EPS);
    }

    @Test
    @DisplayName("level removes a tilted plane")
    void level() {
        Surface s = plane(5, 6, 1.0, 0.5, -0.25).level(true);

        for (int r = 0; r < s.getHeight(); r++) {
            for (int c = 0; c < s.getWidth(); c++) {
                assertEquals(0.0, s.get(r, c), 1e-6);
            }
        }
    }

    @Test
    @DisplayName("threshold outside [0, 50) is rejected")
    void thresholdRange() {
        Surface s = constant(2, 2, 1);

        assertThrows(IllegalArgumentException.class, () -> s.threshold(50, false));
        assertThrows(IllegalArgumentException.class, () -> s.threshold(-1, false));
    }

    @Test
    @DisplayName("remove_outliers masks a single spike")
    void removeOutliers() {
        double[][] d = new double[5][5];
        d[2][2] = 100;
        Surface s = new Surface(d, 1.0, 1.0);

        assertEquals(1, s.removeOutliers(3, "mean", false).countNonmeasured());
        assertThrows(IllegalArgumentException.class, () -> s.removeOutliers(3, "mode", false));
    }

    @Test
    @DisplayName("fill_nonmeasured replaces every NaN")
    void fillNonmeasured() {
        double[][] d = {{1, 2, 3}, {4, Double.NaN, 6}, {7, 8, Double.NaN}};
        Surface s = new Surface(d, 1.0, 1.0);

        assertEquals(0, s.fillNonmeasured("nearest", false).countNonmeasured());
        Surface linear = s.fillNonmeasured("linear", false);
        assertEquals(5.0, linear.get(1, 1), EPS);
        assertEquals(0, linear.countNonmeasured());
    }

    @Test
    @DisplayName("fill_nonmeasured fails on a surface without measured points")
    void fillNothingMeasured() {
        Surface s = new Surface(new double[][] {{Double.NaN}}, 1.0, 1.0);

        assertThrows(IllegalStateException.class, () -> s.fillNonmeasured("nearest", true));
    }

    @Test
    @DisplayName("Gaussian filter keeps a constant surface in lowpass and removes it in highpass")
    void filterConstant() {
        Surface s = constant(8, 8, 2.0);

        Surface low = s.filter("lowpass", 3.0, null, false);
        Surface high = s.filter("highpass", 3.0, null, false);
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                assertEquals(2.0, low.get(r, c), 1e-9);
                assertEquals(0.0, high.get(r, c), 1e-9);
            }
        }
    }

    @Test
    @DisplayName("bandpass requires cutoff2 greater than cutoff")
    void bandpassCutoffs() {
        Surface s = constant(4, 4, 1.0);

        assertThrows(IllegalArgumentException.class, () -> s.filter("bandpass", 5.0, null, false));
        assertThrows(IllegalArgumentException.class, () -> s.filter("bandpass", 5.0, 2.0, false));
        assertThrows(IllegalArgumentException.class, () -> s.filter("notch", 5.0, null, false));
        assertNotNull(s.filter("bandpass", 2.0, 5.0, false));
    }

    @Test
    @DisplayName("rotation keeps the size and the center point")
    void rotate() {
        Surface s = plane(5, 5, 0, 1, 10);

        Surface rotated = s.rotate(90, false);

        assertEquals(5, rotated.getWidth());
        assertEquals(5, rotated.getHeight());
        assertEquals(s.get(2, 2), rotated.get(2, 2), 1e-9);
        assertEquals(s.get(1, 3), s.rotate(360, false).get(1, 3), EPS);
    }

    @Test
    @DisplayName("align leaves texture already along y unchanged")
    void alignAlreadyAligned() {
        double[][] d = new double[6][6];
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                d[r][c] = c % 2 == 0 ? 1.0 : -1.0;
            }
        }
        Surface s = new Surface(d, 1.0, 1.0);

        Surface aligned = s.align("y", false);

        assertEquals(0, aligned.countNonmeasured());
        assertThrows(IllegalArgumentException.class, () -> s.align("z", false));
    }

    @Test
    @DisplayName("zoom crops the central region")
    void zoom() {
        Surface s = plane(4, 4, 0, 1, 10);

        Surface zoomed = s.zoom(2, false);

        assertEquals(2, zoomed.getWidth());
        assertEquals(2, zoomed.getHeight());
        assertEquals(s.get(1, 1), zoomed.get(0, 0), EPS);
        assertThrows(IllegalArgumentException.class, () -> s.zoom(0.5, false));
    }

    @Test
    @DisplayName("height parameters of an alternating surface")
    void heightParameters() {
        Surface s = new Surface(new double[][] {{1, -1}, {-1, 1}}, 1.0, 1.0);

        assertEquals(1.0, s.Sa(), EPS);
        assertEquals(1.0, s.Sq(), EPS);
        assertEquals(1.0, s.Sp(), EPS);
        assertEquals(1.0, s.Sv(), EPS);
        assertEquals(2.0, s.Sz(), EPS);
        assertEquals(0.0, s.Ssk(), EPS);
        assertEquals(1.0, s.Sku(), EPS);
        assertEquals(50.0, s.Smr(0.5), EPS);
    }

    @Test
    @DisplayName("height parameters use population moments")
    void populationMoments() {
        Surface s = new Surface(new double[][] {{0, 0}, {0, 4}}, 1.0, 1.0);

        assertEquals(1.5, s.Sa(), EPS);
        assertEquals(Math.sqrt(3), s.Sq(), EPS);
        assertEquals(2 / Math.sqrt(3), s.Ssk(), EPS);
        assertEquals(7.0 / 3.0, s.Sku(), EPS);
        assertArrayEquals(new double[] {1.0, Math.sqrt(3)}, s.heightStatistics(), EPS);
    }

    @Test
    @DisplayName("hybrid parameters of a unit slope")
    void slopeParameters() {
        Surface s = plane(3, 3, 0, 1, 0);

        assertEquals(1.0, s.Sdq(), EPS);
        assertEquals((Math.sqrt(2) - 1) * 100, s.Sdr(), EPS);
    }

    @Test
    @DisplayName("parameters ignore non-measured points")
    void nonmeasuredIgnored() {
        Surface s = new Surface(new double[][] {{1, Double.NaN}, {-1, Double.NaN}}, 1.0, 1.0);

        assertEquals(1.0, s.Sa(), EPS);
        double[] stats = s.heightStatistics();
        assertEquals(0.0, stats[0], EPS);
        assertEquals(1.0, stats[1], EPS);
    }
}
