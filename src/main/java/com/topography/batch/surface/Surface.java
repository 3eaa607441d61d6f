package com.topography.batch.surface;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * 表面形貌数据：规则网格上的高度图。
 *
 * 数据按行存储（行对应y方向，列对应x方向），高度单位µm，
 * NaN表示未测量点。横向步距stepX/stepY单位µm。
 *
 * 所有操作都带有inplace参数：为true时修改当前对象并返回自身，
 * 为false时返回修改后的副本，当前对象保持不变。
 * 所有参数计算都以均值平面为参考，忽略未测量点。
 */
public class Surface {

    private double[][] data;
    private final double stepX;
    private final double stepY;

    public Surface(double[][] data, double stepX, double stepY) {
        if (data == null || data.length == 0 || data[0].length == 0) {
            throw new IllegalArgumentException("Surface data must not be empty");
        }
        if (!(stepX > 0) || !(stepY > 0)) {
            throw new IllegalArgumentException("Lateral steps must be positive, got: " + stepX + ", " + stepY);
        }
        int width = data[0].length;
        double[][] copy = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            if (data[r].length != width) {
                throw new IllegalArgumentException("Surface data must be rectangular, row " + r
                        + " has " + data[r].length + " values, expected " + width);
            }
            copy[r] = Arrays.copyOf(data[r], width);
        }
        this.data = copy;
        this.stepX = stepX;
        this.stepY = stepY;
    }

    public int getWidth() { return data[0].length; }
    public int getHeight() { return data.length; }
    public double getStepX() { return stepX; }
    public double getStepY() { return stepY; }

    public double get(int row, int col) {
        return data[row][col];
    }

    /** 返回高度数据的深拷贝 */
    public double[][] getData() {
        double[][] copy = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            copy[r] = Arrays.copyOf(data[r], data[r].length);
        }
        return copy;
    }

    public Surface copy() {
        return new Surface(data, stepX, stepY);
    }

    public int countNonmeasured() {
        int count = 0;
        for (double[] row : data) {
            for (double v : row) {
                if (Double.isNaN(v)) count++;
            }
        }
        return count;
    }

    // ==================== 操作 ====================

    /** 平移高度使最低点为0 */
    public Surface zero(boolean inplace) {
        Surface target = target(inplace);
        double min = Double.POSITIVE_INFINITY;
        for (double v : target.measuredValues()) {
            min = Math.min(min, v);
        }
        if (min != Double.POSITIVE_INFINITY) {
            target.shift(-min);
        }
        return target;
    }

    /** 平移高度使均值为0 */
    public Surface center(boolean inplace) {
        Surface target = target(inplace);
        double mean = target.mean();
        if (!Double.isNaN(mean)) {
            target.shift(-mean);
        }
        return target;
    }

    /** 最小二乘拟合平面 z = b0 + b1*x + b2*y 并减去 */
    public Surface level(boolean inplace) {
        Surface target = target(inplace);
        double[][] d = target.data;
        int n = target.getWidth() * target.getHeight() - target.countNonmeasured();
        if (n < 3) {
            throw new IllegalStateException("At least 3 measured points are required to level, got: " + n);
        }
        double[] z = new double[n];
        double[][] xy = new double[n][];
        int i = 0;
        for (int r = 0; r < d.length; r++) {
            for (int c = 0; c < d[r].length; c++) {
                if (!Double.isNaN(d[r][c])) {
                    z[i] = d[r][c];
                    xy[i] = new double[] {c * stepX, r * stepY};
                    i++;
                }
            }
        }
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(z, xy);
        double[] b = regression.estimateRegressionParameters();
        for (int r = 0; r < d.length; r++) {
            for (int c = 0; c < d[r].length; c++) {
                d[r][c] -= b[0] + b[1] * c * stepX + b[2] * r * stepY;
            }
        }
        return target;
    }

    /**
     * 将材料比曲线上下两端各threshold百分比的点置为未测量。
     *
     * @param threshold 每端剔除的百分比，[0, 50)
     */
    public Surface threshold(double threshold, boolean inplace) {
        if (threshold < 0 || threshold >= 50) {
            throw new IllegalArgumentException("Threshold must be in [0, 50), got: " + threshold);
        }
        Surface target = target(inplace);
        double[] values = target.measuredValues();
        if (threshold == 0 || values.length == 0) {
            return target;
        }
        Percentile percentile = new Percentile();
        percentile.setData(values);
        double lower = percentile.evaluate(threshold);
        double upper = percentile.evaluate(100 - threshold);
        target.mask(lower, upper);
        return target;
    }

    /**
     * 将偏离中心值超过n倍离散度的点置为未测量。
     *
     * @param n      离散度倍数
     * @param method mean：均值±n·标准差；median：中位数±n·中位数绝对偏差
     */
    public Surface removeOutliers(double n, String method, boolean inplace) {
        Surface target = target(inplace);
        double[] values = target.measuredValues();
        if (values.length == 0) {
            return target;
        }
        double center;
        double spread;
        switch (method) {
            case "mean":
                center = mean(values);
                spread = standardDeviation(values);
                break;
            case "median":
                Percentile percentile = new Percentile();
                center = percentile.evaluate(values, 50);
                double[] deviations = new double[values.length];
                for (int i = 0; i < values.length; i++) {
                    deviations[i] = Math.abs(values[i] - center);
                }
                spread = percentile.evaluate(deviations, 50);
                break;
            default:
                throw new IllegalArgumentException("Unknown outlier method: " + method);
        }
        target.mask(center - n * spread, center + n * spread);
        return target;
    }

    /**
     * 填充未测量点。
     *
     * @param method nearest：最近的已测量点（4邻域广度优先）；
     *               linear：沿行线性插值，行内无法插值的点再按nearest填充
     */
    public Surface fillNonmeasured(String method, boolean inplace) {
        Surface target = target(inplace);
        if (target.countNonmeasured() == 0) {
            return target;
        }
        if (target.countNonmeasured() == target.getWidth() * target.getHeight()) {
            throw new IllegalStateException("Surface has no measured points to fill from");
        }
        switch (method) {
            case "nearest":
                target.fillNearest();
                break;
            case "linear":
                target.fillRowsLinear();
                target.fillNearest();
                break;
            default:
                throw new IllegalArgumentException("Unknown fill method: " + method);
        }
        return target;
    }

    /**
     * ISO 16610-61 高斯滤波。
     *
     * @param filterType lowpass / highpass / bandpass
     * @param cutoff     截止波长（µm）
     * @param cutoff2    仅bandpass使用，长波截止波长，必须大于cutoff
     */
    public Surface filter(String filterType, double cutoff, Double cutoff2, boolean inplace) {
        if (!(cutoff > 0)) {
            throw new IllegalArgumentException("Cutoff wavelength must be positive, got: " + cutoff);
        }
        Surface target = target(inplace);
        double[][] result;
        switch (filterType) {
            case "lowpass":
                result = target.gaussian(cutoff);
                break;
            case "highpass":
                result = subtract(target.data, target.gaussian(cutoff));
                break;
            case "bandpass":
                if (cutoff2 == null || cutoff2 <= cutoff) {
                    throw new IllegalArgumentException(
                            "Bandpass filter requires cutoff2 greater than cutoff, got: " + cutoff2);
                }
                result = subtract(target.gaussian(cutoff), target.gaussian(cutoff2));
                break;
            default:
                throw new IllegalArgumentException("Unknown filter type: " + filterType);
        }
        target.data = result;
        return target;
    }

    /**
     * 绕网格中心逆时针旋转，双线性插值，保持尺寸不变，
     * 落在原数据范围之外的点为未测量。
     *
     * @param angle 角度（度）
     */
    public Surface rotate(double angle, boolean inplace) {
        Surface target = target(inplace);
        if (angle % 360 == 0) {
            return target;
        }
        double rad = Math.toRadians(angle);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        int ny = target.getHeight();
        int nx = target.getWidth();
        double cx = (nx - 1) / 2.0;
        double cy = (ny - 1) / 2.0;
        double[][] rotated = new double[ny][nx];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                double dx = (c - cx) * stepX;
                double dy = (r - cy) * stepY;
                double sx = (cos * dx + sin * dy) / stepX + cx;
                double sy = (-sin * dx + cos * dy) / stepY + cy;
                rotated[r][c] = target.bilinear(sy, sx);
            }
        }
        target.data = rotated;
        return target;
    }

    /**
     * 按结构张量估计的主纹理方向旋转，使纹理与指定轴对齐。
     *
     * @param axis x或y
     */
    public Surface align(String axis, boolean inplace) {
        if (!"x".equals(axis) && !"y".equals(axis)) {
            throw new IllegalArgumentException("Axis must be 'x' or 'y', got: " + axis);
        }
        Surface target = target(inplace);
        double gradientAngle = Math.toDegrees(target.dominantGradientOrientation());
        // 纹理线方向与主梯度方向垂直
        double angle = "y".equals(axis) ? -gradientAngle : -(gradientAngle + 90);
        while (angle > 90) angle -= 180;
        while (angle <= -90) angle += 180;
        if (Math.abs(angle) > 1e-9) {
            target.rotate(angle, true);
        }
        return target;
    }

    /**
     * 放大：截取中心区域，尺寸缩小为原来的1/factor，步距不变。
     */
    public Surface zoom(double factor, boolean inplace) {
        if (!(factor >= 1)) {
            throw new IllegalArgumentException("Zoom factor must be >= 1, got: " + factor);
        }
        Surface target = target(inplace);
        int ny = target.getHeight();
        int nx = target.getWidth();
        int newNy = Math.max(1, (int) Math.round(ny / factor));
        int newNx = Math.max(1, (int) Math.round(nx / factor));
        int r0 = (ny - newNy) / 2;
        int c0 = (nx - newNx) / 2;
        double[][] cropped = new double[newNy][];
        for (int r = 0; r < newNy; r++) {
            cropped[r] = Arrays.copyOfRange(target.data[r0 + r], c0, c0 + newNx);
        }
        target.data = cropped;
        return target;
    }

    // ==================== 参数 ====================

    /** 算术平均高度 */
    public double Sa() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        return mean(Arrays.stream(h).map(Math::abs).toArray());
    }

    /** 均方根高度 */
    public double Sq() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        return standardDeviation(h);
    }

    /** 最大峰高 */
    public double Sp() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        return Arrays.stream(h).max().getAsDouble();
    }

    /** 最大谷深（正值） */
    public double Sv() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        return Math.abs(Arrays.stream(h).min().getAsDouble());
    }

    /** 最大高度 */
    public double Sz() {
        return Sp() + Sv();
    }

    /** 偏斜度 */
    public double Ssk() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        double sq = standardDeviation(h);
        return centralMoment(h, 0, 3) / Math.pow(sq, 3);
    }

    /** 峰度 */
    public double Sku() {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        double sq = standardDeviation(h);
        return centralMoment(h, 0, 4) / Math.pow(sq, 4);
    }

    /** 均方根梯度 */
    public double Sdq() {
        double[] slopes = squaredSlopes();
        if (slopes.length == 0) return Double.NaN;
        return Math.sqrt(mean(slopes));
    }

    /** 展开界面面积比（%） */
    public double Sdr() {
        double[] slopes = squaredSlopes();
        if (slopes.length == 0) return Double.NaN;
        double sum = 0;
        for (double s : slopes) sum += Math.sqrt(1 + s) - 1;
        return sum / slopes.length * 100;
    }

    /**
     * 逆面积材料比：使p%的面积位于其上方的高度。
     *
     * @param p 材料比（%）
     */
    public double Smc(double p) {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        if (p <= 0) return Sp();
        if (p >= 100) return -Sv();
        return new Percentile().evaluate(h, 100 - p);
    }

    /**
     * 面积材料比：高度不低于c的面积占比（%）。
     *
     * @param c 相对均值平面的高度（µm）
     */
    public double Smr(double c) {
        double[] h = centeredHeights();
        if (h.length == 0) return Double.NaN;
        int count = 0;
        for (double v : h) {
            if (v >= c) count++;
        }
        return 100.0 * count / h.length;
    }

    /** 原始高度的均值与标准差 */
    public double[] heightStatistics() {
        double[] values = measuredValues();
        if (values.length == 0) return new double[] {Double.NaN, Double.NaN};
        double mean = mean(values);
        return new double[] {mean, standardDeviation(values)};
    }

    // ==================== 内部工具 ====================

    private Surface target(boolean inplace) {
        return inplace ? this : copy();
    }

    double mean() {
        double[] values = measuredValues();
        return values.length == 0 ? Double.NaN : mean(values);
    }

    private double[] measuredValues() {
        return Arrays.stream(data)
                .flatMapToDouble(Arrays::stream)
                .filter(v -> !Double.isNaN(v))
                .toArray();
    }

    private double[] centeredHeights() {
        double[] values = measuredValues();
        if (values.length == 0) return values;
        double mean = mean(values);
        for (int i = 0; i < values.length; i++) {
            values[i] -= mean;
        }
        return values;
    }

    private void shift(double offset) {
        for (double[] row : data) {
            for (int c = 0; c < row.length; c++) {
                row[c] += offset;
            }
        }
    }

    /** 区间[lower, upper]之外的点置为NaN */
    private void mask(double lower, double upper) {
        for (double[] row : data) {
            for (int c = 0; c < row.length; c++) {
                if (row[c] < lower || row[c] > upper) {
                    row[c] = Double.NaN;
                }
            }
        }
    }

    private void fillNearest() {
        int ny = getHeight();
        int nx = getWidth();
        Deque<int[]> queue = new ArrayDeque<>();
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                if (!Double.isNaN(data[r][c])) {
                    queue.add(new int[] {r, c});
                }
            }
        }
        int[][] neighbours = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
        while (!queue.isEmpty()) {
            int[] p = queue.poll();
            for (int[] d : neighbours) {
                int r = p[0] + d[0];
                int c = p[1] + d[1];
                if (r >= 0 && r < ny && c >= 0 && c < nx && Double.isNaN(data[r][c])) {
                    data[r][c] = data[p[0]][p[1]];
                    queue.add(new int[] {r, c});
                }
            }
        }
    }

    private void fillRowsLinear() {
        for (double[] row : data) {
            int last = -1;
            for (int c = 0; c < row.length; c++) {
                if (Double.isNaN(row[c])) continue;
                if (last >= 0 && c - last > 1) {
                    for (int k = last + 1; k < c; k++) {
                        double t = (double) (k - last) / (c - last);
                        row[k] = row[last] + t * (row[c] - row[last]);
                    }
                }
                last = c;
            }
        }
    }

    /** 可分离的高斯低通，权重按有效点归一化，未测量点保持未测量 */
    private double[][] gaussian(double cutoff) {
        double alpha = Math.sqrt(Math.log(2) / Math.PI);
        double[] wx = gaussianWeights(cutoff, stepX, alpha);
        double[] wy = gaussianWeights(cutoff, stepY, alpha);
        int ny = getHeight();
        int nx = getWidth();
        int kx = wx.length / 2;
        int ky = wy.length / 2;

        double[][] pass = new double[ny][nx];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                double sum = 0;
                double weight = 0;
                for (int k = -kx; k <= kx; k++) {
                    int cc = c + k;
                    if (cc < 0 || cc >= nx || Double.isNaN(data[r][cc])) continue;
                    sum += wx[k + kx] * data[r][cc];
                    weight += wx[k + kx];
                }
                pass[r][c] = weight > 0 ? sum / weight : Double.NaN;
            }
        }

        double[][] result = new double[ny][nx];
        for (int r = 0; r < ny; r++) {
            for (int c = 0; c < nx; c++) {
                if (Double.isNaN(data[r][c])) {
                    result[r][c] = Double.NaN;
                    continue;
                }
                double sum = 0;
                double weight = 0;
                for (int k = -ky; k <= ky; k++) {
                    int rr = r + k;
                    if (rr < 0 || rr >= ny || Double.isNaN(pass[rr][c])) continue;
                    sum += wy[k + ky] * pass[rr][c];
                    weight += wy[k + ky];
                }
                result[r][c] = weight > 0 ? sum / weight : Double.NaN;
            }
        }
        return result;
    }

    private static double[] gaussianWeights(double cutoff, double step, double alpha) {
        int half = Math.max(1, (int) Math.ceil(cutoff / step));
        double[] w = new double[2 * half + 1];
        for (int k = -half; k <= half; k++) {
            double x = k * step / (alpha * cutoff);
            w[k + half] = Math.exp(-Math.PI * x * x);
        }
        return w;
    }

    private static double[][] subtract(double[][] a, double[][] b) {
        double[][] result = new double[a.length][];
        for (int r = 0; r < a.length; r++) {
            result[r] = new double[a[r].length];
            for (int c = 0; c < a[r].length; c++) {
                result[r][c] = a[r][c] - b[r][c];
            }
        }
        return result;
    }

    private double bilinear(double row, double col) {
        int r0 = (int) Math.floor(row);
        int c0 = (int) Math.floor(col);
        double fr = row - r0;
        double fc = col - c0;
        // 恰好落在网格线上时不需要越界的邻点
        int r1 = fr < 1e-9 ? r0 : r0 + 1;
        int c1 = fc < 1e-9 ? c0 : c0 + 1;
        if (r0 < 0 || c0 < 0 || r1 >= getHeight() || c1 >= getWidth()) {
            return Double.NaN;
        }
        double top = data[r0][c0] * (1 - fc) + data[r0][c1] * fc;
        double bottom = data[r1][c0] * (1 - fc) + data[r1][c1] * fc;
        return top * (1 - fr) + bottom * fr;
    }

    /** 主梯度方向（弧度，相对x轴），由结构张量求得 */
    private double dominantGradientOrientation() {
        double jxx = 0;
        double jyy = 0;
        double jxy = 0;
        for (int r = 1; r < getHeight() - 1; r++) {
            for (int c = 1; c < getWidth() - 1; c++) {
                double gx = (data[r][c + 1] - data[r][c - 1]) / (2 * stepX);
                double gy = (data[r + 1][c] - data[r - 1][c]) / (2 * stepY);
                if (Double.isNaN(gx) || Double.isNaN(gy)) continue;
                jxx += gx * gx;
                jyy += gy * gy;
                jxy += gx * gy;
            }
        }
        return 0.5 * Math.atan2(2 * jxy, jxx - jyy);
    }

    private double[] squaredSlopes() {
        int ny = getHeight();
        int nx = getWidth();
        double[] slopes = new double[Math.max(0, (ny - 1) * (nx - 1))];
        int n = 0;
        for (int r = 0; r < ny - 1; r++) {
            for (int c = 0; c < nx - 1; c++) {
                double gx = (data[r][c + 1] - data[r][c]) / stepX;
                double gy = (data[r + 1][c] - data[r][c]) / stepY;
                if (Double.isNaN(gx) || Double.isNaN(gy)) continue;
                slopes[n++] = gx * gx + gy * gy;
            }
        }
        return Arrays.copyOf(slopes, n);
    }

    private static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /** 总体标准差（除以n） */
    private static double standardDeviation(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * 总体中心矩（除以n）。
     * commons-math的Skewness/Kurtosis带样本偏差修正，与Ssk/Sku的定义不同，三阶和四阶矩在此直接计算。
     */
    private static double centralMoment(double[] values, double center, int order) {
        double sum = 0;
        for (double v : values) sum += Math.pow(v - center, order);
        return sum / values.length;
    }
}
