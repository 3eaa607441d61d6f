package com.topography.batch.operators;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.model.ParameterDefinition;
import com.topography.batch.model.ParameterType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 表面对象公开能力的登记表。
 *
 * 操作的最后一个参数统一为inplace；批处理登记的操作总是强制inplace=true。
 * 参数按此处的注册顺序构成全部可用参数列表。
 */
public final class SurfaceFunctions {

    private static final Logger log = LoggerFactory.getLogger(SurfaceFunctions.class);

    public static final String INPLACE = "inplace";

    private SurfaceFunctions() {}

    /**
     * 注册表面对象的全部预置操作和参数
     */
    public static void registerBuiltins(FunctionManager functionManager) {
        for (SurfaceFunction function : operations()) {
            functionManager.registerFunction(function.getMetadata().getFunctionId(), function);
        }
        for (SurfaceFunction function : parameters()) {
            functionManager.registerFunction(function.getMetadata().getFunctionId(), function);
        }
        log.info("Registered {} surface functions, {} of them parameters.",
                functionManager.getAllFunctions().size(), functionManager.getAvailableParameters().size());
    }

    static List<SurfaceFunction> operations() {
        return Arrays.asList(
                MethodFunction.operation("zero", "平移高度使最低点为0",
                        (s, a) -> s.zero(a.getBoolean(INPLACE)),
                        inplace()),
                MethodFunction.operation("center", "平移高度使均值为0",
                        (s, a) -> s.center(a.getBoolean(INPLACE)),
                        inplace()),
                MethodFunction.operation("level", "减去最小二乘拟合平面",
                        (s, a) -> s.level(a.getBoolean(INPLACE)),
                        inplace()),
                MethodFunction.operation("threshold", "剔除材料比曲线两端的点",
                        (s, a) -> s.threshold(a.getDouble("threshold"), a.getBoolean(INPLACE)),
                        number("threshold", 0.5, 0.0, 49.99, "每端剔除的百分比"),
                        inplace()),
                MethodFunction.operation("remove_outliers", "剔除离群点",
                        (s, a) -> s.removeOutliers(a.getDouble("n"), a.getString("method"), a.getBoolean(INPLACE)),
                        number("n", 3.0, 0.0, null, "离散度倍数"),
                        enumeration("method", "mean", Arrays.asList("mean", "median"), "中心值与离散度的计算方法"),
                        inplace()),
                MethodFunction.operation("fill_nonmeasured", "填充未测量点",
                        (s, a) -> s.fillNonmeasured(a.getString("method"), a.getBoolean(INPLACE)),
                        enumeration("method", "nearest", Arrays.asList("nearest", "linear"), "填充方法"),
                        inplace()),
                MethodFunction.operation("filter", "高斯滤波",
                        (s, a) -> s.filter(a.getString("filter_type"), a.getDouble("cutoff"),
                                a.getOptionalDouble("cutoff2"), a.getBoolean(INPLACE)),
                        requiredEnumeration("filter_type", Arrays.asList("lowpass", "highpass", "bandpass"),
                                "滤波类型"),
                        requiredNumber("cutoff", 0.0, "截止波长（µm）"),
                        optionalNumber("cutoff2", "带通滤波的长波截止波长（µm），必须大于cutoff"),
                        inplace())
                        .withConstraint(SurfaceFunctions::checkBandpassCutoffs),
                MethodFunction.operation("rotate", "绕中心旋转",
                        (s, a) -> s.rotate(a.getDouble("angle"), a.getBoolean(INPLACE)),
                        requiredNumber("angle", null, "角度（度）"),
                        inplace()),
                MethodFunction.operation("align", "将主纹理方向与坐标轴对齐",
                        (s, a) -> s.align(a.getString("axis"), a.getBoolean(INPLACE)),
                        enumeration("axis", "y", Arrays.asList("x", "y"), "对齐的坐标轴"),
                        inplace()),
                MethodFunction.operation("zoom", "截取中心区域放大",
                        (s, a) -> s.zoom(a.getDouble("factor"), a.getBoolean(INPLACE)),
                        requiredNumber("factor", 1.0, "放大倍数"),
                        inplace())
        );
    }

    static List<SurfaceFunction> parameters() {
        return Arrays.asList(
                MethodFunction.parameter("Sa", "算术平均高度", (s, a) -> s.Sa()),
                MethodFunction.parameter("Sq", "均方根高度", (s, a) -> s.Sq()),
                MethodFunction.parameter("Sp", "最大峰高", (s, a) -> s.Sp()),
                MethodFunction.parameter("Sv", "最大谷深", (s, a) -> s.Sv()),
                MethodFunction.parameter("Sz", "最大高度", (s, a) -> s.Sz()),
                MethodFunction.parameter("Ssk", "偏斜度", (s, a) -> s.Ssk()),
                MethodFunction.parameter("Sku", "峰度", (s, a) -> s.Sku()),
                MethodFunction.parameter("Sdq", "均方根梯度", (s, a) -> s.Sdq()),
                MethodFunction.parameter("Sdr", "展开界面面积比", (s, a) -> s.Sdr()),
                MethodFunction.parameter("Smc", "逆面积材料比",
                        (s, a) -> s.Smc(a.getDouble("p")),
                        number("p", 10.0, 0.0, 100.0, "材料比（%）")),
                MethodFunction.parameter("Smr", "面积材料比",
                        (s, a) -> s.Smr(a.getDouble("c")),
                        number("c", 1.0, null, null, "相对均值平面的高度（µm）")),
                MethodFunction.labelledParameter("height_statistics", "高度均值与标准差",
                        Arrays.asList("mean", "std"),
                        (s, a) -> s.heightStatistics())
        );
    }

    /** bandpass需要cutoff2且大于cutoff */
    static String checkBandpassCutoffs(Map<String, Object> bound) {
        if (!"bandpass".equals(bound.get("filter_type"))) {
            return null;
        }
        Object cutoff = bound.get("cutoff");
        Object cutoff2 = bound.get("cutoff2");
        if (cutoff2 == null || ((Number) cutoff2).doubleValue() <= ((Number) cutoff).doubleValue()) {
            return "Bandpass filter requires cutoff2 greater than cutoff, got: cutoff=" + cutoff
                    + ", cutoff2=" + cutoff2;
        }
        return null;
    }

    private static ParameterDefinition inplace() {
        return ParameterDefinition.of(INPLACE, ParameterType.BOOLEAN)
                .withDefault(Boolean.FALSE)
                .describedAs("为true时修改当前表面，否则返回副本");
    }

    private static ParameterDefinition number(String name, Double defaultValue, Double min, Double max,
                                              String description) {
        return ParameterDefinition.of(name, ParameterType.NUMBER)
                .withDefault(defaultValue)
                .withRange(min, max)
                .describedAs(description);
    }

    private static ParameterDefinition requiredNumber(String name, Double min, String description) {
        return number(name, null, min, null, description).required();
    }

    private static ParameterDefinition optionalNumber(String name, String description) {
        return number(name, null, null, null, description).nullable();
    }

    private static ParameterDefinition enumeration(String name, String defaultValue, List<String> values,
                                                   String description) {
        return ParameterDefinition.of(name, ParameterType.ENUM)
                .withDefault(defaultValue)
                .withValues(values)
                .describedAs(description);
    }

    private static ParameterDefinition requiredEnumeration(String name, List<String> values, String description) {
        return enumeration(name, null, values, description).required();
    }
}
