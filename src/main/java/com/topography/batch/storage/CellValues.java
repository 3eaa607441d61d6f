package com.topography.batch.storage;

/**
 * 单元格文本与值之间的转换
 */
final class CellValues {

    private CellValues() {}

    /** 空文本为null，可解析为数值的为Double，其余原样保留 */
    static Object parse(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        String trimmed = text.trim();
        if (looksNumeric(trimmed)) {
            try {
                return Double.valueOf(trimmed);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        return text;
    }

    static String format(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    /** 可作为数值单元格写出的值，NaN和无穷大除外 */
    static boolean isFiniteNumber(Object value) {
        return value instanceof Number && Double.isFinite(((Number) value).doubleValue());
    }

    // 避免把 "Infinity"、"NaN"、"1d" 这类Java可解析的文本当作数值
    private static boolean looksNumeric(String text) {
        if (text.isEmpty()) return false;
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        return (Character.isDigit(first) || first == '-' || first == '+' || first == '.')
                && (Character.isDigit(last) || last == '.');
    }
}
