package com.topography.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置文件中的调用表达式，如 {@code filter(lowpass, 80)} 或 {@code Smc(p=5)}。
 *
 * 多个表达式以分号分隔。参数值的解析规则：带引号的为字符串，
 * null为空值，true/false为布尔值，可解析为数字的为Double，其余按字符串处理。
 */
public final class CallExpression {

    private final String identifier;
    private final List<Object> args;
    private final Map<String, Object> kwargs;

    private CallExpression(String identifier, List<Object> args, Map<String, Object> kwargs) {
        this.identifier = identifier;
        this.args = Collections.unmodifiableList(args);
        this.kwargs = Collections.unmodifiableMap(kwargs);
    }

    public String getIdentifier() { return identifier; }
    public List<Object> getArgs() { return args; }
    public Map<String, Object> getKwargs() { return kwargs; }

    /**
     * 解析分号分隔的表达式列表，空白条目被忽略
     */
    public static List<CallExpression> parseList(String text) {
        List<CallExpression> calls = new ArrayList<>();
        if (text == null) return calls;
        for (String part : split(text, ';')) {
            if (!part.isBlank()) {
                calls.add(parse(part));
            }
        }
        return calls;
    }

    public static CallExpression parse(String text) {
        String expr = text.trim();
        int open = expr.indexOf('(');
        if (open < 0) {
            checkIdentifier(expr, text);
            return new CallExpression(expr, new ArrayList<>(), new LinkedHashMap<>());
        }
        if (!expr.endsWith(")")) {
            throw new IllegalArgumentException("Missing closing parenthesis in call expression: " + text);
        }
        String identifier = expr.substring(0, open).trim();
        checkIdentifier(identifier, text);

        List<Object> args = new ArrayList<>();
        Map<String, Object> kwargs = new LinkedHashMap<>();
        String inner = expr.substring(open + 1, expr.length() - 1);
        if (!inner.isBlank()) {
            for (String token : split(inner, ',')) {
                int eq = indexOfUnquoted(token, '=');
                if (eq >= 0) {
                    String name = token.substring(0, eq).trim();
                    checkIdentifier(name, text);
                    if (kwargs.containsKey(name)) {
                        throw new IllegalArgumentException("Keyword '" + name + "' repeated in: " + text);
                    }
                    kwargs.put(name, parseValue(token.substring(eq + 1)));
                } else {
                    if (!kwargs.isEmpty()) {
                        throw new IllegalArgumentException("Positional argument follows keyword argument in: " + text);
                    }
                    args.add(parseValue(token));
                }
            }
        }
        return new CallExpression(identifier, args, kwargs);
    }

    static Object parseValue(String token) {
        String value = token.trim();
        if (value.length() >= 2 && (value.startsWith("'") && value.endsWith("'")
                || value.startsWith("\"") && value.endsWith("\""))) {
            return value.substring(1, value.length() - 1);
        }
        if ("null".equals(value)) return null;
        if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static void checkIdentifier(String identifier, String text) {
        if (identifier.isEmpty() || !identifier.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
            throw new IllegalArgumentException("Invalid identifier '" + identifier + "' in call expression: " + text);
        }
    }

    /** 按分隔符切分，引号和括号内的分隔符不计 */
    private static List<String> split(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) quote = 0;
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == separator && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in: " + text);
        }
        parts.add(current.toString());
        return parts;
    }

    private static int indexOfUnquoted(String text, char target) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) quote = 0;
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == target) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return identifier + "(args=" + args + ", kwargs=" + kwargs + ")";
    }
}
