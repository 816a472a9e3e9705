package org.example.gis2bim.conversion.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ISO-10303-21 文本的编码与解码工具（写出器和检查器共用）。
 * <p>
 * 字符串规则：
 * <ul>
 *   <li>单引号写成两个单引号，反斜杠写成两个反斜杠</li>
 *   <li>非 ASCII 字符用 {@code \X2\hhhh...\X0\}（UTF-16 码元，4 位十六进制）包裹，补充平面字符用 {@code \X4\}</li>
 * </ul>
 */
public final class StepText {

    public static final String NULL = "$";
    public static final String DERIVED = "*";

    private StepText() {
    }

    /**
     * 编码为带引号的 STEP 字符串；{@code null} 写成 {@code $}。
     */
    public static String string(String value) {
        if (value == null) {
            return NULL;
        }
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append('\'');
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c >= 0x20 && c < 0x7F) {
                if (c == '\'') {
                    out.append("''");
                } else if (c == '\\') {
                    out.append("\\\\");
                } else {
                    out.append(c);
                }
                i++;
                continue;
            }
            // 连续的非 ASCII 字符合并到同一个 \X2\ 块
            int end = i;
            boolean supplementary = false;
            while (end < value.length()) {
                char d = value.charAt(end);
                if (d >= 0x20 && d < 0x7F) {
                    break;
                }
                supplementary |= Character.isSurrogate(d);
                end++;
            }
            String run = value.substring(i, end);
            if (supplementary) {
                out.append("\\X4\\");
                run.codePoints().forEach(cp -> out.append(String.format(Locale.ROOT, "%08X", cp)));
            } else {
                out.append("\\X2\\");
                for (int k = 0; k < run.length(); k++) {
                    out.append(String.format(Locale.ROOT, "%04X", (int) run.charAt(k)));
                }
            }
            out.append("\\X0\\");
            i = end;
        }
        out.append('\'');
        return out.toString();
    }

    /**
     * STEP 实数：必须带小数点（{@code 1.}、{@code 0.5}、{@code 1.5E-05}）。
     */
    public static String real(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("STEP 不支持非有限实数：" + value);
        }
        if (value == 0.0) {
            return "0.";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value) + ".";
        }
        String text = Double.toString(value);
        int exponent = text.indexOf('E');
        if (exponent < 0) {
            return text;
        }
        String mantissa = text.substring(0, exponent);
        return (mantissa.contains(".") ? mantissa : mantissa + ".") + text.substring(exponent);
    }

    public static String bool(boolean value) {
        return value ? ".T." : ".F.";
    }

    public static String enumeration(String literal) {
        return "." + literal.toUpperCase(Locale.ROOT) + ".";
    }

    public static String ref(int id) {
        return "#" + id;
    }

    public static String refs(List<Integer> ids) {
        StringBuilder out = new StringBuilder("(");
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append('#').append(ids.get(i));
        }
        return out.append(')').toString();
    }

    public static String reals(double... values) {
        StringBuilder out = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(real(values[i]));
        }
        return out.append(')').toString();
    }

    /**
     * 解析实体引用 {@code #12}；不是引用（如 {@code $}）返回 -1。
     */
    public static int refOf(String arg) {
        if (arg == null) {
            return -1;
        }
        String trimmed = arg.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '#') {
            return -1;
        }
        try {
            return Integer.parseInt(trimmed.substring(1).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * 解析引用列表 {@code (#1,#2)}；不是列表时返回空列表，列表中的非引用成员被忽略。
     */
    public static List<Integer> refList(String arg) {
        List<Integer> out = new ArrayList<>();
        for (String member : listMembers(arg)) {
            int id = refOf(member);
            if (id >= 0) {
                out.add(id);
            }
        }
        return out;
    }

    /**
     * 解析实数；{@code $}、{@code *} 或无法解析时返回 NaN。接受 {@code 1.}、{@code 1.5E-05} 这类 STEP 写法。
     */
    public static double realOf(String arg) {
        if (arg == null) {
            return Double.NaN;
        }
        String trimmed = arg.trim();
        if (trimmed.isEmpty() || NULL.equals(trimmed) || DERIVED.equals(trimmed)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * 解析实数列表 {@code (0.,1.5,2.)}。
     */
    public static double[] realList(String arg) {
        List<String> members = listMembers(arg);
        double[] out = new double[members.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = realOf(members.get(i));
        }
        return out;
    }

    private static List<String> listMembers(String arg) {
        if (arg == null) {
            return List.of();
        }
        String trimmed = arg.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '(' || trimmed.charAt(trimmed.length() - 1) != ')') {
            return List.of();
        }
        return splitArgs(trimmed.substring(1, trimmed.length() - 1));
    }

    /**
     * 把原始字符串内容（去掉外层引号之后）还原为 Unicode 文本：处理 {@code ''}、{@code \\}、
     * {@code \X2\}、{@code \X4\} 和 {@code \X\hh}。
     */
    public static String decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int len = raw.length();
        int i = 0;
        while (i < len) {
            char c = raw.charAt(i);
            if (c == '\'' && i + 1 < len && raw.charAt(i + 1) == '\'') {
                out.append('\'');
                i += 2;
                continue;
            }
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }
            if (i + 1 < len && raw.charAt(i + 1) == '\\') {
                out.append('\\');
                i += 2;
                continue;
            }
            if (i + 3 < len && (raw.charAt(i + 1) == 'X' || raw.charAt(i + 1) == 'x')) {
                char mode = raw.charAt(i + 2);
                if ((mode == '2' || mode == '4') && raw.charAt(i + 3) == '\\') {
                    int close = raw.indexOf("\\X0\\", i + 4);
                    if (close < 0) {
                        close = raw.indexOf("\\x0\\", i + 4);
                    }
                    if (close > 0) {
                        String decoded = decodeHexRun(raw.substring(i + 4, close), mode == '4' ? 8 : 4);
                        if (decoded != null) {
                            out.append(decoded);
                            i = close + 4;
                            continue;
                        }
                    }
                }
                if (mode == '\\' && i + 4 < len) {
                    int hi = Character.digit(raw.charAt(i + 3), 16);
                    int lo = Character.digit(raw.charAt(i + 4), 16);
                    if (hi >= 0 && lo >= 0) {
                        out.append((char) ((hi << 4) | lo));
                        i += 5;
                        continue;
                    }
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static String decodeHexRun(String hex, int width) {
        if (hex.length() % width != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hex.length() / width);
        for (int i = 0; i < hex.length(); i += width) {
            int value;
            try {
                value = Integer.parseUnsignedInt(hex.substring(i, i + width), 16);
            } catch (NumberFormatException e) {
                return null;
            }
            if (width == 8) {
                if (!Character.isValidCodePoint(value)) {
                    return null;
                }
                out.appendCodePoint(value);
            } else {
                out.append((char) value);
            }
        }
        return out.toString();
    }

    /**
     * 跳过字符串字面量，找到与 {@code open} 处左括号匹配的右括号；找不到返回 -1。
     */
    public static int matchingParen(String text, int open) {
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
            } else if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 按最外层逗号切分参数列表（忽略括号内和字符串内的逗号）。
     */
    public static List<String> splitArgs(String args) {
        List<String> out = new ArrayList<>();
        if (args == null || args.isBlank()) {
            return out;
        }
        int depth = 0;
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < args.length() && args.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
            } else if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                out.add(args.substring(start, i).trim());
                start = i + 1;
            }
        }
        out.add(args.substring(start).trim());
        return out;
    }

    /**
     * 提取一段文本里所有字符串字面量（已解码）。
     */
    public static List<String> stringLiterals(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '\'') {
                i++;
                continue;
            }
            int start = ++i;
            while (i < text.length()) {
                if (text.charAt(i) == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i += 2;
                        continue;
                    }
                    break;
                }
                i++;
            }
            out.add(decode(text.substring(start, Math.min(i, text.length()))));
            i++;
        }
        return out;
    }

    public static String firstStringLiteral(String text) {
        List<String> all = stringLiterals(text);
        return all.isEmpty() ? null : all.get(0);
    }
}
