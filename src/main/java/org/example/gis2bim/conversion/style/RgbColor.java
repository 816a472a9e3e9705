package org.example.gis2bim.conversion.style;

import java.util.Locale;

/**
 * RGB 颜色，分量取值 [0, 1]；{@code alpha} 为不透明度（1 = 完全不透明）。
 */
public record RgbColor(double red, double green, double blue, double alpha) {

    public RgbColor {
        requireUnit(red, "red");
        requireUnit(green, "green");
        requireUnit(blue, "blue");
        requireUnit(alpha, "alpha");
    }

    public static RgbColor of(double red, double green, double blue) {
        return new RgbColor(red, green, blue, 1.0);
    }

    /**
     * 解析 {@code #RRGGBB} 或 {@code #RRGGBBAA}（{@code #} 可省略，大小写不敏感）。
     *
     * @throws IllegalArgumentException 格式不合法
     */
    public static RgbColor parseHex(String text) {
        if (text == null) {
            throw new IllegalArgumentException("颜色不能为空");
        }
        String hex = text.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if ((hex.length() != 6 && hex.length() != 8) || !hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("颜色格式不合法（应为 #RRGGBB 或 #RRGGBBAA）：" + text);
        }
        double r = Integer.parseInt(hex.substring(0, 2), 16) / 255.0;
        double g = Integer.parseInt(hex.substring(2, 4), 16) / 255.0;
        double b = Integer.parseInt(hex.substring(4, 6), 16) / 255.0;
        double a = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) / 255.0 : 1.0;
        return new RgbColor(r, g, b, a);
    }

    /**
     * IFC 表面样式使用透明度而不是不透明度。
     */
    public double transparency() {
        return 1.0 - alpha;
    }

    public String toHex() {
        String rgb = String.format(Locale.ROOT, "#%02X%02X%02X", channel(red), channel(green), channel(blue));
        return alpha >= 1.0 ? rgb : rgb + String.format(Locale.ROOT, "%02X", channel(alpha));
    }

    private static int channel(double value) {
        return (int) Math.round(value * 255.0);
    }

    private static void requireUnit(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("颜色分量 " + name + " 必须在 [0, 1] 内：" + value);
        }
    }
}
