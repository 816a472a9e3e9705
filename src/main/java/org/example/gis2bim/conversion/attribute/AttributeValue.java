package org.example.gis2bim.conversion.attribute;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 要素属性值（封闭的标签类型）：字符串、实数、整数、布尔。
 * <p>
 * GIS 源数据中的属性表是弱类型的“字段名 → 值”映射；这里在读取时就收敛成三种类型，
 * 后续的样式匹配与属性集写出都按类型处理，不再做动态判断。
 */
public sealed interface AttributeValue permits AttributeValue.TextValue, AttributeValue.NumberValue,
        AttributeValue.IntegerValue, AttributeValue.BooleanValue {

    static AttributeValue text(String value) {
        return new TextValue(value);
    }

    static AttributeValue number(double value) {
        return new NumberValue(value);
    }

    static AttributeValue integer(long value) {
        return new IntegerValue(value);
    }

    static AttributeValue bool(boolean value) {
        return new BooleanValue(value);
    }

    /**
     * 按类型比较是否相等：数值按数值比较（6 与 6.0 相等），字符串区分大小写，布尔按值；不同类型永不相等。
     */
    boolean sameValueAs(AttributeValue other);

    /**
     * 便于日志/预览展示的文本形式。
     */
    String displayText();

    record TextValue(String value) implements AttributeValue {

        public TextValue {
            if (value == null) {
                throw new IllegalArgumentException("属性值不能为 null");
            }
        }

        @Override
        public boolean sameValueAs(AttributeValue other) {
            return other instanceof TextValue text && value.equals(text.value);
        }

        @Override
        public String displayText() {
            return value;
        }
    }

    /**
     * 数值型属性（实数或整数），供高度/半径覆盖字段统一取值。
     */
    static Optional<Double> numericValue(AttributeValue value) {
        if (value instanceof NumberValue number) {
            return Optional.of(number.value());
        }
        if (value instanceof IntegerValue integer) {
            return Optional.of((double) integer.value());
        }
        return Optional.empty();
    }

    /**
     * 实数。-0.0 与 0.0 相等，NaN 与任何值都不相等。
     */
    record NumberValue(double value) implements AttributeValue {

        @Override
        public boolean sameValueAs(AttributeValue other) {
            if (other instanceof NumberValue number) {
                return value == number.value;
            }
            return other instanceof IntegerValue integer && integer.equalsReal(value);
        }

        @Override
        public String displayText() {
            return Double.toString(value);
        }
    }

    /**
     * 整数，按 long 原样保存，超过 2^53 也不丢精度。
     */
    record IntegerValue(long value) implements AttributeValue {

        @Override
        public boolean sameValueAs(AttributeValue other) {
            if (other instanceof IntegerValue integer) {
                return value == integer.value;
            }
            return other instanceof NumberValue number && equalsReal(number.value());
        }

        boolean equalsReal(double real) {
            if (!Double.isFinite(real) || real != Math.rint(real)) {
                return false;
            }
            return new BigDecimal(real).compareTo(BigDecimal.valueOf(value)) == 0;
        }

        @Override
        public String displayText() {
            return Long.toString(value);
        }
    }

    record BooleanValue(boolean value) implements AttributeValue {

        @Override
        public boolean sameValueAs(AttributeValue other) {
            return other instanceof BooleanValue bool && value == bool.value;
        }

        @Override
        public String displayText() {
            return Boolean.toString(value);
        }
    }
}
