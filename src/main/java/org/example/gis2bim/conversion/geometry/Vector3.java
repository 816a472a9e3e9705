package org.example.gis2bim.conversion.geometry;

/**
 * 三维坐标/向量（不可变）。
 * <p>
 * GIS 输入只有 x/y 时 z 取 0；坐标不做投影转换，原样透传。
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);
    public static final Vector3 UNIT_X = new Vector3(1.0, 0.0, 0.0);
    public static final Vector3 UNIT_Z = new Vector3(0.0, 0.0, 1.0);

    public static Vector3 of(double x, double y, double z) {
        return new Vector3(x, y, z);
    }

    public static Vector3 of(double x, double y) {
        return new Vector3(x, y, 0.0);
    }

    public Vector3 plus(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 times(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 cross(Vector3 other) {
        return new Vector3(
                y * other.z - z * other.y,
                z * other.x - x * other.z,
                x * other.y - y * other.x
        );
    }

    public double length() {
        return Math.sqrt(dot(this));
    }

    public Vector3 normalized() {
        double len = length();
        if (len == 0.0) {
            throw new IllegalStateException("零向量无法归一化");
        }
        return times(1.0 / len);
    }

    public Vector3 withZ(double newZ) {
        return new Vector3(x, y, newZ);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    /**
     * 在容差范围内判断两点是否重合（用于折叠连续重复顶点）。
     */
    public boolean sameAs(Vector3 other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance
                && Math.abs(y - other.y) <= tolerance
                && Math.abs(z - other.z) <= tolerance;
    }
}
