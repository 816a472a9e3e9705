package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.geometry.Vector3;

/**
 * 局部坐标系：原点 + 三个轴向量（轴向量可带缩放）。局部点 p 的外层坐标为 origin + x·px + y·py + z·pz。
 */
record Frame(Vector3 origin, Vector3 xAxis, Vector3 yAxis, Vector3 zAxis) {

    static final Frame IDENTITY = new Frame(Vector3.ZERO, Vector3.UNIT_X, Vector3.of(0.0, 1.0, 0.0), Vector3.UNIT_Z);

    /**
     * 由原点、Z 轴与参考 X 方向构造右手正交坐标系（与 IfcAxis2Placement3D 相同的规则）。
     */
    static Frame of(Vector3 origin, Vector3 axis, Vector3 refDirection) {
        Vector3 z = axis.normalized();
        Vector3 ref = refDirection.minus(z.times(refDirection.dot(z)));
        if (ref.length() < 1e-12) {
            // 参考方向与 Z 轴平行时任取一条垂线
            ref = Math.abs(z.x()) < 0.9 ? Vector3.UNIT_X.minus(z.times(z.x())) : Vector3.of(0.0, 1.0, 0.0).minus(z.times(z.y()));
        }
        Vector3 x = ref.normalized();
        return new Frame(origin, x, z.cross(x), z);
    }

    Vector3 apply(Vector3 p) {
        return origin.plus(rotate(p));
    }

    Vector3 rotate(Vector3 v) {
        return xAxis.times(v.x()).plus(yAxis.times(v.y())).plus(zAxis.times(v.z()));
    }

    /**
     * 先在 inner 中定位，再把结果放进本坐标系。
     */
    Frame compose(Frame inner) {
        return new Frame(apply(inner.origin), rotate(inner.xAxis), rotate(inner.yAxis), rotate(inner.zAxis));
    }

    Frame scaled(double factor) {
        return new Frame(origin, xAxis.times(factor), yAxis.times(factor), zAxis.times(factor));
    }
}
