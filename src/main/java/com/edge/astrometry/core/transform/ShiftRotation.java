package com.edge.astrometry.core.transform;

import com.edge.astrometry.core.catalog.CatalogColumns;

/**
 * 全局改正参数：绕枢轴旋转角度 + RA/Dec 平移
 * <p>
 * 作用对象是源星表：先在赤纬缩放后的局部坐标系中旋转 angle，
 * 再把 (dRa, dDec) 直接加到坐标上（dRa 是 RA 坐标差，未乘 cos(dec)）。
 * 不可变，优化得到的是新实例。
 */
public final class ShiftRotation {
    public static final ShiftRotation IDENTITY = new ShiftRotation(0, 0, 0);

    private final double angleDeg;
    private final double dRa;
    private final double dDec;

    public ShiftRotation(double angleDeg, double dRa, double dDec) {
        this.angleDeg = angleDeg;
        this.dRa = dRa;
        this.dDec = dDec;
    }

    public static ShiftRotation shift(double dRa, double dDec) {
        return new ShiftRotation(0, dRa, dDec);
    }

    /**
     * 从参数向量 [angle, dRa, dDec] 构建
     */
    public static ShiftRotation fromArray(double[] p) {
        return new ShiftRotation(p[0], p[1], p[2]);
    }

    public double[] toArray() {
        return new double[]{angleDeg, dRa, dDec};
    }

    public double getAngleDeg() { return angleDeg; }
    public double getDRa() { return dRa; }
    public double getDDec() { return dDec; }

    public double getDRaArcsec() { return dRa / CatalogColumns.ARCSEC; }
    public double getDDecArcsec() { return dDec / CatalogColumns.ARCSEC; }

    public ShiftRotation withAngle(double angle) {
        return new ShiftRotation(angle, dRa, dDec);
    }

    @Override
    public String toString() {
        return String.format("ShiftRotation[angle=%.5f°, dRA=%.3f\", dDec=%.3f\"]",
            angleDeg, getDRaArcsec(), getDDecArcsec());
    }
}
