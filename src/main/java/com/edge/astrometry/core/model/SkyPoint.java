package com.edge.astrometry.core.model;

/**
 * 天球坐标点（度）
 */
public class SkyPoint {
    public final double ra;
    public final double dec;

    public SkyPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    /**
     * 小角度近似下的角距离（度），RA 差按 cos(平均赤纬) 缩放
     */
    public double separationTo(SkyPoint other) {
        double meanDec = Math.toRadians(0.5 * (dec + other.dec));
        double dRa = (ra - other.ra) * Math.cos(meanDec);
        double dDec = dec - other.dec;
        return Math.sqrt(dRa * dRa + dDec * dDec);
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %+.6f)", ra, dec);
    }
}
