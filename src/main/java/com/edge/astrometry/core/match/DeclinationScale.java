package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.Catalog;

/**
 * 赤纬缩放
 * <p>
 * RA 乘以 cos(dec) 后，欧氏距离近似角距离。赤纬上限 85°，避免极区缩放因子趋零。
 */
public final class DeclinationScale {
    public static final double MAX_DECLINATION = 85.0;

    private DeclinationScale() {
    }

    /**
     * 取两个星表中较大的 |dec| 计算缩放因子
     */
    public static double factorFor(Catalog first, Catalog second) {
        return factorFor(Math.max(first.maxAbsY(), second.maxAbsY()));
    }

    public static double factorFor(double maxAbsDeclination) {
        double dec = Math.min(Math.abs(maxAbsDeclination), MAX_DECLINATION);
        return Math.cos(Math.toRadians(dec));
    }

    /**
     * 返回缩放后的 RA 列
     */
    public static double[] scaledRa(Catalog catalog, double factor) {
        double[] ra = catalog.column(0);
        for (int i = 0; i < ra.length; i++) {
            ra[i] *= factor;
        }
        return ra;
    }
}
