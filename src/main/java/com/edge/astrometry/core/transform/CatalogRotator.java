package com.edge.astrometry.core.transform;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.model.SkyPoint;

/**
 * 星表刚体旋转 + 平移
 * <p>
 * 旋转在以枢轴为原点、RA 乘以 cos(枢轴赤纬) 的局部坐标系中进行，
 * 因此同一个角度在任何赤纬下都表示相同的天球旋转。
 */
public final class CatalogRotator {

    private CatalogRotator() {
    }

    /**
     * 对星表前两列施加改正，其余列原样保留
     */
    public static Catalog apply(Catalog catalog, SkyPoint pivot, ShiftRotation correction) {
        return rotateShift(catalog, pivot, correction.getAngleDeg(), correction.getDRa(), correction.getDDec());
    }

    public static Catalog rotate(Catalog catalog, SkyPoint pivot, double angleDeg) {
        return rotateShift(catalog, pivot, angleDeg, 0, 0);
    }

    public static Catalog rotateShift(Catalog catalog, SkyPoint pivot, double angleDeg, double dRa, double dDec) {
        int n = catalog.size();
        double[] ra = new double[n];
        double[] dec = new double[n];
        for (int i = 0; i < n; i++) {
            double[] p = rotateShift(catalog.x(i), catalog.y(i), pivot, angleDeg, dRa, dDec);
            ra[i] = p[0];
            dec[i] = p[1];
        }
        return catalog.withCoordinates(ra, dec);
    }

    /**
     * 单点改正
     */
    public static double[] rotateShift(double ra, double dec, SkyPoint pivot, double angleDeg, double dRa, double dDec) {
        double cosPivot = Math.cos(Math.toRadians(pivot.dec));
        double angle = Math.toRadians(angleDeg);
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);

        double x = (ra - pivot.ra) * cosPivot;
        double y = dec - pivot.dec;

        double rotatedX = cos * x - sin * y;
        double rotatedY = sin * x + cos * y;

        return new double[]{
            rotatedX / cosPivot + pivot.ra + dRa,
            rotatedY + pivot.dec + dDec
        };
    }

    /**
     * 逆变换：先减平移，再反向旋转
     */
    public static Catalog invert(Catalog catalog, SkyPoint pivot, ShiftRotation correction) {
        Catalog unshifted = rotateShift(catalog, pivot, 0, -correction.getDRa(), -correction.getDDec());
        return rotate(unshifted, pivot, -correction.getAngleDeg());
    }
}
