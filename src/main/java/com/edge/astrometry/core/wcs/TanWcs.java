package com.edge.astrometry.core.wcs;

import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.transform.CatalogRotator;

import java.util.Arrays;

/**
 * 切平面 (TAN) 投影 + 低阶多项式畸变
 * <p>
 * 像素 -> 中间坐标：(u, v) = CD · (x - CRPIX1, y - CRPIX2)，单位度<br>
 * 畸变：xi = Σ a_k · T_k(u, v)，eta = Σ b_k · T_k(v, u)，T = [1, p, q, p², pq, q²]<br>
 * 无畸变时 a = b = [0, 1, 0, 0, 0, 0]。最后由 (xi, eta) 反投影到天球。
 */
public final class TanWcs implements TileWcs {

    public static final int DISTORTION_TERMS = 6;
    public static final int FITTED_DISTORTION_TERMS = 3;

    private static final double[] IDENTITY_DISTORTION = {0, 1, 0, 0, 0, 0};

    private final double crval1;
    private final double crval2;
    private final double crpix1;
    private final double crpix2;
    private final double[] cd;
    private final double[] xiCoefficients;
    private final double[] etaCoefficients;

    /**
     * @param cd CD 矩阵 {CD1_1, CD1_2, CD2_1, CD2_2}，单位度/像素
     */
    public TanWcs(double crval1, double crval2, double crpix1, double crpix2, double[] cd) {
        this(crval1, crval2, crpix1, crpix2, cd, IDENTITY_DISTORTION, IDENTITY_DISTORTION);
    }

    public TanWcs(double crval1, double crval2, double crpix1, double crpix2, double[] cd,
                  double[] xiCoefficients, double[] etaCoefficients) {
        if (cd == null || cd.length != 4) {
            throw new IllegalArgumentException("CD matrix needs 4 elements");
        }
        if (xiCoefficients.length != DISTORTION_TERMS || etaCoefficients.length != DISTORTION_TERMS) {
            throw new IllegalArgumentException("Distortion needs " + DISTORTION_TERMS + " coefficients per axis");
        }
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd = cd.clone();
        this.xiCoefficients = xiCoefficients.clone();
        this.etaCoefficients = etaCoefficients.clone();
    }

    /**
     * 简单的无旋转 WCS：RA 随 x 增大，Dec 随 y 增大
     */
    public static TanWcs simple(double crval1, double crval2, double crpix1, double crpix2, double pixelScaleDeg) {
        return new TanWcs(crval1, crval2, crpix1, crpix2, new double[]{pixelScaleDeg, 0, 0, pixelScaleDeg});
    }

    public double getCrval1() { return crval1; }
    public double getCrval2() { return crval2; }
    public double getCrpix1() { return crpix1; }
    public double getCrpix2() { return crpix2; }
    public double[] getCd() { return cd.clone(); }
    public double[] getXiCoefficients() { return xiCoefficients.clone(); }
    public double[] getEtaCoefficients() { return etaCoefficients.clone(); }

    @Override
    public double[] projectToSky(double x, double y) {
        double dx = x - crpix1;
        double dy = y - crpix2;
        double u = cd[0] * dx + cd[1] * dy;
        double v = cd[2] * dx + cd[3] * dy;
        double xi = polynomial(xiCoefficients, u, v);
        double eta = polynomial(etaCoefficients, v, u);
        return deproject(Math.toRadians(xi), Math.toRadians(eta));
    }

    /**
     * 天球 -> 像素（畸变部分用不动点迭代求逆）
     */
    public double[] skyToPixel(double ra, double dec) {
        double[] standard = project(ra, dec);
        double xi = standard[0];
        double eta = standard[1];

        double u = xi;
        double v = eta;
        for (int i = 0; i < 50; i++) {
            double du = xi - polynomial(xiCoefficients, u, v);
            double dv = eta - polynomial(etaCoefficients, v, u);
            u += du;
            v += dv;
            if (Math.abs(du) < 1e-14 && Math.abs(dv) < 1e-14) {
                break;
            }
        }

        double det = cd[0] * cd[3] - cd[1] * cd[2];
        if (det == 0) {
            throw new IllegalStateException("CD matrix is singular");
        }
        double dx = (cd[3] * u - cd[1] * v) / det;
        double dy = (-cd[2] * u + cd[0] * v) / det;
        return new double[]{dx + crpix1, dy + crpix2};
    }

    @Override
    public TanWcs withShift(double dRa, double dDec) {
        return new TanWcs(crval1 + dRa, crval2 + dDec, crpix1, crpix2, cd, xiCoefficients, etaCoefficients);
    }

    /**
     * CRVAL 绕枢轴旋转，CD 矩阵在切平面内旋转同一角度
     */
    @Override
    public TanWcs withRotation(double angleDeg, SkyPoint pivot) {
        double[] center = CatalogRotator.rotateShift(crval1, crval2, pivot, angleDeg, 0, 0);
        double angle = Math.toRadians(angleDeg);
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double[] rotated = {
            cos * cd[0] - sin * cd[2], cos * cd[1] - sin * cd[3],
            sin * cd[0] + cos * cd[2], sin * cd[1] + cos * cd[3]
        };
        return new TanWcs(center[0], center[1], crpix1, crpix2, rotated, xiCoefficients, etaCoefficients);
    }

    @Override
    public TanWcs withDistortion(double[] xi, double[] eta) {
        return new TanWcs(crval1, crval2, crpix1, crpix2, cd, xi, eta);
    }

    @Override
    public double[] getParameters(WcsParameterSet set) {
        switch (set) {
            case CENTER:
                return new double[]{crval1, crval2};
            case CENTER_AND_LINEAR:
                return new double[]{crval1, crval2, cd[0], cd[1], cd[2], cd[3]};
            case DISTORTION:
                double[] p = new double[2 * FITTED_DISTORTION_TERMS];
                System.arraycopy(xiCoefficients, 0, p, 0, FITTED_DISTORTION_TERMS);
                System.arraycopy(etaCoefficients, 0, p, FITTED_DISTORTION_TERMS, FITTED_DISTORTION_TERMS);
                return p;
            default:
                throw new IllegalArgumentException("Unknown parameter set " + set);
        }
    }

    @Override
    public TanWcs withParameters(WcsParameterSet set, double[] p) {
        if (p.length != set.getParameterCount()) {
            throw new IllegalArgumentException(set + " needs " + set.getParameterCount()
                + " parameters, got " + p.length);
        }
        switch (set) {
            case CENTER:
                return new TanWcs(p[0], p[1], crpix1, crpix2, cd, xiCoefficients, etaCoefficients);
            case CENTER_AND_LINEAR:
                return new TanWcs(p[0], p[1], crpix1, crpix2, Arrays.copyOfRange(p, 2, 6),
                    xiCoefficients, etaCoefficients);
            case DISTORTION:
                double[] xi = xiCoefficients.clone();
                double[] eta = etaCoefficients.clone();
                System.arraycopy(p, 0, xi, 0, FITTED_DISTORTION_TERMS);
                System.arraycopy(p, FITTED_DISTORTION_TERMS, eta, 0, FITTED_DISTORTION_TERMS);
                return new TanWcs(crval1, crval2, crpix1, crpix2, cd, xi, eta);
            default:
                throw new IllegalArgumentException("Unknown parameter set " + set);
        }
    }

    private static double polynomial(double[] c, double p, double q) {
        return c[0] + c[1] * p + c[2] * q + c[3] * p * p + c[4] * p * q + c[5] * q * q;
    }

    /**
     * 标准坐标 (xi, eta)（弧度）-> (RA, Dec)（度）
     */
    private double[] deproject(double xi, double eta) {
        double dec0 = Math.toRadians(crval2);
        double cosDec0 = Math.cos(dec0);
        double sinDec0 = Math.sin(dec0);
        double denominator = cosDec0 - eta * sinDec0;
        double ra = crval1 + Math.toDegrees(Math.atan2(xi, denominator));
        double dec = Math.toDegrees(Math.atan2(eta * cosDec0 + sinDec0, Math.hypot(xi, denominator)));
        return new double[]{ra, dec};
    }

    /**
     * (RA, Dec)（度）-> 标准坐标 (xi, eta)（度）
     */
    private double[] project(double ra, double dec) {
        double dRa = Math.toRadians(ra - crval1);
        double decRad = Math.toRadians(dec);
        double dec0 = Math.toRadians(crval2);
        double cosC = Math.sin(dec0) * Math.sin(decRad) + Math.cos(dec0) * Math.cos(decRad) * Math.cos(dRa);
        if (cosC <= 0) {
            throw new IllegalArgumentException("Position (" + ra + ", " + dec + ") is not on the tangent hemisphere");
        }
        double xi = Math.cos(decRad) * Math.sin(dRa) / cosC;
        double eta = (Math.cos(dec0) * Math.sin(decRad) - Math.sin(dec0) * Math.cos(decRad) * Math.cos(dRa)) / cosC;
        return new double[]{Math.toDegrees(xi), Math.toDegrees(eta)};
    }

    @Override
    public String toString() {
        return String.format("TanWcs[crval=(%.6f, %.6f), crpix=(%.1f, %.1f), cd=%s]",
            crval1, crval2, crpix1, crpix2, Arrays.toString(cd));
    }
}
