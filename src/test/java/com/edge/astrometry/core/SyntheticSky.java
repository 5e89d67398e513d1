package com.edge.astrometry.core;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;

import java.util.Random;

/**
 * 测试用的随机星场
 */
public final class SyntheticSky {

    private SyntheticSky() {
    }

    /**
     * 以 (ra, dec) 为中心、边长 size 度（天球上）的均匀星场
     */
    public static Catalog field(Random random, int n, double ra, double dec, double size) {
        double cosDec = Math.cos(Math.toRadians(dec));
        double[] r = new double[n];
        double[] d = new double[n];
        for (int i = 0; i < n; i++) {
            r[i] = ra + (random.nextDouble() - 0.5) * size / cosDec;
            d[i] = dec + (random.nextDouble() - 0.5) * size;
        }
        return Catalog.ofCoordinates(r, d);
    }

    /**
     * 每颗星加上 sigma 角秒的高斯位置误差
     */
    public static Catalog jitter(Random random, Catalog catalog, double sigmaArcsec) {
        double[] r = catalog.column(0);
        double[] d = catalog.column(1);
        for (int i = 0; i < r.length; i++) {
            double cosDec = Math.cos(Math.toRadians(d[i]));
            r[i] += random.nextGaussian() * sigmaArcsec * CatalogColumns.ARCSEC / cosDec;
            d[i] += random.nextGaussian() * sigmaArcsec * CatalogColumns.ARCSEC;
        }
        return catalog.withCoordinates(r, d);
    }

    /**
     * 坐标星表扩展为完整源星表列（点源、无标记、星等按行号递增）
     */
    public static Catalog sourceRows(Catalog sky, int tile) {
        double[][] rows = new double[sky.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[]{
                sky.x(i), sky.y(i), 0, 0, 1.0 * CatalogColumns.ARCSEC, 12 + i * 0.001, 0.01, 0, tile
            };
        }
        return Catalog.of(rows, CatalogColumns.SOURCE_WIDTH);
    }

    public static double arcsec(double degrees) {
        return degrees / CatalogColumns.ARCSEC;
    }
}
