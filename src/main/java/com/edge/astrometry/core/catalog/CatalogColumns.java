package com.edge.astrometry.core.catalog;

/**
 * 源星表列定义
 * <p>
 * 探测工具输出的原始星表按此顺序排列，前两列为天球坐标。
 */
public final class CatalogColumns {
    public static final int RA = 0;
    public static final int DEC = 1;
    public static final int PIXEL_X = 2;
    public static final int PIXEL_Y = 3;
    /** 视宽度（度） */
    public static final int FWHM = 4;
    public static final int MAG = 5;
    public static final int MAG_ERR = 6;
    /** 0 表示无标记 */
    public static final int FLAGS = 7;
    public static final int TILE = 8;

    /** 源星表最少列数 */
    public static final int SOURCE_WIDTH = 9;

    public static final double ARCSEC = 1.0 / 3600.0;
    public static final double ARCMIN = 1.0 / 60.0;

    private CatalogColumns() {
    }
}
