package com.edge.astrometry.core.wcs;

import com.edge.astrometry.core.model.SkyPoint;

/**
 * 单个探测器 tile 的像素到天球坐标变换
 * <p>
 * 实现必须不可变：所有 with* 方法返回新实例。
 */
public interface TileWcs {

    /**
     * 像素坐标投影到 (RA, Dec)，单位度
     */
    double[] projectToSky(double x, double y);

    /**
     * 整体平移 (dRA, dDec)，单位度
     */
    TileWcs withShift(double dRa, double dDec);

    /**
     * 绕枢轴旋转，与 {@link com.edge.astrometry.core.transform.CatalogRotator} 的约定一致
     */
    TileWcs withRotation(double angleDeg, SkyPoint pivot);

    /**
     * 替换畸变多项式系数
     */
    TileWcs withDistortion(double[] xiCoefficients, double[] etaCoefficients);

    /**
     * 取出某一参数组的当前值（作为拟合初值）
     */
    double[] getParameters(WcsParameterSet set);

    /**
     * 用拟合结果替换某一参数组
     */
    TileWcs withParameters(WcsParameterSet set, double[] parameters);
}
