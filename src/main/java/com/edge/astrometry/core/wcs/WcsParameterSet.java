package com.edge.astrometry.core.wcs;

/**
 * 逐 tile 精修时允许变化的参数组
 */
public enum WcsParameterSet {
    /** CRVAL1/2 */
    CENTER(2),
    /** CRVAL1/2 + CD 矩阵 */
    CENTER_AND_LINEAR(6),
    /** 每个轴前 3 项畸变系数（常数项 + 两个线性项） */
    DISTORTION(6);

    private final int parameterCount;

    WcsParameterSet(int parameterCount) {
        this.parameterCount = parameterCount;
    }

    public int getParameterCount() {
        return parameterCount;
    }
}
