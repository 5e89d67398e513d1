package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.catalog.Catalog;

/**
 * 参考星表来源；可以返回空星表，由调用方按“无重叠”处理
 */
@FunctionalInterface
public interface ReferenceCatalogProvider {

    Catalog fetch(double centerRa, double centerDec, double radiusDeg);
}
