package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.transform.CatalogRotator;
import com.edge.astrometry.core.transform.ShiftRotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 全局 (角度, dRA, dDec) 非线性精修
 * <p>
 * 1. 用初值改正源星表，在较大半径内与参考星表做唯一匹配
 * 2. 对匹配星对最小化天球残差（RA 残差乘以 cos(参考星赤纬)）
 * <p>
 * 拟合内部用角秒作为平移单位，返回值仍是度。
 */
public class NonlinearRefiner {
    private static final Logger logger = LoggerFactory.getLogger(NonlinearRefiner.class);

    private final UniqueCatalogMatcher matcher;
    private final LeastSquaresSolver solver;

    public NonlinearRefiner(UniqueCatalogMatcher matcher, LeastSquaresSolver solver) {
        this.matcher = matcher;
        this.solver = solver;
    }

    /**
     * @param source      未改正的源星表（前两列 RA/Dec）
     * @param reference   参考星表
     * @param initial     初值
     * @param pivot       旋转中心
     * @param matchRadius 匹配半径（度）
     * @param minMatches  最少唯一匹配数，不足时返回 INSUFFICIENT_DATA
     */
    public ShiftRotationFit fitShiftRotation(Catalog source, Catalog reference, ShiftRotation initial,
                                             SkyPoint pivot, double matchRadius, int minMatches) {
        Catalog coordinates = source.coordinates();
        Catalog aligned = CatalogRotator.apply(coordinates, pivot, initial);
        MatchedCatalog matched = matcher.matchWithSentinels(aligned, reference.coordinates(), matchRadius, 1);

        int n = matched.matchedCount();
        double[] srcRa = new double[n];
        double[] srcDec = new double[n];
        double[] refRa = new double[n];
        double[] refDec = new double[n];
        double[] cosRefDec = new double[n];
        int k = 0;
        for (int i = 0; i < matched.size(); i++) {
            if (!matched.isMatched(i)) {
                continue;
            }
            srcRa[k] = coordinates.x(i);
            srcDec[k] = coordinates.y(i);
            refRa[k] = matched.referenceRa(i);
            refDec[k] = matched.referenceDec(i);
            cosRefDec[k] = Math.cos(Math.toRadians(refDec[k]));
            k++;
        }

        double[] start = {initial.getAngleDeg(), initial.getDRaArcsec(), initial.getDDecArcsec()};
        if (n < minMatches) {
            logger.warn("全局精修匹配数不足: {} < {}，沿用初值", n, minMatches);
            return new ShiftRotationFit(initial, FitResult.insufficientData(start, n, minMatches));
        }

        LeastSquaresSolver.ResidualFunction residuals = p -> {
            double dRa = p[1] * CatalogColumns.ARCSEC;
            double dDec = p[2] * CatalogColumns.ARCSEC;
            double[] r = new double[2 * n];
            for (int i = 0; i < n; i++) {
                double[] moved = CatalogRotator.rotateShift(srcRa[i], srcDec[i], pivot, p[0], dRa, dDec);
                r[2 * i] = (moved[0] - refRa[i]) * cosRefDec[i] * 3600.0;
                r[2 * i + 1] = (moved[1] - refDec[i]) * 3600.0;
            }
            return r;
        };

        FitResult fit = solver.solve(residuals, start, 2 * n).withSampleCount(n);
        if (!fit.isConverged()) {
            logger.warn("全局精修未收敛 ({})，沿用初值", fit.getMessage());
            return new ShiftRotationFit(initial, fit);
        }
        double[] p = fit.getParameters();
        ShiftRotation refined = new ShiftRotation(p[0], p[1] * CatalogColumns.ARCSEC, p[2] * CatalogColumns.ARCSEC);
        logger.info("全局精修: {} -> {} ({} 对匹配, rms {}\")", initial, refined, n,
            String.format("%.3f", fit.getRms()));
        return new ShiftRotationFit(refined, fit);
    }
}
