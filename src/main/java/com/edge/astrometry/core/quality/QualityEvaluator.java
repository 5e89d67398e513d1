package com.edge.astrometry.core.quality;

import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.tile.DetectorTile;
import com.edge.astrometry.core.tile.TileLayout;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 残差统计
 * <p>
 * d_ra = (源 RA - 参考 RA) · cos(源 Dec)，d_dec = 源 Dec - 参考 Dec，d = hypot(d_ra, d_dec)。
 * RMS、中位数，以及 16%-84% 分位间距的一半作为稳健 sigma。
 */
@Component
public class QualityEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(QualityEvaluator.class);

    /**
     * 只统计已匹配行；没有可用行时返回 {@link QualityRecord#invalid()}
     */
    public QualityRecord computeQuality(MatchedCatalog matched) {
        MatchedCatalog usable = matched.matchedOnly();
        int n = usable.size();
        if (n == 0) {
            logger.debug("没有可用匹配，质量指标无效");
            return QualityRecord.invalid();
        }

        double[] dRa = new double[n];
        double[] dDec = new double[n];
        double[] total = new double[n];
        double sumRa = 0, sumDec = 0;
        for (int i = 0; i < n; i++) {
            double srcDec = usable.sourceValue(i, CatalogColumns.DEC);
            dRa[i] = (usable.sourceValue(i, CatalogColumns.RA) - usable.referenceRa(i))
                * Math.cos(Math.toRadians(srcDec)) * 3600.0;
            dDec[i] = (srcDec - usable.referenceDec(i)) * 3600.0;
            total[i] = Math.hypot(dRa[i], dDec[i]);
            sumRa += dRa[i] * dRa[i];
            sumDec += dDec[i] * dDec[i];
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        EnumMap<QualityMetric, Double> values = new EnumMap<>(QualityMetric.class);
        values.put(QualityMetric.RMS_RA, Math.sqrt(sumRa / n));
        values.put(QualityMetric.RMS_DEC, Math.sqrt(sumDec / n));
        values.put(QualityMetric.RMS, Math.sqrt((sumRa + sumDec) / n));
        values.put(QualityMetric.MEDIAN_RA, percentile.evaluate(dRa, 50));
        values.put(QualityMetric.MEDIAN_DEC, percentile.evaluate(dDec, 50));
        values.put(QualityMetric.MEDIAN, percentile.evaluate(total, 50));
        values.put(QualityMetric.SIGMA_RA, halfSpread(percentile, dRa));
        values.put(QualityMetric.SIGMA_DEC, halfSpread(percentile, dDec));
        values.put(QualityMetric.SIGMA, halfSpread(percentile, total));
        values.put(QualityMetric.STARCOUNT, (double) n);

        QualityRecord record = new QualityRecord(values);
        logger.debug("质量: {}", record);
        return record;
    }

    /**
     * 每个成像 tile 单独统计
     */
    public Map<Integer, QualityRecord> computeByTile(MatchedCatalog matched, TileLayout tiles) {
        if (matched.getSourceWidth() <= CatalogColumns.TILE) {
            throw new IllegalArgumentException("Matched catalog has no tile column");
        }
        Map<Integer, QualityRecord> byTile = new TreeMap<>();
        for (DetectorTile tile : tiles.imageTiles()) {
            byTile.put(tile.getId(), computeQuality(matched.withSourceValue(CatalogColumns.TILE, tile.getId())));
        }
        return byTile;
    }

    private static double halfSpread(Percentile percentile, double[] values) {
        return 0.5 * (percentile.evaluate(values, 84) - percentile.evaluate(values, 16));
    }
}
