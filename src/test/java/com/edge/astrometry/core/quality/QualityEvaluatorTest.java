package com.edge.astrometry.core.quality;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.tile.DetectorTile;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.wcs.TanWcs;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QualityEvaluatorTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;

    private final QualityEvaluator evaluator = new QualityEvaluator();
    private final UniqueCatalogMatcher matcher = new UniqueCatalogMatcher();

    @Test
    void emptyMatchIsInvalid() {
        MatchedCatalog empty = MatchedCatalog.empty(2, 2);

        QualityRecord quality = evaluator.computeQuality(empty);

        assertThat(quality.isValid()).isFalse();
        assertThat(quality.get(QualityMetric.RMS)).isEqualTo(QualityRecord.INVALID);
        assertThat(quality.get(QualityMetric.SIGMA_DEC)).isEqualTo(-9999.0);
        assertThat(quality.getStarCount()).isZero();
    }

    @Test
    void knownOffsetsGiveExactStatistics() {
        // 赤道附近，cos(dec) ≈ 1
        double[] refRa = {10, 10.01, 10.02, 10.03};
        double[] refDec = {0, 0, 0, 0};
        double[] srcRa = {10 + ARCSEC, 10.01 + ARCSEC, 10.02 + ARCSEC, 10.03 + ARCSEC};
        double[] srcDec = {0, 0, 0, 0};
        Catalog reference = Catalog.ofCoordinates(refRa, refDec);
        Catalog source = Catalog.ofCoordinates(srcRa, srcDec)
            .append(Catalog.ofCoordinates(new double[]{11}, new double[]{0}));

        QualityRecord quality = evaluator.computeQuality(matcher.matchWithSentinels(source, reference, 3 * ARCSEC, 1));

        assertThat(quality.getStarCount()).isEqualTo(4);
        assertThat(quality.get(QualityMetric.RMS_RA)).isCloseTo(1.0, within(1e-6));
        assertThat(quality.get(QualityMetric.RMS_DEC)).isCloseTo(0.0, within(1e-9));
        assertThat(quality.get(QualityMetric.RMS)).isCloseTo(1.0, within(1e-6));
        assertThat(quality.get(QualityMetric.MEDIAN)).isCloseTo(1.0, within(1e-6));
        assertThat(quality.get(QualityMetric.SIGMA_RA)).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void spreadUsesSixteenthAndEightyFourthPercentiles() {
        int n = 101;
        double[] refRa = new double[n];
        double[] refDec = new double[n];
        double[] srcRa = new double[n];
        double[] srcDec = new double[n];
        for (int i = 0; i < n; i++) {
            refRa[i] = 10 + i * 0.01;
            srcRa[i] = refRa[i];
            srcDec[i] = (i - 50) * 0.02 * ARCSEC;
        }

        QualityRecord quality = evaluator.computeQuality(matcher.matchWithSentinels(
            Catalog.ofCoordinates(srcRa, srcDec), Catalog.ofCoordinates(refRa, refDec), 3 * ARCSEC, 1));

        // dDec 从 -1" 到 +1" 均匀分布：16%/84% 分位为 -0.68"/+0.68"
        assertThat(quality.get(QualityMetric.SIGMA_DEC)).isCloseTo(0.68, within(1e-6));
        assertThat(quality.get(QualityMetric.MEDIAN_DEC)).isCloseTo(0.0, within(1e-9));
        assertThat(quality.get(QualityMetric.RMS_DEC))
            .isCloseTo(Math.sqrt(2.0 * 0.0004 * 50 * 51 * 101 / 6 / n), within(1e-6));
        assertThat(quality.toMap()).containsKeys("RMS-RA", "MEDIAN", "SIGMA", "STARCOUNT");
    }

    @Test
    void qualityPerTile() {
        double[][] sourceRows = {
            {10 + ARCSEC, 0, 0, 0, 0, 0, 0, 0, 1},
            {10.01 + 2 * ARCSEC, 0, 0, 0, 0, 0, 0, 0, 2},
        };
        Catalog source = Catalog.of(sourceRows, CatalogColumns.SOURCE_WIDTH);
        Catalog reference = Catalog.ofCoordinates(new double[]{10, 10.01}, new double[]{0, 0});
        TanWcs wcs = TanWcs.simple(10, 0, 0, 0, 1e-4);
        TileLayout tiles = new TileLayout(Arrays.asList(
            DetectorTile.image(1, wcs), DetectorTile.image(2, wcs), DetectorTile.image(3, wcs)));

        Map<Integer, QualityRecord> byTile = evaluator.computeByTile(
            matcher.matchWithSentinels(source, reference, 3 * ARCSEC, 1), tiles);

        assertThat(byTile).containsOnlyKeys(1, 2, 3);
        assertThat(byTile.get(1).get(QualityMetric.RMS)).isCloseTo(1.0, within(1e-6));
        assertThat(byTile.get(2).get(QualityMetric.RMS)).isCloseTo(2.0, within(1e-6));
        assertThat(byTile.get(3).isValid()).isFalse();
    }

    @Test
    void tileQualityNeedsTileColumn() {
        MatchedCatalog narrow = MatchedCatalog.empty(2, 2);

        assertThatThrownBy(() -> evaluator.computeByTile(narrow, TileLayout.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
