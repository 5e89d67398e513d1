package com.edge.astrometry.core.transform;

import com.edge.astrometry.core.SyntheticSky;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.model.SkyPoint;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CatalogRotatorTest {

    @Test
    void rotatesCounterClockwiseAboutPivot() {
        SkyPoint pivot = new SkyPoint(100, 60);
        // 枢轴正东 0.1°（天球上）
        double ra = 100 + 0.1 / Math.cos(Math.toRadians(60));

        double[] rotated = CatalogRotator.rotateShift(ra, 60, pivot, 90, 0, 0);

        assertThat(rotated[0]).isCloseTo(100, within(1e-12));
        assertThat(rotated[1]).isCloseTo(60.1, within(1e-12));
    }

    @Test
    void invertUndoesApply() {
        Catalog catalog = SyntheticSky.sourceRows(SyntheticSky.field(new Random(51), 100, 200, -30, 1.0), 4);
        SkyPoint pivot = new SkyPoint(200, -30);
        ShiftRotation correction = new ShiftRotation(-1.2, 5 * CatalogColumns.ARCSEC, 7 * CatalogColumns.ARCSEC);

        Catalog roundTrip = CatalogRotator.invert(CatalogRotator.apply(catalog, pivot, correction), pivot, correction);

        for (int i = 0; i < catalog.size(); i++) {
            assertThat(roundTrip.x(i)).isCloseTo(catalog.x(i), within(1e-10));
            assertThat(roundTrip.y(i)).isCloseTo(catalog.y(i), within(1e-10));
            // 其余列原样保留
            assertThat(roundTrip.get(i, CatalogColumns.TILE)).isEqualTo(4.0);
        }
    }

    @Test
    void identityLeavesCatalogUnchanged() {
        Catalog catalog = SyntheticSky.field(new Random(52), 10, 10, 10, 1.0);

        Catalog same = CatalogRotator.apply(catalog, new SkyPoint(10, 10), ShiftRotation.IDENTITY);

        for (int i = 0; i < catalog.size(); i++) {
            assertThat(same.x(i)).isCloseTo(catalog.x(i), within(1e-12));
            assertThat(same.y(i)).isCloseTo(catalog.y(i), within(1e-12));
        }
    }
}
