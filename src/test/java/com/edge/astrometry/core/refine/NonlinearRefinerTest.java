package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.SyntheticSky;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.transform.CatalogRotator;
import com.edge.astrometry.core.transform.ShiftRotation;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NonlinearRefinerTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;
    private static final SkyPoint PIVOT = new SkyPoint(150, 20);

    private final NonlinearRefiner refiner =
        new NonlinearRefiner(new UniqueCatalogMatcher(), new LevenbergMarquardtSolver());

    @Test
    void staysAtIdentityForAlignedCatalogs() {
        Random random = new Random(21);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 1.0);
        Catalog source = SyntheticSky.jitter(random, reference, 0.1);

        ShiftRotationFit fit = refiner.fitShiftRotation(source, reference, ShiftRotation.IDENTITY, PIVOT,
            5 * ARCSEC, 4);

        assertThat(fit.isConverged()).isTrue();
        assertThat(fit.getMatchCount()).isGreaterThanOrEqualTo(290);
        assertThat(fit.getSolution().getAngleDeg()).isCloseTo(0, within(0.01));
        assertThat(fit.getSolution().getDRaArcsec()).isCloseTo(0, within(0.5));
        assertThat(fit.getSolution().getDDecArcsec()).isCloseTo(0, within(0.5));
        assertThat(fit.getFit().getRms()).isLessThan(0.3);
    }

    @Test
    void refinesRoughGuess() {
        Random random = new Random(22);
        ShiftRotation truth = new ShiftRotation(0.2, 2 * ARCSEC, -1 * ARCSEC);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 1.0);
        Catalog source = SyntheticSky.jitter(random, CatalogRotator.invert(reference, PIVOT, truth), 0.1);
        ShiftRotation rough = new ShiftRotation(0.15, 1 * ARCSEC, 0);

        ShiftRotationFit fit = refiner.fitShiftRotation(source, reference, rough, PIVOT, 5 * ARCSEC, 4);

        assertThat(fit.getFit().getStatus()).isEqualTo(FitResult.Status.CONVERGED);
        assertThat(fit.getSolution().getAngleDeg()).isCloseTo(0.2, within(0.01));
        assertThat(fit.getSolution().getDRaArcsec()).isCloseTo(2, within(0.5));
        assertThat(fit.getSolution().getDDecArcsec()).isCloseTo(-1, within(0.5));
    }

    @Test
    void keepsInitialGuessWhenTooFewMatches() {
        Random random = new Random(23);
        Catalog reference = SyntheticSky.field(random, 20, 150, 20, 1.0);
        ShiftRotation initial = new ShiftRotation(0.1, ARCSEC, ARCSEC);

        ShiftRotationFit fit = refiner.fitShiftRotation(reference, reference, initial, PIVOT, 5 * ARCSEC, 50);

        assertThat(fit.getFit().getStatus()).isEqualTo(FitResult.Status.INSUFFICIENT_DATA);
        assertThat(fit.getSolution()).isSameAs(initial);
        assertThat(fit.isConverged()).isFalse();
    }
}
