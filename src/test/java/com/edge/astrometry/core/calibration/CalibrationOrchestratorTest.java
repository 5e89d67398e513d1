package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.SyntheticSky;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.catalog.CatalogPreprocessor;
import com.edge.astrometry.core.catalog.ReferenceCatalogSelector;
import com.edge.astrometry.core.match.OffsetVotingMatcher;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.quality.QualityEvaluator;
import com.edge.astrometry.core.quality.QualityMetric;
import com.edge.astrometry.core.refine.LeastSquaresSolver;
import com.edge.astrometry.core.refine.LevenbergMarquardtSolver;
import com.edge.astrometry.core.refine.NonlinearRefiner;
import com.edge.astrometry.core.refine.RegionalRefiner;
import com.edge.astrometry.core.refine.TileFitOutcome;
import com.edge.astrometry.core.search.RotationSearch;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.tile.TileLayoutFixtures;
import com.edge.astrometry.core.transform.CatalogRotator;
import com.edge.astrometry.core.transform.ShiftRotation;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CalibrationOrchestratorTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;
    private static final SkyPoint PIVOT = new SkyPoint(150, 20);

    private static CalibrationOrchestrator orchestrator(ReferenceCatalogProvider provider) {
        UniqueCatalogMatcher unique = new UniqueCatalogMatcher();
        LeastSquaresSolver solver = new LevenbergMarquardtSolver();
        WorkerPool pool = new WorkerPool(2, true, "calibration-test");
        CatalogPreprocessor preprocessor = new CatalogPreprocessor();
        return new CalibrationOrchestrator(preprocessor, new ReferenceCatalogSelector(preprocessor),
            new RotationSearch(new OffsetVotingMatcher(), pool), new NonlinearRefiner(unique, solver),
            new RegionalRefiner(unique, solver, pool), unique, new QualityEvaluator(), provider);
    }

    @Test
    void recoversGlobalRotationAndPerTileOffsets() {
        ShiftRotation truth = new ShiftRotation(0.8, 6 * ARCSEC, -4 * ARCSEC);
        TileLayout nominal = TileLayoutFixtures.row(150, 20, 3);
        TileLayout actual = nominal.applyGlobal(truth, PIVOT);
        actual = actual.withWcs(2, actual.get(2).getWcs().withShift(0.6 * ARCSEC, -0.4 * ARCSEC));
        Catalog sources = TileLayoutFixtures.sources(new Random(61), nominal, 120);
        Catalog reference = TileLayoutFixtures.truthReference(sources, actual);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, nominal, PIVOT, CalibrationMode.OTASHEAR, new CalibrationSettings()));

        assertThat(result.isValidSolution()).isTrue();
        assertThat(result.getFinalStage()).isEqualTo(CalibrationStage.DONE);
        assertThat(result.getCorrection().getAngleDeg()).isCloseTo(0.8, within(0.01));
        assertThat(result.getCorrection().getDRaArcsec()).isCloseTo(6, within(0.5));
        assertThat(result.getCorrection().getDDecArcsec()).isCloseTo(-4, within(0.5));
        assertThat(result.getContrast()).isGreaterThanOrEqualTo(3);
        assertThat(result.getPointingError()).isEqualTo(3 * CatalogColumns.ARCMIN);

        assertThat(result.getStages()).extracting(StageRecord::getStage).containsExactly(
            CalibrationStage.ROTATION_SEARCH, CalibrationStage.ROTATION_SEARCH,
            CalibrationStage.PER_TILE_SHIFT, CalibrationStage.PER_TILE_SHEAR);
        assertThat(result.getTileOutcomes()).containsOnlyKeys(1, 2, 3);
        assertThat(result.getTileOutcomes().values())
            .allMatch(outcome -> outcome.getStatus() == TileFitOutcome.Status.FITTED);

        assertThat(result.getQuality().getStarCount()).isGreaterThanOrEqualTo(sources.size() - 20);
        assertThat(result.getQuality().get(QualityMetric.RMS)).isLessThan(0.05);
        assertThat(result.getTileQuality()).containsOnlyKeys(1, 2, 3);
        assertThat(result.getCalibrated().size()).isEqualTo(sources.size());
        assertThat(result.getMatched().size()).isEqualTo(sources.size());
    }

    @Test
    void serialRunGivesSameCorrection() {
        ShiftRotation truth = new ShiftRotation(-1.1, -3 * ARCSEC, 5 * ARCSEC);
        TileLayout nominal = TileLayoutFixtures.row(150, 20, 2);
        Catalog sources = TileLayoutFixtures.sources(new Random(62), nominal, 150);
        Catalog reference = TileLayoutFixtures.truthReference(sources, nominal.applyGlobal(truth, PIVOT));
        CalibrationSettings serial = new CalibrationSettings();
        serial.setParallel(false);

        CalibrationResult parallelResult = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, nominal, PIVOT, CalibrationMode.ROTATION, new CalibrationSettings()));
        CalibrationResult serialResult = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, nominal, PIVOT, CalibrationMode.ROTATION, serial));

        assertThat(serialResult.isValidSolution()).isTrue();
        assertThat(serialResult.getCorrection().toArray()).containsExactly(parallelResult.getCorrection().toArray());
        assertThat(serialResult.getTileOutcomes()).isEmpty();
    }

    @Test
    void shiftModeAppliesOffsetOnly() {
        Random random = new Random(63);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 0.5);
        Catalog sources = SyntheticSky.sourceRows(
            CatalogRotator.rotateShift(reference, PIVOT, 0, -8 * ARCSEC, 3 * ARCSEC), 0);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, null, PIVOT, CalibrationMode.SHIFT, null));

        assertThat(result.isValidSolution()).isTrue();
        assertThat(result.getCorrection().getAngleDeg()).isZero();
        assertThat(result.getCorrection().getDRaArcsec()).isCloseTo(8, within(5.5));
        assertThat(result.getCorrection().getDDecArcsec()).isCloseTo(-3, within(5.5));
        assertThat(result.getStages()).extracting(StageRecord::getStage)
            .containsExactly(CalibrationStage.SHIFT_ONLY);
        assertThat(result.getPointingError()).isEqualTo(7 * CatalogColumns.ARCMIN);
    }

    @Test
    void shiftModeIgnoresContrastThreshold() {
        Random random = new Random(66);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 0.5);
        Catalog sources = SyntheticSky.sourceRows(
            CatalogRotator.rotateShift(reference, PIVOT, 0, 4 * ARCSEC, -6 * ARCSEC), 0);
        CalibrationSettings strict = new CalibrationSettings();
        strict.setMinContrast(1e9);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, null, PIVOT, CalibrationMode.SHIFT, strict));

        assertThat(result.isValidSolution()).isTrue();
        assertThat(result.getContrast()).isLessThan(1e9);
        assertThat(result.getCorrection().getAngleDeg()).isZero();
        assertThat(result.getCorrection().getDRaArcsec()).isCloseTo(-4, within(5.5));
        assertThat(result.getCorrection().getDDecArcsec()).isCloseTo(6, within(5.5));
        assertThat(result.getStages()).extracting(StageRecord::getStage)
            .containsExactly(CalibrationStage.SHIFT_ONLY);
    }

    @Test
    void disjointCatalogsReportNoOverlap() {
        Random random = new Random(64);
        Catalog sources = SyntheticSky.sourceRows(SyntheticSky.field(random, 100, 150, 20, 0.5), 0);
        Catalog reference = SyntheticSky.field(random, 100, 170, 20, 0.5);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, null, null, CalibrationMode.ROTATION, null));

        assertThat(result.isValidSolution()).isFalse();
        assertThat(result.getFinalStage()).isEqualTo(CalibrationStage.FAILED);
        assertThat(result.getReason()).contains("No overlap");
        assertThat(result.getQuality().isValid()).isFalse();
    }

    @Test
    void unrelatedFieldsFailOnContrast() {
        Random random = new Random(65);
        Catalog sources = SyntheticSky.sourceRows(SyntheticSky.field(random, 300, 150, 20, 0.5), 0);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 0.5);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            sources, reference, null, PIVOT, CalibrationMode.ROTATION, null));

        assertThat(result.isValidSolution()).isFalse();
        assertThat(result.getReason()).contains("contrast");
        assertThat(result.getGuess()).isNotNull();
        assertThat(result.getContrast()).isLessThan(3);
    }

    @Test
    void emptySourceIsInvalidNotAnError() {
        Catalog empty = Catalog.empty(CatalogColumns.SOURCE_WIDTH);

        CalibrationResult result = orchestrator(null).calibrate(new CalibrationInput(
            empty, Catalog.empty(2), null, null, null, null));

        assertThat(result.isValidSolution()).isFalse();
        assertThat(result.getMode()).isEqualTo(CalibrationMode.OTASHEAR);
    }

    @Test
    void fetchesReferenceFromProviderAroundPivot() {
        Random random = new Random(66);
        Catalog reference = SyntheticSky.field(random, 300, 150, 20, 0.5);
        Catalog sources = SyntheticSky.sourceRows(reference, 0);
        AtomicReference<double[]> request = new AtomicReference<>();
        ReferenceCatalogProvider provider = (ra, dec, radius) -> {
            request.set(new double[]{ra, dec, radius});
            return reference;
        };

        CalibrationResult result = orchestrator(provider).calibrate(new CalibrationInput(
            sources, null, null, PIVOT, CalibrationMode.ROTATION, null));

        assertThat(result.isValidSolution()).isTrue();
        assertThat(request.get()[0]).isEqualTo(150.0);
        assertThat(request.get()[2]).isCloseTo(0.8 + 7 * CatalogColumns.ARCMIN, within(1e-12));
    }

    @Test
    void missingReferenceWithoutProviderIsCallerError() {
        Catalog sources = SyntheticSky.sourceRows(SyntheticSky.field(new Random(67), 10, 150, 20, 0.5), 0);

        assertThatThrownBy(() -> orchestrator(null).calibrate(new CalibrationInput(
            sources, null, null, null, CalibrationMode.ROTATION, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
