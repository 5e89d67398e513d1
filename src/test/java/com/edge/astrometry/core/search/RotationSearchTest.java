package com.edge.astrometry.core.search;

import com.edge.astrometry.core.SyntheticSky;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.match.OffsetVote;
import com.edge.astrometry.core.match.OffsetVotingMatcher;
import com.edge.astrometry.core.match.UniqueCatalogMatcher;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.parallel.WorkerPool;
import com.edge.astrometry.core.refine.LevenbergMarquardtSolver;
import com.edge.astrometry.core.refine.NonlinearRefiner;
import com.edge.astrometry.core.refine.ShiftRotationFit;
import com.edge.astrometry.core.transform.CatalogRotator;
import com.edge.astrometry.core.transform.ShiftRotation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RotationSearchTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;
    private static final ShiftRotation TRUTH = new ShiftRotation(1.5, 3 * ARCSEC, -2 * ARCSEC);

    private final OffsetVotingMatcher matcher = new OffsetVotingMatcher();

    /**
     * 500 颗共同星 + 各 50 颗互不相关的星
     */
    private static Catalog[] scene(double dec, long seed) {
        Random random = new Random(seed);
        SkyPoint pivot = new SkyPoint(150, dec);
        Catalog common = SyntheticSky.field(random, 500, 150, dec, 1.0);
        Catalog reference = common.append(SyntheticSky.field(random, 50, 150, dec, 1.0));
        Catalog source = CatalogRotator.invert(common, pivot, TRUTH)
            .append(SyntheticSky.field(random, 50, 150, dec, 1.0));
        return new Catalog[]{source, reference};
    }

    private RotationGuess search(Catalog[] scene, double dec, WorkerPool pool) {
        RotationSearch search = new RotationSearch(matcher, pool);
        return search.findBestGuess(scene[0], scene[1], new SkyPoint(150, dec), 1 * CatalogColumns.ARCMIN,
            AngleRange.symmetric(3), 6 * CatalogColumns.ARCMIN, 5 * ARCSEC);
    }

    @Test
    void findsRotationAndOffset() {
        RotationGuess guess = search(scene(20, 42), 20, new WorkerPool(4, true, "rotation-test"));

        assertThat(guess.isFound()).isTrue();
        assertThat(guess.getAngleDeg()).isBetween(1.45, 1.55);
        assertThat(guess.getVotes()).isGreaterThanOrEqualTo(450);
        assertThat(guess.getContrast()).isGreaterThanOrEqualTo(10);
        // 投票半径内的偏移都得到相同的票数，精度以投票半径为限
        assertThat(SyntheticSky.arcsec(guess.getDRa() - TRUTH.getDRa())).isCloseTo(0, within(5.5));
        assertThat(SyntheticSky.arcsec(guess.getDDec() - TRUTH.getDDec())).isCloseTo(0, within(5.5));
        assertThat(guess.getAngleVotes()).hasSize(61);
        assertThat(guess.getPointingError()).isEqualTo(1 * CatalogColumns.ARCMIN);
    }

    @Test
    void refinedGuessRecoversShift() {
        Catalog[] scene = scene(20, 42);
        RotationGuess guess = search(scene, 20, WorkerPool.serial("rotation-refine"));
        NonlinearRefiner refiner = new NonlinearRefiner(new UniqueCatalogMatcher(), new LevenbergMarquardtSolver());

        ShiftRotationFit fit = refiner.fitShiftRotation(scene[0], scene[1], guess.toShiftRotation(),
            new SkyPoint(150, 20), 10 * ARCSEC, 4);

        assertThat(fit.isConverged()).isTrue();
        assertThat(fit.getSolution().getAngleDeg()).isCloseTo(1.5, within(0.01));
        assertThat(fit.getSolution().getDRaArcsec()).isCloseTo(3, within(0.3));
        assertThat(fit.getSolution().getDDecArcsec()).isCloseTo(-2, within(0.3));
    }

    @Test
    void parallelAndSerialSearchAgree() {
        Catalog[] scene = scene(20, 43);
        WorkerPool parallel = new WorkerPool(4, true, "rotation-parallel");

        RotationGuess fromParallel = search(scene, 20, parallel);
        RotationGuess fromSerial = search(scene, 20, parallel.asSerial());

        assertThat(fromParallel.getAngleDeg()).isEqualTo(fromSerial.getAngleDeg());
        assertThat(fromParallel.getVotes()).isEqualTo(fromSerial.getVotes());
        assertThat(fromParallel.getDRa()).isEqualTo(fromSerial.getDRa());
        assertThat(fromParallel.getDDec()).isEqualTo(fromSerial.getDDec());
        assertThat(fromParallel.getContrast()).isEqualTo(fromSerial.getContrast());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, 45, 80})
    void sameSolutionAtEveryDeclination(double dec) {
        Catalog[] scene = scene(dec, 44);
        RotationGuess guess = search(scene, dec, WorkerPool.serial("rotation-dec"));

        assertThat(guess.getAngleDeg()).isBetween(1.45, 1.55);
        assertThat(guess.getContrast()).isGreaterThanOrEqualTo(10);

        ShiftRotationFit fit = new NonlinearRefiner(new UniqueCatalogMatcher(), new LevenbergMarquardtSolver())
            .fitShiftRotation(scene[0], scene[1], guess.toShiftRotation(), new SkyPoint(150, dec), 10 * ARCSEC, 4);
        double cosDec = Math.cos(Math.toRadians(dec));

        assertThat(fit.isConverged()).isTrue();
        assertThat(fit.getSolution().getAngleDeg()).isCloseTo(1.5, within(0.01));
        // RA 偏移按 cos(dec) 换算成天球上的角距离后比较
        assertThat((fit.getSolution().getDRaArcsec() - TRUTH.getDRaArcsec()) * cosDec).isCloseTo(0, within(0.3));
        assertThat(fit.getSolution().getDDecArcsec()).isCloseTo(TRUTH.getDDecArcsec(), within(0.3));
    }

    @Test
    void noRotationSearchesOnlyZero() {
        Catalog[] scene = scene(20, 45);

        RotationGuess guess = new RotationSearch(matcher, WorkerPool.serial("none")).findBestGuess(
            scene[0], scene[1], new SkyPoint(150, 20), 1 * CatalogColumns.ARCMIN, AngleRange.none(),
            6 * CatalogColumns.ARCMIN, 5 * ARCSEC);

        assertThat(guess.getAngleVotes()).hasSize(1);
        assertThat(guess.getAngleDeg()).isZero();
        // 没有其他角度时背景取 1
        assertThat(guess.getBackgroundMatches()).isEqualTo(1.0);
        assertThat(guess.getContrast()).isEqualTo(guess.getVotes() - 1.0);
    }

    @Test
    void contrastUsesMedianOfOffPeakAngles() {
        List<AngleVote> votes = Arrays.asList(
            vote(0, -1.0, 5), vote(1, -0.5, 6), vote(2, 0.0, 50),
            vote(3, 0.2, 40), vote(4, 0.5, 4), vote(5, 1.0, 6));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.getAngleDeg()).isZero();
        assertThat(guess.getBackgroundMatches()).isEqualTo(5.5);
        assertThat(guess.getContrast()).isCloseTo((50 - 5.5) / Math.sqrt(5.5), within(1e-12));
    }

    @Test
    void evenPlateauTakesLowerMiddle() {
        List<AngleVote> votes = Arrays.asList(vote(0, -1.0, 9), vote(1, 0.0, 30), vote(2, 1.0, 30));

        assertThat(RotationSearch.summarize(votes, 0.05).getAngleDeg()).isZero();
    }

    @Test
    void equalVotePlateauResolvesToItsMiddle() {
        List<AngleVote> votes = Arrays.asList(
            vote(0, 1.3, 295), vote(1, 1.4, 502), vote(2, 1.5, 502), vote(3, 1.6, 502), vote(4, 1.7, 295));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.getAngleDeg()).isEqualTo(1.5);
        assertThat(guess.getVotes()).isEqualTo(502);
    }

    @Test
    void firstPlateauWinsAndArrivalOrderDoesNotMatter() {
        List<AngleVote> votes = Arrays.asList(
            vote(5, 2.5, 40), vote(4, 2.0, 3), vote(0, 0.0, 40), vote(3, 1.5, 3), vote(1, 0.5, 40), vote(2, 1.0, 40));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.getAngleDeg()).isEqualTo(0.5);
        assertThat(guess.getAngleVotes()).extracting(AngleVote::getIndex).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void emptyBackgroundUsesBestVotesAsContrast() {
        List<AngleVote> votes = Arrays.asList(
            new AngleVote(0, -1.0, OffsetVote.noCandidates()), vote(1, 0.0, 12),
            new AngleVote(2, 1.0, OffsetVote.noCandidates()));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.getBackgroundMatches()).isZero();
        assertThat(guess.getContrast()).isEqualTo(12.0);
    }

    @Test
    void noCandidatesAtAnyAngle() {
        List<AngleVote> votes = Arrays.asList(
            new AngleVote(0, -1.0, OffsetVote.noCandidates()), new AngleVote(1, 1.0, OffsetVote.noCandidates()));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.isFound()).isFalse();
        assertThat(guess.getContrast()).isZero();
        assertThat(guess.toShiftRotation()).isSameAs(ShiftRotation.IDENTITY);
    }

    @Test
    void fineCoincidencesBreakEqualVotes() {
        List<AngleVote> votes = Arrays.asList(
            new AngleVote(0, 1.4, OffsetVote.found(502, 200, 0, 0, 502)),
            new AngleVote(1, 1.5, OffsetVote.found(502, 500, 0, 0, 502)),
            new AngleVote(2, 1.6, OffsetVote.found(501, 501, 0, 0, 501)),
            new AngleVote(3, 1.7, OffsetVote.found(300, 300, 0, 0, 300)));

        RotationGuess guess = RotationSearch.summarize(votes, 0.05);

        assertThat(guess.getAngleDeg()).isEqualTo(1.5);
        assertThat(guess.getVotes()).isEqualTo(502);
    }

    private static AngleVote vote(int index, double angle, int count) {
        return new AngleVote(index, angle, OffsetVote.found(count, 0, 0, count));
    }
}
