package com.edge.astrometry.core.match;

import com.edge.astrometry.core.SyntheticSky;
import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.model.SkyPoint;
import com.edge.astrometry.core.transform.CatalogRotator;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OffsetVotingMatcherTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;

    private final OffsetVotingMatcher matcher = new OffsetVotingMatcher();

    @Test
    void recoversCommonOffset() {
        Catalog reference = SyntheticSky.field(new Random(1), 400, 150, 45, 1.0);
        double dRa = 4 * ARCSEC;
        double dDec = -3 * ARCSEC;
        Catalog source = CatalogRotator.rotateShift(reference, new SkyPoint(150, 45), 0, -dRa, -dDec);

        OffsetVote vote = matcher.countMatches(source, reference, 1 * CatalogColumns.ARCMIN, 2 * ARCSEC);

        // 得票最多的偏移在投票半径内必须包含全部真实星对
        assertThat(vote.isFound()).isTrue();
        assertThat(vote.getVotes()).isGreaterThanOrEqualTo(400);
        assertThat(vote.getFineVotes()).isBetween(1, vote.getVotes());
        assertThat(vote.getDRa()).isCloseTo(dRa, within(3 * ARCSEC));
        assertThat(vote.getDDec()).isCloseTo(dDec, within(2 * ARCSEC));
        assertThat(vote.getCandidateCount()).isGreaterThanOrEqualTo(400);
    }

    @Test
    void emptyCatalogHasNoCandidates() {
        Catalog reference = SyntheticSky.field(new Random(2), 10, 150, 20, 1.0);

        assertThat(matcher.countMatches(Catalog.empty(2), reference, 0.1, 0.001).getStatus())
            .isEqualTo(OffsetVote.Status.NO_CANDIDATES);
        assertThat(matcher.countMatches(reference, Catalog.empty(2), 0.1, 0.001).isFound()).isFalse();
    }

    @Test
    void disjointFieldsHaveNoCandidates() {
        Catalog source = SyntheticSky.field(new Random(3), 50, 150, 20, 0.5);
        Catalog reference = SyntheticSky.field(new Random(4), 50, 170, 20, 0.5);

        OffsetVote vote = matcher.countMatches(source, reference, 5 * CatalogColumns.ARCMIN, 5 * ARCSEC);

        assertThat(vote.isFound()).isFalse();
        assertThat(vote.getVotes()).isZero();
    }
}
