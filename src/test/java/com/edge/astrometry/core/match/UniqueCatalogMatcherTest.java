package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.catalog.CatalogColumns;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UniqueCatalogMatcherTest {

    private static final double ARCSEC = CatalogColumns.ARCSEC;

    private final UniqueCatalogMatcher matcher = new UniqueCatalogMatcher();

    @Test
    void dropFormKeepsOnlyUnambiguousMatches() {
        Catalog source = Catalog.of(new double[][]{
            {10, 0, 1},
            {11, 0, 2},
            {12, 0, 3},
        }, 3);
        Catalog reference = Catalog.of(new double[][]{
            {10 + 0.5 * ARCSEC, 0, 100},
            {11 - ARCSEC, 0, 200},
            {11 + ARCSEC, 0, 201},
        }, 3);

        MatchedCatalog matched = matcher.matchCatalogs(source, reference, 2 * ARCSEC, 1);

        assertThat(matched.size()).isEqualTo(1);
        assertThat(matched.getSourceWidth()).isEqualTo(3);
        assertThat(matched.getReferenceWidth()).isEqualTo(3);
        assertThat(matched.sourceValue(0, 2)).isEqualTo(1);
        assertThat(matched.referenceValue(0, 2)).isEqualTo(100);
    }

    @Test
    void sentinelFormPreservesRowOrder() {
        Catalog source = Catalog.ofCoordinates(new double[]{10, 11, 12}, new double[]{0, 0, 0});
        Catalog reference = Catalog.ofCoordinates(
            new double[]{12, 11 - ARCSEC, 11 + ARCSEC}, new double[]{0, 0, 0});

        MatchedCatalog matched = matcher.matchWithSentinels(source, reference, 2 * ARCSEC, 1);

        assertThat(matched.size()).isEqualTo(3);
        assertThat(matched.isMatched(0)).isFalse();
        assertThat(Double.isNaN(matched.referenceRa(0))).isTrue();
        // 等距的两个候选：歧义，拒绝
        assertThat(matched.isMatched(1)).isFalse();
        assertThat(matched.isMatched(2)).isTrue();
        assertThat(matched.referenceRa(2)).isEqualTo(12.0);
        assertThat(matched.matchedCount()).isEqualTo(1);
        assertThat(matched.matchedOnly().size()).isEqualTo(1);
        assertThat(matched.sourcePart().column(0)).containsExactly(10, 11, 12);
    }

    @Test
    void higherMultiplicityTakesFirstCandidate() {
        Catalog source = Catalog.ofCoordinates(new double[]{11}, new double[]{0});
        Catalog reference = Catalog.ofCoordinates(new double[]{11 + ARCSEC, 11 - ARCSEC}, new double[]{0, 0});

        MatchedCatalog matched = matcher.matchCatalogs(source, reference, 2 * ARCSEC, 2);

        assertThat(matched.size()).isEqualTo(1);
        assertThat(matched.referenceRa(0)).isEqualTo(11 + ARCSEC);
    }

    @Test
    void emptyReferenceGivesAllSentinels() {
        Catalog source = Catalog.ofCoordinates(new double[]{1, 2}, new double[]{0, 0});

        MatchedCatalog sentinels = matcher.matchWithSentinels(source, Catalog.empty(2), ARCSEC, 1);
        MatchedCatalog dropped = matcher.matchCatalogs(source, Catalog.empty(2), ARCSEC, 1);

        assertThat(sentinels.size()).isEqualTo(2);
        assertThat(sentinels.matchedCount()).isZero();
        assertThat(dropped.isEmpty()).isTrue();
    }

    @Test
    void rejectsNonPositiveMultiplicity() {
        Catalog source = Catalog.ofCoordinates(new double[]{1}, new double[]{0});

        assertThatThrownBy(() -> matcher.matchCatalogs(source, source, ARCSEC, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
