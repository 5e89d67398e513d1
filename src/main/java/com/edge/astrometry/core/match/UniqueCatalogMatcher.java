package com.edge.astrometry.core.match;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.index.KdTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 唯一最近邻交叉匹配
 * <p>
 * 对每颗源星查询半径内的参考星，候选数在 [1, maxMultiplicity] 内才接受，
 * 接受时取第一个候选（索引最小）。maxMultiplicity = 1 时只保留无歧义的匹配。
 * <p>
 * {@link #matchCatalogs} 丢弃未匹配行；{@link #matchWithSentinels} 保留行数，
 * 未匹配行的参考列填 NaN。
 */
@Component
public class UniqueCatalogMatcher {
    private static final Logger logger = LoggerFactory.getLogger(UniqueCatalogMatcher.class);

    /**
     * 探索性两两匹配：只返回被接受的行
     */
    public MatchedCatalog matchCatalogs(Catalog source, Catalog reference, double radius, int maxMultiplicity) {
        return match(source, reference, radius, maxMultiplicity, false);
    }

    /**
     * 行对齐匹配：每个源行都有输出，未匹配时参考列为 NaN
     */
    public MatchedCatalog matchWithSentinels(Catalog source, Catalog reference, double radius, int maxMultiplicity) {
        return match(source, reference, radius, maxMultiplicity, true);
    }

    private MatchedCatalog match(Catalog source, Catalog reference, double radius, int maxMultiplicity,
                                 boolean keepUnmatched) {
        if (maxMultiplicity < 1) {
            throw new IllegalArgumentException("maxMultiplicity must be >= 1, got " + maxMultiplicity);
        }
        int sourceWidth = source.width();
        int referenceWidth = reference.width();
        int width = sourceWidth + referenceWidth;

        if (source.isEmpty()) {
            return MatchedCatalog.empty(sourceWidth, referenceWidth);
        }

        List<int[]> candidates;
        if (reference.isEmpty()) {
            candidates = null;
        } else {
            double cosDec = DeclinationScale.factorFor(source, reference);
            KdTree sourceTree = KdTree.build(DeclinationScale.scaledRa(source, cosDec), source.column(1));
            KdTree referenceTree = KdTree.build(DeclinationScale.scaledRa(reference, cosDec), reference.column(1));
            candidates = sourceTree.pointsWithinRadius(referenceTree, radius);
        }

        double[][] rows = new double[source.size()][];
        int kept = 0;
        int ambiguous = 0;
        for (int i = 0; i < source.size(); i++) {
            int count = candidates == null ? 0 : candidates.get(i).length;
            boolean accepted = count >= 1 && count <= maxMultiplicity;
            if (count > maxMultiplicity) {
                ambiguous++;
            }
            if (!accepted && !keepUnmatched) {
                continue;
            }
            double[] row = new double[width];
            System.arraycopy(source.row(i), 0, row, 0, sourceWidth);
            if (accepted) {
                System.arraycopy(reference.row(candidates.get(i)[0]), 0, row, sourceWidth, referenceWidth);
            } else {
                Arrays.fill(row, sourceWidth, width, Double.NaN);
            }
            rows[kept++] = row;
        }

        MatchedCatalog result = new MatchedCatalog(Catalog.of(Arrays.copyOf(rows, kept), width),
            sourceWidth, referenceWidth);
        logger.debug("交叉匹配: 半径 {}\", {} 个源 -> {} 个匹配 ({} 个多重候选被拒绝)",
            String.format("%.2f", radius * 3600), source.size(), result.matchedCount(), ambiguous);
        return result;
    }
}
