package com.edge.astrometry.core.catalog;

import com.edge.astrometry.core.index.KdTree;
import com.edge.astrometry.core.match.DeclinationScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * 源星表预处理
 * <p>
 * 按固定顺序筛选（顺序影响结果的可复现性）：
 * 1. 去掉 flags 非零的行
 * 2. 去掉视宽度过小或星等误差过大的行（噪声冒充点源）
 * 3. 去掉孤立半径内有邻居的行；如果因此清空，回退到未筛选星表
 * 4. 超过 N 行时只保留最亮的 N 行，按星等升序排列
 */
@Component
public class CatalogPreprocessor {
    private static final Logger logger = LoggerFactory.getLogger(CatalogPreprocessor.class);

    /**
     * @param raw             原始源星表（列布局见 {@link CatalogColumns}）
     * @param minFwhm         最小视宽度（度）
     * @param maxMagError     最大星等误差
     * @param isolationRadius 孤立半径（度）
     * @param maxSources      亮星上限 N
     */
    public PreparedCatalog prepare(Catalog raw, double minFwhm, double maxMagError,
                                   double isolationRadius, int maxSources) {
        raw.requireWidth(CatalogColumns.SOURCE_WIDTH, "Source");

        Catalog unflagged = raw.filter(i -> raw.get(i, CatalogColumns.FLAGS) == 0);

        Catalog likelyStars = unflagged.filter(i ->
            unflagged.get(i, CatalogColumns.FWHM) > minFwhm
                && unflagged.get(i, CatalogColumns.MAG_ERR) < maxMagError);
        logger.debug("源星表: {} -> {} (无标记) -> {} (点源质量)", raw.size(), unflagged.size(), likelyStars.size());

        Catalog isolated = pickIsolated(likelyStars, isolationRadius);
        int isolatedCount = isolated.size();
        boolean fallback = false;
        if (isolated.isEmpty()) {
            logger.warn("孤立星筛选后没有剩余源 (半径 {}\")，改用未筛选星表",
                String.format("%.1f", isolationRadius * 3600));
            isolated = likelyStars;
            fallback = true;
        }

        Catalog result = isolated;
        if (isolated.size() > maxSources) {
            logger.debug("截断源星表: {} -> {} 颗最亮的星", isolated.size(), maxSources);
            result = selectBrightest(isolated, CatalogColumns.MAG, maxSources);
        }

        PreparedCatalog prepared = new PreparedCatalog(result, raw.size(), unflagged.size(),
            likelyStars.size(), isolatedCount, fallback);
        logger.info("源星表预处理完成: {}", prepared);
        return prepared;
    }

    /**
     * 孤立星筛选：自连接中邻居数 > 1（每个点都匹配到自己）的行被去掉
     */
    public Catalog pickIsolated(Catalog catalog, double radius) {
        if (catalog.isEmpty()) {
            return catalog;
        }
        double cosDec = DeclinationScale.factorFor(catalog.maxAbsY());
        KdTree tree = KdTree.build(DeclinationScale.scaledRa(catalog, cosDec), catalog.column(1));
        int[] neighbors = tree.neighborCounts(tree, radius);
        return catalog.filter(i -> neighbors[i] <= 1);
    }

    /**
     * 按星等升序保留最亮的 n 行（星等相同时保持原顺序）
     */
    public Catalog selectBrightest(Catalog catalog, int magColumn, int n) {
        int[] order = IntStream.range(0, catalog.size())
            .boxed()
            .sorted(Comparator.comparingDouble(i -> catalog.get(i, magColumn)))
            .mapToInt(Integer::intValue)
            .toArray();
        return catalog.select(Arrays.copyOf(order, Math.min(n, order.length)));
    }
}
